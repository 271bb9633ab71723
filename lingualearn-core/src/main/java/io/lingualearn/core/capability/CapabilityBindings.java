package io.lingualearn.core.capability;

import io.lingualearn.core.catalog.AgentDescriptor;
import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.execution.ExecutionEngine;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link CapabilityRegistry} from configured {@code capability -> agent name} pairs.
 * Recognised capability keys: translator, textExtractor, speechTranscriber, summarizer.
 */
public final class CapabilityBindings {
    private static final Logger LOG = LoggerFactory.getLogger(CapabilityBindings.class);

    private CapabilityBindings() {
    }

    public static CapabilityRegistry bind(Catalog catalog, ExecutionEngine engine, Map<String, String> bindings) {
        CapabilityRegistry registry = new CapabilityRegistry();
        if (bindings == null) {
            return registry;
        }
        bindings.forEach((capability, agentName) -> {
            Optional<AgentDescriptor> agent = catalog.agent(agentName);
            if (agent.isEmpty()) {
                LOG.warn("Capability {} is bound to unknown agent '{}'", capability, agentName);
                return;
            }
            ProcessAgentCapability adapter = new ProcessAgentCapability(agent.get(), engine);
            switch (capability) {
                case "translator" -> registry.register(Translator.class, adapter);
                case "textExtractor" -> registry.register(TextExtractor.class, adapter);
                case "speechTranscriber" -> registry.register(SpeechTranscriber.class, adapter);
                case "summarizer" -> registry.register(Summarizer.class, adapter);
                default -> LOG.warn("Unknown capability '{}' in configuration", capability);
            }
        });
        return registry;
    }
}
