package io.lingualearn.core.capability;

import io.lingualearn.core.catalog.AgentDescriptor;
import io.lingualearn.core.catalog.LanguagePair;
import io.lingualearn.core.concurrent.CancellationSignal;
import io.lingualearn.core.error.LinguaLearnException;
import io.lingualearn.core.execution.ExecutionEngine;
import io.lingualearn.core.execution.ExecutionResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts one catalog agent to the capability interfaces. The input is handed over as the
 * {@code {{input}}} placeholder (a file path) and the agent's output artifact is read back as text.
 */
public final class ProcessAgentCapability implements Translator, TextExtractor, SpeechTranscriber, Summarizer {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessAgentCapability.class);
    public static final String INPUT_PLACEHOLDER = "input";
    static final String OUTPUT_STEM = "output";

    private final AgentDescriptor agent;
    private final ExecutionEngine engine;

    public ProcessAgentCapability(AgentDescriptor agent, ExecutionEngine engine) {
        this.agent = Objects.requireNonNull(agent, "agent must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public AgentDescriptor agent() {
        return agent;
    }

    @Override
    public String translate(String text, LanguagePair languages) {
        LanguagePair pair = languages == null ? LanguagePair.unspecified() : languages;
        Map<String, String> extra = new LinkedHashMap<>(pair.placeholderValues());
        extra.putAll(pair.environment());
        return runOnText(text, extra);
    }

    @Override
    public String summarize(String text) {
        return runOnText(text, Map.of());
    }

    @Override
    public String extractText(Path image) {
        return runOnFile(image, Map.of());
    }

    @Override
    public String transcribe(Path audio) {
        return runOnFile(audio, Map.of());
    }

    private String runOnText(String text, Map<String, String> extra) {
        Path input;
        try {
            input = Files.createTempFile("lingualearn-input-", ".txt");
            Files.writeString(input, text == null ? "" : text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LinguaLearnException("Failed to stage input for " + agent.name(), e);
        }
        try {
            return runOnFile(input, extra);
        } finally {
            try {
                Files.deleteIfExists(input);
            } catch (IOException e) {
                LOG.warn("Failed to delete staged input {}: {}", input, e.getMessage());
            }
        }
    }

    private String runOnFile(Path input, Map<String, String> extra) {
        Objects.requireNonNull(input, "input must not be null");
        if (!Files.isRegularFile(input)) {
            throw new LinguaLearnException("Input file not found: " + input);
        }
        Map<String, String> env = new LinkedHashMap<>(extra);
        env.put(INPUT_PLACEHOLDER, input.toAbsolutePath().toString());

        ExecutionResult result;
        try {
            result = engine.executeAgentAsync(agent, env, CancellationSignal.none()).join().orThrow();
        } catch (CompletionException e) {
            throw new LinguaLearnException("Agent " + agent.name() + " could not be run", e.getCause());
        }
        return readOutput(result.artifacts());
    }

    private String readOutput(List<Path> artifacts) {
        Path output = null;
        if (artifacts.size() == 1) {
            output = artifacts.get(0);
        } else {
            for (Path artifact : artifacts) {
                if (artifact.getFileName().toString().startsWith(OUTPUT_STEM + ".")) {
                    output = artifact;
                    break;
                }
            }
        }
        if (output == null) {
            throw new LinguaLearnException("Agent " + agent.name() + " produced " + artifacts.size()
                + " artifact(s); expected one, or one named '" + OUTPUT_STEM + "'");
        }
        try {
            return Files.readString(output, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new LinguaLearnException("Failed to read output of " + agent.name() + ": " + output, e);
        }
    }
}
