package io.lingualearn.cli;

import io.lingualearn.core.capability.CapabilityRegistry;
import io.lingualearn.core.capability.SpeechTranscriber;
import io.lingualearn.core.capability.Summarizer;
import io.lingualearn.core.capability.TextExtractor;
import io.lingualearn.core.capability.Translator;
import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import io.lingualearn.core.execution.ExecutionListener;
import io.lingualearn.core.orchestrator.Orchestrator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "capability", description = "Run the agent bound to a capability in the config")
public final class CapabilityCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1",
        description = "translator, summarizer, textExtractor or speechTranscriber")
    String capability;

    @ArgGroup(exclusive = true, multiplicity = "1")
    Input input;

    static final class Input {
        @Option(names = "--text", description = "Text to hand to the agent")
        String text;

        @Option(names = "--file", description = "File to hand to the agent")
        Path file;
    }

    public CapabilityCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LinguaLearnConfig config = context.loadValidated();
            try (Orchestrator orchestrator = context.openOrchestrator(config, ExecutionListener.NOOP)) {
                Catalog catalog = orchestrator.loadCatalog(context.configService().languages(config));
                CapabilityRegistry registry = orchestrator.capabilities(catalog, config.capabilities());
                String output = switch (capability) {
                    case "translator" -> registry.require(Translator.class)
                        .translate(text(), context.configService().languages(config));
                    case "summarizer" -> registry.require(Summarizer.class).summarize(text());
                    case "textExtractor" -> registry.require(TextExtractor.class).extractText(file());
                    case "speechTranscriber" -> registry.require(SpeechTranscriber.class).transcribe(file());
                    default -> throw new IllegalArgumentException("Unknown capability '" + capability + "'");
                };
                System.out.println(output);
                return 0;
            }
        } catch (Exception e) {
            System.err.println("Capability failed: " + e.getMessage());
            return 1;
        }
    }

    private String text() throws IOException {
        return input.text != null ? input.text : Files.readString(input.file, StandardCharsets.UTF_8);
    }

    private Path file() {
        if (input.file == null) {
            throw new IllegalArgumentException(capability + " needs --file");
        }
        return input.file;
    }
}
