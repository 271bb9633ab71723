package io.lingualearn.cli;

import io.lingualearn.core.config.ConfigValidator;
import io.lingualearn.core.config.ValidationReport;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LinguaLearnConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Catalog root: " + context.configService().catalogRoot(context.configPath(), config));
            System.out.println("Output root: " + context.configService().outputRoot(context.configPath(), config));
            System.out.println("Languages: " + describe(config));
            System.out.println("Embedding provider: " + config.embedding().provider()
                + " (" + config.embedding().model() + ")");
            System.out.println("Embedding API key configured: " + config.embedding().configured());
            System.out.println("Vector store: " + config.vectorStore().backend() + " at "
                + context.configService().vectorStorePath(context.configPath(), config));
            System.out.println("Capabilities: " + (config.capabilities().isEmpty() ? "(none bound)" : config.capabilities()));

            ValidationReport report = new ConfigValidator(context.configService()).validate(context.configPath(), config);
            report.warnings().forEach(warning -> System.out.println("Warning: " + warning));
            report.errors().forEach(error -> System.out.println("Error: " + error));
            System.out.println("Ready: " + report.ok());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String describe(LinguaLearnConfig config) {
        String target = config.catalog().targetLanguage();
        String source = config.catalog().sourceLanguage();
        return (source.isBlank() ? "?" : source) + " -> " + (target.isBlank() ? "?" : target);
    }
}
