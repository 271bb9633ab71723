package io.lingualearn.cli;

import io.lingualearn.core.config.ConfigService;
import io.lingualearn.core.config.ConfigValidator;
import io.lingualearn.core.config.ValidationReport;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import io.lingualearn.core.execution.ExecutionListener;
import io.lingualearn.core.orchestrator.Orchestrator;
import io.lingualearn.core.orchestrator.OrchestratorFactory;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    OrchestratorFactory orchestratorFactory
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, new OrchestratorFactory(configService));
    }

    /**
     * Loads the config and refuses to continue while it has validation errors.
     */
    LinguaLearnConfig loadValidated() throws IOException {
        LinguaLearnConfig config = configService.load(configPath);
        ValidationReport report = new ConfigValidator(configService).validate(configPath, config);
        report.warnings().forEach(warning -> System.err.println("Warning: " + warning));
        if (!report.ok()) {
            throw new IllegalStateException("invalid configuration:\n  - " + String.join("\n  - ", report.errors()));
        }
        return config;
    }

    Orchestrator openOrchestrator(LinguaLearnConfig config, ExecutionListener listener) {
        return orchestratorFactory.create(configPath, config, listener);
    }
}
