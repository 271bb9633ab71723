package io.lingualearn.app;

import io.lingualearn.cli.CapabilityCommand;
import io.lingualearn.cli.CatalogCommand;
import io.lingualearn.cli.CliContext;
import io.lingualearn.cli.LinguaLearnCliCommand;
import io.lingualearn.cli.OnboardCommand;
import io.lingualearn.cli.RunCommand;
import io.lingualearn.cli.SearchCommand;
import io.lingualearn.cli.StatusCommand;
import io.lingualearn.core.config.ConfigPaths;
import io.lingualearn.core.config.ConfigService;
import io.lingualearn.core.orchestrator.OrchestratorFactory;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class LinguaLearnApplication {
    private static final Logger LOG = LoggerFactory.getLogger(LinguaLearnApplication.class);
    static final String CONFIG_ENV = "LINGUALEARN_CONFIG";

    private LinguaLearnApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = resolveConfigPath();
        LOG.debug("Using config {}", configPath);

        CliContext context = new CliContext(configService, configPath, new OrchestratorFactory(configService));

        CommandLine commandLine = new CommandLine(new LinguaLearnCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("catalog", new CatalogCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("capability", new CapabilityCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String override = System.getenv(CONFIG_ENV);
        if (override == null || override.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.resolve(override, Path.of("").toAbsolutePath());
    }
}
