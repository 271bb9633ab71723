package io.lingualearn.cli;

import io.lingualearn.core.catalog.CatalogDiscovery;
import io.lingualearn.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Initialize or refresh config and catalog directories")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Overwrote config with defaults: " + result.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + result.configPath());
            }
            System.out.println("Catalog root: " + result.catalogRoot());
            System.out.println("  Agent manifests go in:    " + result.catalogRoot().resolve(CatalogDiscovery.AGENTS_DIR)
                + " (one directory per agent, each with " + CatalogDiscovery.AGENT_MANIFEST + ")");
            System.out.println("  Workflow manifests go in: " + result.catalogRoot().resolve(CatalogDiscovery.WORKFLOWS_DIR)
                + " (one .json file per workflow)");
            System.out.println("Step output goes under: " + result.outputRoot());
            System.out.println("Next: add an agent, then run 'lingualearn catalog' to check it is discovered");
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
