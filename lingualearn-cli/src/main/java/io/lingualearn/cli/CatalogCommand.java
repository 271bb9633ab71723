package io.lingualearn.cli;

import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.catalog.CatalogDiscovery;
import io.lingualearn.core.catalog.CatalogEntry;
import io.lingualearn.core.catalog.DiscoveryError;
import io.lingualearn.core.catalog.EntryKind;
import io.lingualearn.core.catalog.WorkflowDescriptor;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "catalog", description = "List discovered agents and workflows by category")
public final class CatalogCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--snapshot", paramLabel = "FILE", description = "Also write the catalog as JSON to FILE")
    Path snapshot;

    public CatalogCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LinguaLearnConfig config = context.configService().load(context.configPath());
            CatalogDiscovery discovery = new CatalogDiscovery(context.configService().catalogRoot(context.configPath(), config));
            Catalog catalog = discovery.discover(context.configService().languages(config));

            if (catalog.size() == 0) {
                System.out.println("No agents or workflows found under " + discovery.root());
            }
            int number = 1;
            for (Map.Entry<String, List<CatalogEntry>> group : catalog.byCategory().entrySet()) {
                System.out.println("=== " + group.getKey() + " ===");
                for (CatalogEntry entry : group.getValue()) {
                    System.out.println(number++ + ". " + label(entry) + (entry.description().isBlank() ? "" : " - " + entry.description()));
                }
            }
            for (DiscoveryError error : catalog.errors()) {
                System.out.println("Skipped " + error.source() + ": " + error.message());
            }
            if (snapshot != null) {
                discovery.writeSnapshot(catalog, snapshot);
                System.out.println("Snapshot written: " + snapshot);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Catalog command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String label(CatalogEntry entry) {
        if (entry.kind() == EntryKind.WORKFLOW) {
            return entry.name() + " [workflow, " + ((WorkflowDescriptor) entry).steps().size() + " steps]";
        }
        return entry.name();
    }
}
