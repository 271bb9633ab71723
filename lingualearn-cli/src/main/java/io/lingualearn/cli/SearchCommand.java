package io.lingualearn.cli;

import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import io.lingualearn.core.embedding.RankedEntry;
import io.lingualearn.core.execution.ExecutionListener;
import io.lingualearn.core.orchestrator.Orchestrator;
import io.lingualearn.core.orchestrator.RankingResult;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Rank catalog entries against a free-text intent")
public final class SearchCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "What you want to do")
    String intent;

    @Option(names = {"-k", "--top"}, description = "Number of results (default: search.topK)")
    Integer topK;

    public SearchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LinguaLearnConfig config = context.loadValidated();
            try (Orchestrator orchestrator = context.openOrchestrator(config, ExecutionListener.NOOP)) {
                Catalog catalog = orchestrator.loadCatalog(context.configService().languages(config));
                RankingResult ranking = orchestrator.rank(catalog, intent, topK != null ? topK : config.search().topK());
                if (ranking.isEmpty()) {
                    System.out.println("No matches for: " + intent);
                    return 0;
                }
                System.out.println("Matches (" + (ranking.semantic() ? "semantic" : "keyword") + "):");
                int rank = 1;
                for (RankedEntry entry : ranking.entries()) {
                    System.out.println(rank++ + ". " + entry.entityId()
                        + " (" + String.format(Locale.ROOT, "%.3f", entry.score()) + ")");
                }
                return 0;
            }
        } catch (Exception e) {
            System.err.println("Search failed: " + e.getMessage());
            return 1;
        }
    }
}
