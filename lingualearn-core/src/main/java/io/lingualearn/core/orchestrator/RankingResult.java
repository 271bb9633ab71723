package io.lingualearn.core.orchestrator;

import io.lingualearn.core.embedding.RankedEntry;
import java.util.List;

/**
 * @param semantic {@code false} when the ranking came from keyword matching because the
 *     embedding path was unavailable
 */
public record RankingResult(List<RankedEntry> entries, boolean semantic) {

    public RankingResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
