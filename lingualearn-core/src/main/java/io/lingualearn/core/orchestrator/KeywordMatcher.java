package io.lingualearn.core.orchestrator;

import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.catalog.CatalogEntry;
import io.lingualearn.core.embedding.RankedEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Non-semantic ranking by term overlap. Name hits weigh most, then keywords, then category and
 * description. A shared prefix of four or more letters ("translate" / "translator") counts half.
 */
public final class KeywordMatcher {
    private static final double NAME_WEIGHT = 3.0;
    private static final double KEYWORD_WEIGHT = 2.0;
    private static final double CATEGORY_WEIGHT = 1.0;
    private static final double DESCRIPTION_WEIGHT = 1.0;
    private static final int MIN_PREFIX = 4;
    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "to", "of", "in", "for", "on", "with", "at", "by",
        "from", "it", "this", "that", "my", "me", "i", "please", "want", "can", "you"
    );

    public List<RankedEntry> rank(Catalog catalog, String query, int topK) {
        Set<String> terms = tokenize(query);
        if (terms.isEmpty() || topK <= 0) {
            return List.of();
        }
        List<RankedEntry> scored = new ArrayList<>();
        for (CatalogEntry entry : catalog.entries()) {
            double score = score(entry, terms);
            if (score > 0) {
                scored.add(new RankedEntry(entry.name(), score));
            }
        }
        scored.sort(Comparator.comparingDouble(RankedEntry::score).reversed());
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    private double score(CatalogEntry entry, Set<String> terms) {
        Set<String> name = tokenize(entry.name());
        Set<String> keywords = tokenize(String.join(" ", entry.keywords()));
        Set<String> category = tokenize(entry.category());
        Set<String> description = tokenize(entry.description());

        double score = 0;
        for (String term : terms) {
            score += NAME_WEIGHT * match(term, name);
            score += KEYWORD_WEIGHT * match(term, keywords);
            score += CATEGORY_WEIGHT * match(term, category);
            score += DESCRIPTION_WEIGHT * match(term, description);
        }
        return score;
    }

    private static double match(String term, Set<String> tokens) {
        if (tokens.contains(term)) {
            return 1.0;
        }
        for (String token : tokens) {
            int shared = commonPrefix(term, token);
            if (shared >= MIN_PREFIX && shared >= Math.min(term.length(), token.length()) - 2) {
                return 0.5;
            }
        }
        return 0.0;
    }

    private static int commonPrefix(String a, String b) {
        int limit = Math.min(a.length(), b.length());
        int i = 0;
        while (i < limit && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
