package io.lingualearn.core.embedding;

import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.catalog.CatalogEntry;
import io.lingualearn.core.concurrent.CancellationSignal;
import io.lingualearn.core.embedding.store.VectorStore;
import io.lingualearn.core.error.EmbeddingProviderException;
import io.lingualearn.core.resilience.RetryExecutor;
import io.lingualearn.core.resilience.RetryPolicy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Semantic index over catalog entries: embeds text through the provider (with retry), keeps one
 * vector per entity in the {@link VectorStore}, and ranks by brute-force cosine similarity.
 */
public final class EmbeddingIndex {
    private static final Logger LOG = LoggerFactory.getLogger(EmbeddingIndex.class);

    private final EmbeddingProvider provider;
    private final VectorStore store;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    public EmbeddingIndex(EmbeddingProvider provider, VectorStore store) {
        this(provider, store, new RetryExecutor(), RetryPolicy.defaults());
    }

    public EmbeddingIndex(EmbeddingProvider provider, VectorStore store, RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    public VectorStore store() {
        return store;
    }

    public float[] embed(String text) {
        return embed(text, CancellationSignal.none());
    }

    /**
     * Embeds through the retry executor. A call already in flight when the signal fires is allowed
     * to finish, but its result is discarded.
     */
    public float[] embed(String text, CancellationSignal cancellation) {
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;
        float[] vector = retryExecutor.executeWithRetry(() -> provider.embed(text), retryPolicy, null, signal);
        signal.throwIfCancelled();
        if (vector == null || vector.length == 0) {
            throw new EmbeddingProviderException("Embedding provider " + provider.name() + " returned an empty vector");
        }
        return vector;
    }

    public void storeEmbedding(String entityId, float[] vector, String descriptiveText) {
        store.upsert(new EmbeddingRecord(entityId, vector, entityId, descriptiveText));
    }

    public Optional<float[]> retrieveEmbedding(String entityId) {
        if (entityId == null) {
            return Optional.empty();
        }
        return store.find(entityId).map(EmbeddingRecord::vector);
    }

    /**
     * Up to {@code topK} stored ids by non-increasing similarity, ties in store order.
     */
    public List<String> search(float[] queryVector, int topK) {
        List<RankedEntry> scored = new ArrayList<>();
        for (EmbeddingRecord record : store.scanAll()) {
            if (record.dimension() == queryVector.length) {
                scored.add(new RankedEntry(record.entityId(), VectorMath.cosine(queryVector, record.vector())));
            }
        }
        return top(scored, topK).stream().map(RankedEntry::entityId).toList();
    }

    /**
     * Like {@link #search(float[], int)} but restricted to ids present in {@code catalog}, ties in
     * catalog order.
     */
    public List<RankedEntry> search(Catalog catalog, float[] queryVector, int topK) {
        Map<String, Integer> order = new HashMap<>();
        List<CatalogEntry> entries = catalog.entries();
        for (int i = 0; i < entries.size(); i++) {
            order.put(entries.get(i).name(), i);
        }

        List<RankedEntry> scored = new ArrayList<>();
        for (EmbeddingRecord record : store.scanAll()) {
            if (order.containsKey(record.entityId()) && record.dimension() == queryVector.length) {
                scored.add(new RankedEntry(record.entityId(), VectorMath.cosine(queryVector, record.vector())));
            }
        }
        scored.sort(Comparator.comparingInt(entry -> order.get(entry.entityId())));
        return top(scored, topK);
    }

    /**
     * Embeds the query, fills in any missing or stale catalog embeddings, then searches.
     */
    public List<RankedEntry> rank(Catalog catalog, String query, int topK, CancellationSignal cancellation) {
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;
        float[] queryVector = embed(query, signal);
        ensureIndexed(catalog, queryVector.length, signal);
        List<RankedEntry> ranked = search(catalog, queryVector, topK);
        LOG.debug("Ranked {} of {} catalog entries for query '{}'", ranked.size(), catalog.size(), query);
        return ranked;
    }

    /**
     * Computes and stores embeddings for entries with no record, or whose descriptive text changed.
     */
    public int ensureIndexed(Catalog catalog, CancellationSignal cancellation) {
        return ensureIndexed(catalog, -1, cancellation);
    }

    private int ensureIndexed(Catalog catalog, int expectedDimension, CancellationSignal signal) {
        OptionalInt stored = store.dimension();
        if (expectedDimension > 0 && stored.isPresent() && stored.getAsInt() != expectedDimension) {
            LOG.warn(
                "Stored embeddings have length {} but provider {} produces {}; rebuilding index",
                stored.getAsInt(),
                provider.name(),
                expectedDimension
            );
            store.clear();
        }

        int computed = 0;
        for (CatalogEntry entry : catalog.entries()) {
            signal.throwIfCancelled();
            String text = entry.descriptiveText();
            Optional<EmbeddingRecord> existing = store.find(entry.name());
            if (existing.isPresent() && existing.get().descriptiveText().equals(text)) {
                continue;
            }
            float[] vector = embed(text, signal);
            store.upsert(new EmbeddingRecord(entry.name(), vector, entry.name(), text));
            computed++;
        }
        if (computed > 0) {
            LOG.info("Stored {} new embedding(s) using provider {}", computed, provider.name());
        }
        return computed;
    }

    private static List<RankedEntry> top(List<RankedEntry> scored, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        // stable sort keeps the incoming order for equal scores
        List<RankedEntry> sorted = new ArrayList<>(scored);
        sorted.sort(Comparator.comparingDouble(RankedEntry::score).reversed());
        return List.copyOf(sorted.subList(0, Math.min(topK, sorted.size())));
    }
}
