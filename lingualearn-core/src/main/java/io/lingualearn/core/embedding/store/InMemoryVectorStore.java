package io.lingualearn.core.embedding.store;

import io.lingualearn.core.embedding.EmbeddingRecord;
import io.lingualearn.core.error.VectorStoreException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

public final class InMemoryVectorStore implements VectorStore {
    private final Map<String, EmbeddingRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void upsert(EmbeddingRecord record) {
        checkDimension(record);
        records.put(record.entityId(), record);
    }

    @Override
    public synchronized Optional<EmbeddingRecord> find(String entityId) {
        return Optional.ofNullable(records.get(entityId));
    }

    @Override
    public synchronized List<EmbeddingRecord> scanAll() {
        return List.copyOf(records.values());
    }

    @Override
    public synchronized int count() {
        return records.size();
    }

    @Override
    public synchronized OptionalInt dimension() {
        return records.values().stream().findFirst()
            .map(record -> OptionalInt.of(record.dimension()))
            .orElse(OptionalInt.empty());
    }

    @Override
    public synchronized void clear() {
        records.clear();
    }

    private void checkDimension(EmbeddingRecord record) {
        OptionalInt expected = dimension();
        if (expected.isPresent() && expected.getAsInt() != record.dimension()) {
            throw new VectorStoreException(
                "Vector length " + record.dimension() + " does not match store dimension " + expected.getAsInt()
            );
        }
    }
}
