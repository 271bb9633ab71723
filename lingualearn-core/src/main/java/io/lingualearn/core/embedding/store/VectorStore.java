package io.lingualearn.core.embedding.store;

import io.lingualearn.core.embedding.EmbeddingRecord;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Keyed store of embedding records. Writes are upserts by entity id; all records in one store
 * share a vector length. Failures surface as {@link io.lingualearn.core.error.VectorStoreException}.
 */
public interface VectorStore {
    void upsert(EmbeddingRecord record);

    Optional<EmbeddingRecord> find(String entityId);

    /**
     * Every record, in first-insertion order.
     */
    List<EmbeddingRecord> scanAll();

    int count();

    /**
     * Vector length shared by the stored records, empty while the store is empty.
     */
    OptionalInt dimension();

    void clear();
}
