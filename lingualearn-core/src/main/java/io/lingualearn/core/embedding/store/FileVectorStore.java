package io.lingualearn.core.embedding.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lingualearn.core.embedding.EmbeddingRecord;
import io.lingualearn.core.error.VectorStoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * JSON array of records on disk, rewritten through a temp file and an atomic move.
 */
public final class FileVectorStore implements VectorStore {
    private static final TypeReference<List<EmbeddingRecord>> RECORDS = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;

    public FileVectorStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        this.mapper = new ObjectMapper();
    }

    @Override
    public synchronized void upsert(EmbeddingRecord record) {
        List<EmbeddingRecord> records = new ArrayList<>(load());
        if (!records.isEmpty() && records.get(0).dimension() != record.dimension()) {
            throw new VectorStoreException(
                "Vector length " + record.dimension() + " does not match store dimension " + records.get(0).dimension()
            );
        }
        boolean replaced = false;
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).entityId().equals(record.entityId())) {
                if (records.get(i).equals(record)) {
                    return;
                }
                records.set(i, record);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            records.add(record);
        }
        save(records);
    }

    @Override
    public synchronized Optional<EmbeddingRecord> find(String entityId) {
        return load().stream().filter(record -> record.entityId().equals(entityId)).findFirst();
    }

    @Override
    public synchronized List<EmbeddingRecord> scanAll() {
        return load();
    }

    @Override
    public synchronized int count() {
        return load().size();
    }

    @Override
    public synchronized OptionalInt dimension() {
        List<EmbeddingRecord> records = load();
        return records.isEmpty() ? OptionalInt.empty() : OptionalInt.of(records.get(0).dimension());
    }

    @Override
    public synchronized void clear() {
        save(List.of());
    }

    private List<EmbeddingRecord> load() {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            String json = Files.readString(path);
            if (json.isBlank()) {
                return List.of();
            }
            return List.copyOf(mapper.readValue(json, RECORDS));
        } catch (IOException e) {
            throw new VectorStoreException("Failed to read vector store " + path, e);
        }
    }

    private void save(List<EmbeddingRecord> records) {
        try {
            Files.createDirectories(path.getParent());
            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, json + System.lineSeparator());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new VectorStoreException("Failed to write vector store " + path, e);
        }
    }
}
