package io.lingualearn.core.embedding.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lingualearn.core.embedding.EmbeddingRecord;
import io.lingualearn.core.error.VectorStoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * SQLite-backed store. Rows keep their rowid on update, so scans return records in first-insertion
 * order.
 */
public final class SqliteVectorStore implements VectorStore {
    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteVectorStore(Path dbPath) {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        try {
            Files.createDirectories(dbPath.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new VectorStoreException("Failed to create directory for " + dbPath, e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized void upsert(EmbeddingRecord record) {
        OptionalInt expected = dimension();
        if (expected.isPresent() && expected.getAsInt() != record.dimension()) {
            throw new VectorStoreException(
                "Vector length " + record.dimension() + " does not match store dimension " + expected.getAsInt()
            );
        }
        String sql = """
            INSERT INTO embeddings (entity_id, name, descriptive_text, dimension, vector_json)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(entity_id) DO UPDATE SET
                name = excluded.name,
                descriptive_text = excluded.descriptive_text,
                dimension = excluded.dimension,
                vector_json = excluded.vector_json
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, record.entityId());
            statement.setString(2, record.name());
            statement.setString(3, record.descriptiveText());
            statement.setInt(4, record.dimension());
            statement.setString(5, mapper.writeValueAsString(record.vector()));
            statement.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new VectorStoreException("Failed to upsert embedding " + record.entityId(), e);
        }
    }

    @Override
    public synchronized Optional<EmbeddingRecord> find(String entityId) {
        String sql = """
            SELECT entity_id, name, descriptive_text, vector_json
            FROM embeddings
            WHERE entity_id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, entityId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(toRecord(resultSet)) : Optional.empty();
            }
        } catch (SQLException | IOException e) {
            throw new VectorStoreException("Failed to read embedding " + entityId, e);
        }
    }

    @Override
    public synchronized List<EmbeddingRecord> scanAll() {
        String sql = """
            SELECT entity_id, name, descriptive_text, vector_json
            FROM embeddings
            ORDER BY rowid ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<EmbeddingRecord> records = new ArrayList<>();
            while (resultSet.next()) {
                records.add(toRecord(resultSet));
            }
            return records;
        } catch (SQLException | IOException e) {
            throw new VectorStoreException("Failed to scan embeddings", e);
        }
    }

    @Override
    public synchronized int count() {
        return queryInt("SELECT COUNT(*) FROM embeddings", "Failed to count embeddings").orElse(0);
    }

    @Override
    public synchronized OptionalInt dimension() {
        return queryInt("SELECT dimension FROM embeddings ORDER BY rowid ASC LIMIT 1", "Failed to read store dimension");
    }

    @Override
    public synchronized void clear() {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM embeddings");
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to clear embeddings", e);
        }
    }

    private OptionalInt queryInt(String sql, String failure) {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            return resultSet.next() ? OptionalInt.of(resultSet.getInt(1)) : OptionalInt.empty();
        } catch (SQLException e) {
            throw new VectorStoreException(failure, e);
        }
    }

    private EmbeddingRecord toRecord(ResultSet resultSet) throws SQLException, IOException {
        return new EmbeddingRecord(
            resultSet.getString("entity_id"),
            mapper.readValue(resultSet.getString("vector_json"), float[].class),
            resultSet.getString("name"),
            resultSet.getString("descriptive_text")
        );
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() {
        String ddl = """
            CREATE TABLE IF NOT EXISTS embeddings (
                entity_id TEXT PRIMARY KEY,
                name TEXT NOT NULL,
                descriptive_text TEXT NOT NULL,
                dimension INTEGER NOT NULL,
                vector_json TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to initialize SQLite vector store", e);
        }
    }
}
