package io.lingualearn.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.lingualearn.core.catalog.CatalogDiscovery;
import io.lingualearn.core.catalog.LanguagePair;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes {@code config.json}. Values present in the file are deep-merged over the
 * defaults, so older files pick up new settings.
 */
public final class ConfigService {
    public static final String API_KEY_ENV = "OPENAI_API_KEY";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    /**
     * Loads the file (or the defaults when it is absent) and applies {@code OPENAI_API_KEY} when no
     * key is configured.
     */
    public LinguaLearnConfig load(Path configPath) throws IOException {
        return applyEnvironment(loadFile(configPath));
    }

    public void save(Path configPath, LinguaLearnConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(ConfigPaths.baseDirectory(configPath));
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        LinguaLearnConfig config;
        if (created || overwrite) {
            config = LinguaLearnConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = loadFile(configPath);
        }

        save(configPath, config);

        Path catalogRoot = catalogRoot(configPath, config);
        Files.createDirectories(catalogRoot.resolve(CatalogDiscovery.AGENTS_DIR));
        Files.createDirectories(catalogRoot.resolve(CatalogDiscovery.WORKFLOWS_DIR));
        Path outputRoot = outputRoot(configPath, config);
        Files.createDirectories(outputRoot);
        return new OnboardResult(configPath, catalogRoot, outputRoot, created, overwritten);
    }

    public Path catalogRoot(Path configPath, LinguaLearnConfig config) {
        return ConfigPaths.resolve(config.catalog().root(), ConfigPaths.baseDirectory(configPath));
    }

    public Path outputRoot(Path configPath, LinguaLearnConfig config) {
        return ConfigPaths.resolve(config.execution().outputRoot(), ConfigPaths.baseDirectory(configPath));
    }

    public Path vectorStorePath(Path configPath, LinguaLearnConfig config) {
        return ConfigPaths.resolve(config.vectorStore().path(), ConfigPaths.baseDirectory(configPath));
    }

    public LanguagePair languages(LinguaLearnConfig config) {
        return new LanguagePair(config.catalog().targetLanguage(), config.catalog().sourceLanguage());
    }

    public String toPrettyJson(LinguaLearnConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private LinguaLearnConfig loadFile(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return LinguaLearnConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(LinguaLearnConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, LinguaLearnConfig.class);
    }

    private LinguaLearnConfig applyEnvironment(LinguaLearnConfig config) {
        String key = environment.get(API_KEY_ENV);
        if (config.embedding().configured() || key == null || key.isBlank()) {
            return config;
        }
        return config.withEmbedding(config.embedding().withApiKey(key));
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
