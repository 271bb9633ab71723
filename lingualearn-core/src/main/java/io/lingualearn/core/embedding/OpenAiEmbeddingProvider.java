package io.lingualearn.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lingualearn.core.error.EmbeddingProviderException;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Client for an OpenAI-compatible {@code /embeddings} endpoint. It makes exactly one request per
 * call; retries are the caller's concern.
 */
public final class OpenAiEmbeddingProvider implements EmbeddingProvider {
    public static final String DEFAULT_MODEL = "text-embedding-3-small";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 500;

    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final Integer dimensions;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiEmbeddingProvider(String apiKey, String apiBase, String model, Integer dimensions) {
        this(apiKey, apiBase, model, dimensions, Duration.ofSeconds(30));
    }

    public OpenAiEmbeddingProvider(String apiKey, String apiBase, String model, Integer dimensions, Duration timeout) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        this.dimensions = dimensions != null && dimensions > 0 ? dimensions : null;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(timeout)
            .writeTimeout(Duration.ofSeconds(10))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "openai";
    }

    public String model() {
        return model;
    }

    @Override
    public float[] embed(String text) {
        if (apiKey.isBlank()) {
            throw new EmbeddingProviderException("Missing API key for embedding provider " + name());
        }
        if (text == null || text.isBlank()) {
            throw new EmbeddingProviderException("Cannot embed blank text");
        }

        Request request = buildRequest(text);
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new EmbeddingProviderException(
                    "Embedding request failed: HTTP " + response.code() + " " + truncate(raw),
                    response.code(),
                    parseRetryAfter(response.header("Retry-After")),
                    null
                );
            }
            return parseVector(raw);
        } catch (IOException e) {
            throw new EmbeddingProviderException("Embedding provider unreachable: " + e.getMessage(), e);
        }
    }

    private Request buildRequest(String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", text);
        if (dimensions != null) {
            payload.put("dimensions", dimensions);
        }
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new EmbeddingProviderException("Failed to encode embedding request", e);
        }
        return new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("embeddings").build())
            .post(RequestBody.create(json, JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .build();
    }

    private float[] parseVector(String raw) throws IOException {
        JsonNode embedding = mapper.readTree(raw).path("data").path(0).path("embedding");
        if (!embedding.isArray() || embedding.isEmpty()) {
            throw new EmbeddingProviderException("Embedding provider returned an empty vector");
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) embedding.get(i).asDouble();
        }
        return vector;
    }

    private static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_ERROR_BODY) {
            return value;
        }
        return value.substring(0, MAX_ERROR_BODY) + "...";
    }
}
