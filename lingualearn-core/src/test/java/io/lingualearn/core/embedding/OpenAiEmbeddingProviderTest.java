package io.lingualearn.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lingualearn.core.error.EmbeddingProviderException;
import java.time.Duration;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiEmbeddingProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldPostModelAndInputAndParseVector() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"data\":[{\"embedding\":[0.1,0.2,0.3]}]}"));
        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider(
            "sk-test", server.url("/v1").toString(), null, 3
        );

        float[] vector = provider.embed("translate my lecture");

        assertThat(vector).containsExactly(0.1f, 0.2f, 0.3f);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/embeddings");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo(OpenAiEmbeddingProvider.DEFAULT_MODEL);
        assertThat(body.path("input").asText()).isEqualTo("translate my lecture");
        assertThat(body.path("dimensions").asInt()).isEqualTo(3);
    }

    @Test
    void shouldCarryStatusAndRetryAfterOnErrorResponse() {
        server.enqueue(new MockResponse()
            .setResponseCode(429)
            .setHeader("Retry-After", "2")
            .setBody("{\"error\":{\"message\":\"Rate limit\"}}"));
        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider("sk-test", server.url("/v1").toString(), "m", null);

        assertThatThrownBy(() -> provider.embed("hello"))
            .isInstanceOfSatisfying(EmbeddingProviderException.class, error -> {
                assertThat(error.statusCode()).isEqualTo(429);
                assertThat(error.retryAfter()).contains(Duration.ofSeconds(2));
                assertThat(error).hasMessageContaining("HTTP 429");
            });
    }

    @Test
    void shouldRejectEmptyEmbedding() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":[{\"embedding\":[]}]}"));
        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider("sk-test", server.url("/v1").toString(), "m", null);

        assertThatThrownBy(() -> provider.embed("hello"))
            .isInstanceOf(EmbeddingProviderException.class)
            .hasMessageContaining("empty vector");
    }

    @Test
    void shouldFailWithoutApiKeyBeforeCallingServer() {
        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider(" ", server.url("/v1").toString(), "m", null);

        assertThatThrownBy(() -> provider.embed("hello"))
            .isInstanceOf(EmbeddingProviderException.class)
            .hasMessageContaining("Missing API key");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldReportUnreachableServer() throws Exception {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String url = stopped.url("/v1").toString();
        stopped.shutdown();
        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider("sk-test", url, "m", null, Duration.ofSeconds(2));

        assertThatThrownBy(() -> provider.embed("hello"))
            .isInstanceOfSatisfying(EmbeddingProviderException.class, error ->
                assertThat(error.statusCode()).isEqualTo(-1))
            .hasMessageContaining("unreachable");
    }
}
