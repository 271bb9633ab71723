package io.lingualearn.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lingualearn.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CommandIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path configPath;
    private CliContext context;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.json");
        context = new CliContext(new ConfigService(Map.of()), configPath);
    }

    @Test
    void onboardShouldCreateConfigAndCatalogDirectories() {
        Captured captured = execute(new OnboardCommand(context));

        assertThat(captured.code).isZero();
        assertThat(captured.out)
            .contains("Created config: " + configPath)
            .contains("Agent manifests go in:    " + tempDir.resolve("catalog/agents"))
            .contains("Workflow manifests go in: " + tempDir.resolve("catalog/workflows"))
            .contains("Step output goes under: " + tempDir.resolve("output"));
        assertThat(tempDir.resolve("catalog/agents")).isDirectory();
        assertThat(tempDir.resolve("catalog/workflows")).isDirectory();
    }

    @Test
    void catalogShouldListEntriesByCategoryAndSkippedManifests() throws Exception {
        writeOfflineConfig();
        writeGreeter();
        writeWorkflow();
        Files.writeString(tempDir.resolve("catalog/agents/broken.json"), "{ not json");

        Captured captured = execute(new CatalogCommand(context), "--snapshot", tempDir.resolve("snapshot.json").toString());

        assertThat(captured.code).isZero();
        assertThat(captured.out)
            .contains("=== Language ===")
            .contains("1. Greeter - Writes a greeting in the target language")
            .contains("Greeting Lesson [workflow, 1 steps]")
            .contains("Skipped ")
            .contains("Snapshot written: ");
        assertThat(tempDir.resolve("snapshot.json")).exists();
    }

    @Test
    void searchShouldRankWithOfflineEmbeddings() throws Exception {
        writeOfflineConfig();
        writeGreeter();
        writeAgent("Board Capture", "Photographs the whiteboard", List.of("whiteboard"), "Vision", "exit 0");

        Captured captured = execute(new SearchCommand(context), "write a greeting", "-k", "1");

        assertThat(captured.code).isZero();
        assertThat(captured.out).contains("Matches (semantic):").contains("1. Greeter (");
        assertThat(captured.out).doesNotContain("Board Capture");
    }

    @Test
    void searchShouldUseOpenAiCompatibleEndpoint() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.setDispatcher(new Dispatcher() {
                @Override
                public MockResponse dispatch(RecordedRequest request) {
                    String body = request.getBody().readUtf8();
                    String vector = body.contains("Greeter") || body.contains("greeting") ? "[0.9,0.1]" : "[0.1,0.9]";
                    return new MockResponse()
                        .setHeader("Content-Type", "application/json")
                        .setBody("{\"data\":[{\"embedding\":" + vector + "}]}");
                }
            });
            server.start();
            Map<String, Object> embedding = new LinkedHashMap<>();
            embedding.put("provider", "openai");
            embedding.put("apiKey", "sk-test");
            embedding.put("apiBase", server.url("/v1").toString());
            writeConfig(embedding);
            writeGreeter();
            writeAgent("Board Capture", "Photographs the whiteboard", List.of("whiteboard"), "Vision", "exit 0");

            Captured captured = execute(new SearchCommand(context), "say a greeting");

            assertThat(captured.code).isZero();
            assertThat(captured.out).contains("Matches (semantic):").contains("1. Greeter (1.000)");
            assertThat(server.getRequestCount()).isEqualTo(3);
            assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer sk-test");
        }
    }

    @Test
    void runShouldExecuteAgentByNameAndPrintArtifacts() throws Exception {
        writeOfflineConfig();
        writeGreeter();

        Captured captured = execute(new RunCommand(context), "--name", "Greeter", "--var", "name=Ana");

        assertThat(captured.code).isZero();
        assertThat(captured.out)
            .contains("[1] Greeter: RUNNING")
            .contains("Greeter: SUCCEEDED (invocation ")
            .contains("greeting.txt");
        Path artifact;
        try (Stream<Path> files = Files.walk(tempDir.resolve("output"))) {
            artifact = files.filter(path -> path.getFileName().toString().equals("greeting.txt")).findFirst().orElseThrow();
        }
        assertThat(Files.readString(artifact)).isEqualTo("hola Ana");
    }

    @Test
    void runShouldResolveIntentAndReportFailure() throws Exception {
        writeOfflineConfig();
        writeAgent("Broken Translator", "Translates nothing and fails", List.of("translate"), "Language",
            "echo 'no model installed' >&2; exit 5");

        Captured captured = execute(new RunCommand(context), "--intent", "translate my notes");

        assertThat(captured.code).isEqualTo(1);
        assertThat(captured.out).contains("Broken Translator: FAILED");
        assertThat(captured.err).contains("Failed at step 1 (Broken Translator): exit code 5: no model installed");
    }

    @Test
    void runShouldRefuseInvalidConfiguration() {
        Captured captured = execute(new RunCommand(context), "--name", "Anything");

        assertThat(captured.code).isEqualTo(1);
        assertThat(captured.err).contains("invalid configuration").contains("Catalog root does not exist");
    }

    @Test
    void capabilityShouldRunTheBoundAgentOnText() throws Exception {
        writeConfig(Map.of("provider", "hashing"), Map.of("summarizer", "Shortener"));
        writeAgent("Shortener", "Keeps the first word", List.of("summary"), "Language",
            "cut -d ' ' -f 1 \"$1\" > \"$LINGUALEARN_OUTPUT_DIR/output.txt\"", "{{input}}");

        Captured captured = execute(new CapabilityCommand(context), "summarizer", "--text", "Bonjour tout le monde");

        assertThat(captured.code).isZero();
        assertThat(captured.out.strip()).isEqualTo("Bonjour");
    }

    @Test
    void capabilityShouldFailWhenNothingIsBound() throws Exception {
        writeConfig(Map.of("provider", "hashing"), Map.of("summarizer", "Missing Agent"));

        Captured captured = execute(new CapabilityCommand(context), "summarizer", "--text", "anything");

        assertThat(captured.code).isEqualTo(1);
        assertThat(captured.err).contains("No agent provides Summarizer");
    }

    @Test
    void statusShouldReportReadiness() throws Exception {
        writeOfflineConfig();

        Captured captured = execute(new StatusCommand(context));

        assertThat(captured.code).isZero();
        assertThat(captured.out)
            .contains("Embedding provider: hashing")
            .contains("Vector store: memory")
            .contains("Languages: en -> es")
            .contains("Ready: true");
    }

    private void writeOfflineConfig() throws IOException {
        writeConfig(Map.of("provider", "hashing"));
    }

    private void writeConfig(Map<String, Object> embedding) throws IOException {
        writeConfig(embedding, Map.of());
    }

    private void writeConfig(Map<String, Object> embedding, Map<String, String> capabilities) throws IOException {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("catalog", Map.of("root", "catalog", "targetLanguage", "es", "sourceLanguage", "en"));
        config.put("embedding", embedding);
        config.put("vectorStore", Map.of("backend", "memory"));
        config.put("execution", Map.of("stepTimeoutSeconds", 20));
        config.put("capabilities", capabilities);
        Files.writeString(configPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
        Files.createDirectories(tempDir.resolve("catalog/agents"));
        Files.createDirectories(tempDir.resolve("catalog/workflows"));
    }

    private void writeGreeter() throws IOException {
        writeAgent("Greeter", "Writes a greeting in the target language", List.of("greeting", "hello"), "Language",
            "printf 'hola %s' \"$1\" > \"$LINGUALEARN_OUTPUT_DIR/greeting.txt\"", "{{name}}");
    }

    private void writeWorkflow() throws IOException {
        Map<String, Object> workflow = new LinkedHashMap<>();
        workflow.put("name", "Greeting Lesson");
        workflow.put("steps", List.of("Greeter"));
        workflow.put("category", "Language");
        Files.writeString(tempDir.resolve("catalog/workflows/greeting-lesson.json"), mapper.writeValueAsString(workflow));
    }

    private void writeAgent(
        String name,
        String description,
        List<String> keywords,
        String category,
        String script,
        String... extraArguments
    ) throws IOException {
        Path directory = Files.createDirectories(tempDir.resolve("catalog/agents").resolve(name.replace(' ', '-')));
        List<String> arguments = new ArrayList<>(List.of("-c", script, "sh"));
        arguments.addAll(List.of(extraArguments));
        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("name", name);
        manifest.put("description", description);
        manifest.put("executablePath", "/bin/sh");
        manifest.put("arguments", arguments);
        manifest.put("keywords", keywords);
        manifest.put("category", category);
        Files.writeString(directory.resolve("agent.json"), mapper.writeValueAsString(manifest));
    }

    private static Captured execute(Callable<Integer> command, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = new CommandLine(command).execute(args);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
        return new Captured(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private record Captured(int code, String out, String err) {
    }
}
