package io.lingualearn.core.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans a catalog root and builds the session catalog.
 *
 * <p>Layout:
 * <pre>
 * root/
 *   agents/&lt;dir&gt;/agent.json   (working directory defaults to &lt;dir&gt;)
 *   agents/*.json
 *   workflows/*.json
 * </pre>
 * A manifest that cannot be read or does not describe a valid entry is skipped and recorded as
 * a {@link DiscoveryError}; the remaining manifests are still discovered. Results are ordered
 * lexicographically by name.
 */
public final class CatalogDiscovery {
    private static final Logger LOG = LoggerFactory.getLogger(CatalogDiscovery.class);
    public static final String AGENTS_DIR = "agents";
    public static final String WORKFLOWS_DIR = "workflows";
    public static final String AGENT_MANIFEST = "agent.json";

    private final Path root;
    private final ObjectMapper mapper;

    public CatalogDiscovery(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.mapper = new ObjectMapper();
    }

    public Path root() {
        return root;
    }

    public Catalog discover(LanguagePair languages) {
        DiscoveryResult<AgentDescriptor> agents = discoverAgents(languages);
        DiscoveryResult<WorkflowDescriptor> workflows = discoverWorkflows(languages, agents.entries());
        List<DiscoveryError> errors = new ArrayList<>(agents.errors());
        errors.addAll(workflows.errors());
        LOG.info(
            "Discovered {} agent(s) and {} workflow(s) under {} ({} skipped)",
            agents.entries().size(),
            workflows.entries().size(),
            root,
            errors.size()
        );
        return new Catalog(agents.entries(), workflows.entries(), errors);
    }

    public DiscoveryResult<AgentDescriptor> discoverAgents(LanguagePair languages) {
        LanguagePair context = languages == null ? LanguagePair.unspecified() : languages;
        List<DiscoveryError> errors = new ArrayList<>();
        Map<String, AgentDescriptor> byName = new LinkedHashMap<>();

        for (Path manifest : agentManifests(errors)) {
            try {
                AgentManifest raw = mapper.readValue(Files.readString(manifest), AgentManifest.class);
                AgentDescriptor agent = toDescriptor(raw, manifest, context);
                if (byName.containsKey(agent.name())) {
                    errors.add(skip(manifest, "duplicate agent name '" + agent.name() + "'"));
                    continue;
                }
                byName.put(agent.name(), agent);
            } catch (IOException | RuntimeException e) {
                errors.add(skip(manifest, describe(e)));
            }
        }

        List<AgentDescriptor> sorted = byName.values().stream()
            .sorted(Comparator.comparing(AgentDescriptor::name))
            .toList();
        return new DiscoveryResult<>(sorted, errors);
    }

    public DiscoveryResult<WorkflowDescriptor> discoverWorkflows(LanguagePair languages, List<AgentDescriptor> agents) {
        List<DiscoveryError> errors = new ArrayList<>();
        Map<String, AgentDescriptor> agentsByName = new LinkedHashMap<>();
        for (AgentDescriptor agent : agents == null ? List.<AgentDescriptor>of() : agents) {
            agentsByName.put(agent.name(), agent);
        }

        Map<String, WorkflowDescriptor> byName = new LinkedHashMap<>();
        for (Path manifest : jsonFiles(root.resolve(WORKFLOWS_DIR), errors)) {
            try {
                WorkflowManifest raw = mapper.readValue(Files.readString(manifest), WorkflowManifest.class);
                WorkflowDescriptor workflow = toDescriptor(raw, agentsByName);
                if (byName.containsKey(workflow.name()) || agentsByName.containsKey(workflow.name())) {
                    errors.add(skip(manifest, "duplicate catalog name '" + workflow.name() + "'"));
                    continue;
                }
                byName.put(workflow.name(), workflow);
            } catch (IOException | RuntimeException e) {
                errors.add(skip(manifest, describe(e)));
            }
        }

        List<WorkflowDescriptor> sorted = byName.values().stream()
            .sorted(Comparator.comparing(WorkflowDescriptor::name))
            .toList();
        return new DiscoveryResult<>(sorted, errors);
    }

    /**
     * Exports the catalog as pretty-printed JSON, in the manifest vocabulary.
     */
    public void writeSnapshot(Catalog catalog, Path target) throws IOException {
        ObjectMapper writer = mapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        ObjectNode rootNode = writer.createObjectNode();
        rootNode.set("generatedAt", writer.valueToTree(Instant.now()));
        rootNode.put("root", root.toString());
        ArrayNode agentNodes = rootNode.putArray("agents");
        for (AgentDescriptor agent : catalog.agents()) {
            ObjectNode node = agentNodes.addObject();
            node.put("name", agent.name());
            node.put("description", agent.description());
            node.put("executablePath", agent.executablePath());
            node.put("workingDirectory", agent.workingDirectory().toString());
            node.set("environmentVariables", writer.valueToTree(agent.environmentVariables()));
            node.set("arguments", writer.valueToTree(agent.arguments()));
            node.set("keywords", writer.valueToTree(agent.keywords()));
            node.put("category", agent.category());
        }
        ArrayNode workflowNodes = rootNode.putArray("workflows");
        for (WorkflowDescriptor workflow : catalog.workflows()) {
            ObjectNode node = workflowNodes.addObject();
            node.put("name", workflow.name());
            node.put("description", workflow.description());
            node.set("steps", writer.valueToTree(workflow.steps().stream().map(AgentDescriptor::name).toList()));
            node.set("outputMappings", writer.valueToTree(workflow.outputMappings()));
            node.set("keywords", writer.valueToTree(workflow.keywords()));
            node.put("category", workflow.category());
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, writer.writeValueAsString(rootNode) + System.lineSeparator());
    }

    private AgentDescriptor toDescriptor(AgentManifest raw, Path manifest, LanguagePair languages) {
        if (raw == null) {
            throw new IllegalArgumentException("manifest is empty");
        }
        Map<String, String> languageValues = languages.placeholderValues();

        Map<String, String> env = new LinkedHashMap<>(languages.environment());
        if (raw.environmentVariables() != null) {
            raw.environmentVariables().forEach((key, value) ->
                env.put(key, Placeholders.substitute(value == null ? "" : value, languageValues)));
        }
        List<String> arguments = raw.arguments() == null
            ? List.of()
            : raw.arguments().stream()
                .map(argument -> Placeholders.substitute(argument, languageValues))
                .toList();
        Set<String> keywords = raw.keywords() == null
            ? Set.of()
            : raw.keywords().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(keyword -> !keyword.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));

        String name = raw.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("missing required field 'name'");
        }
        if (raw.executablePath() == null || raw.executablePath().isBlank()) {
            throw new IllegalArgumentException("missing required field 'executablePath'");
        }

        return new AgentDescriptor(
            name,
            raw.description(),
            raw.executablePath(),
            resolveWorkingDirectory(raw.workingDirectory(), manifest, name.trim()),
            env,
            arguments,
            keywords,
            raw.category()
        );
    }

    private WorkflowDescriptor toDescriptor(WorkflowManifest raw, Map<String, AgentDescriptor> agents) {
        if (raw == null) {
            throw new IllegalArgumentException("manifest is empty");
        }
        if (raw.name() == null || raw.name().isBlank()) {
            throw new IllegalArgumentException("missing required field 'name'");
        }
        List<AgentDescriptor> steps = new ArrayList<>();
        for (String stepName : raw.steps() == null ? List.<String>of() : raw.steps()) {
            AgentDescriptor agent = agents.get(stepName == null ? "" : stepName.trim());
            if (agent == null) {
                throw new IllegalArgumentException("unknown agent '" + stepName + "'");
            }
            steps.add(agent);
        }
        Set<String> keywords = raw.keywords() == null
            ? Set.of()
            : new LinkedHashSet<>(raw.keywords().stream().filter(Objects::nonNull).map(String::trim).toList());
        return new WorkflowDescriptor(
            raw.name(),
            raw.description(),
            steps,
            raw.outputMappings(),
            keywords,
            raw.category()
        );
    }

    private Path resolveWorkingDirectory(String declared, Path manifest, String agentName) {
        Path manifestDir = manifest.getParent();
        if (declared == null || declared.isBlank()) {
            return manifestDir;
        }
        Path candidate = manifestDir.resolve(declared.trim()).normalize();
        if (Files.isDirectory(candidate)) {
            return candidate;
        }
        LOG.warn("Working directory not found for {}: {}", agentName, candidate);
        Path alternative = root.resolve(agentName).normalize();
        if (Files.isDirectory(alternative)) {
            LOG.info("Found alternative path for {}: {}", agentName, alternative);
            return alternative;
        }
        LOG.warn("Alternative path not found either for {}: {}", agentName, alternative);
        return candidate;
    }

    private List<Path> agentManifests(List<DiscoveryError> errors) {
        Path agentsDir = root.resolve(AGENTS_DIR);
        List<Path> manifests = new ArrayList<>(jsonFiles(agentsDir, errors));
        if (!Files.isDirectory(agentsDir)) {
            return manifests;
        }
        try (Stream<Path> children = Files.list(agentsDir)) {
            children
                .filter(Files::isDirectory)
                .map(dir -> dir.resolve(AGENT_MANIFEST))
                .filter(Files::isRegularFile)
                .forEach(manifests::add);
        } catch (IOException e) {
            errors.add(skip(agentsDir, describe(e)));
        }
        manifests.sort(Comparator.naturalOrder());
        return manifests;
    }

    private List<Path> jsonFiles(Path dir, List<DiscoveryError> errors) {
        if (!Files.isDirectory(dir)) {
            LOG.debug("Catalog directory {} does not exist", dir);
            return List.of();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(".json"))
                .sorted()
                .toList();
        } catch (IOException e) {
            errors.add(skip(dir, describe(e)));
            return List.of();
        }
    }

    private DiscoveryError skip(Path source, String message) {
        LOG.warn("Skipping catalog manifest {}: {}", source, message);
        return new DiscoveryError(source, message);
    }

    private String describe(Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
