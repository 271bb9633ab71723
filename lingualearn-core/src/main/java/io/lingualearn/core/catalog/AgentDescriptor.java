package io.lingualearn.core.catalog;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record AgentDescriptor(
    String name,
    String description,
    String executablePath,
    Path workingDirectory,
    Map<String, String> environmentVariables,
    List<String> arguments,
    Set<String> keywords,
    String category
) implements CatalogEntry {

    public AgentDescriptor {
        name = requireText(name, "name");
        executablePath = requireText(executablePath, "executablePath");
        // no working directory means the current one
        workingDirectory = workingDirectory == null ? Path.of("").toAbsolutePath() : workingDirectory;
        description = description == null ? "" : description.trim();
        category = category == null ? "" : category.trim();
        environmentVariables = environmentVariables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(environmentVariables));
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        keywords = keywords == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
    }

    @Override
    public EntryKind kind() {
        return EntryKind.AGENT;
    }

    /**
     * Placeholder names referenced by this agent's arguments, in order of first use.
     */
    public Set<String> placeholders() {
        Set<String> names = new LinkedHashSet<>();
        for (String argument : arguments) {
            names.addAll(Placeholders.find(argument));
        }
        return names;
    }

    private static String requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return trimmed;
    }
}
