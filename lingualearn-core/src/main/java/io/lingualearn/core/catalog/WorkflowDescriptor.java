package io.lingualearn.core.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered composition of agents. {@code outputMappings} maps a producing step's agent name to
 * the placeholder names its output satisfies in later steps.
 *
 * <p>Construction enforces that each mapped placeholder is produced before any step that
 * consumes it. Placeholders no mapping produces are invocation inputs, supplied by the caller.
 */
public record WorkflowDescriptor(
    String name,
    String description,
    List<AgentDescriptor> steps,
    Map<String, List<String>> outputMappings,
    Set<String> keywords,
    String category
) implements CatalogEntry {

    public WorkflowDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        description = description == null ? "" : description.trim();
        category = category == null ? "" : category.trim();
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("workflow '" + name + "' has no steps");
        }
        Map<String, List<String>> mappings = new LinkedHashMap<>();
        if (outputMappings != null) {
            outputMappings.forEach((producer, placeholders) ->
                mappings.put(producer, placeholders == null ? List.of() : List.copyOf(placeholders)));
        }
        outputMappings = Collections.unmodifiableMap(mappings);
        keywords = keywords == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        validateMappings(name, steps, outputMappings);
    }

    @Override
    public EntryKind kind() {
        return EntryKind.WORKFLOW;
    }

    /**
     * Zero-based index of the step that produces {@code placeholder}, or {@code -1}.
     */
    public int producerOf(String placeholder) {
        for (int i = 0; i < steps.size(); i++) {
            List<String> produced = outputMappings.get(steps.get(i).name());
            if (produced != null && produced.contains(placeholder)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Placeholders used by some step that no step in this workflow produces.
     */
    public Set<String> invocationInputs() {
        Set<String> inputs = new LinkedHashSet<>();
        for (AgentDescriptor step : steps) {
            for (String placeholder : step.placeholders()) {
                if (producerOf(placeholder) < 0) {
                    inputs.add(placeholder);
                }
            }
        }
        return inputs;
    }

    /**
     * Wraps a single agent so the engine can run it through the workflow path.
     */
    public static WorkflowDescriptor ofAgent(AgentDescriptor agent) {
        return new WorkflowDescriptor(
            agent.name(),
            agent.description(),
            List.of(agent),
            Map.of(),
            agent.keywords(),
            agent.category()
        );
    }

    private static void validateMappings(String name, List<AgentDescriptor> steps, Map<String, List<String>> mappings) {
        Map<String, Integer> firstIndex = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            firstIndex.putIfAbsent(steps.get(i).name(), i);
        }

        Map<String, Integer> producedAt = new HashMap<>();
        List<String> problems = new ArrayList<>();
        for (Map.Entry<String, List<String>> mapping : mappings.entrySet()) {
            Integer producer = firstIndex.get(mapping.getKey());
            if (producer == null) {
                problems.add("mapping source '" + mapping.getKey() + "' is not a step");
                continue;
            }
            for (String placeholder : mapping.getValue()) {
                Integer previous = producedAt.putIfAbsent(placeholder, producer);
                if (previous != null && !previous.equals(producer)) {
                    problems.add("placeholder '" + placeholder + "' is produced by more than one step");
                }
            }
        }

        for (int i = 0; i < steps.size(); i++) {
            for (String placeholder : steps.get(i).placeholders()) {
                Integer producer = producedAt.get(placeholder);
                if (producer != null && producer >= i) {
                    problems.add("step " + (i + 1) + " (" + steps.get(i).name() + ") consumes '"
                        + placeholder + "' before it is produced");
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("workflow '" + name + "' is invalid: " + String.join("; ", problems));
        }
    }
}
