package io.lingualearn.core.catalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory set of discovered agents and workflows for one session. Immutable, so it is
 * shared across concurrent orchestrations without locking.
 *
 * <p>Insertion order (agents first, then workflows, each lexicographic by name) is the
 * tie-break order for ranking.
 */
public final class Catalog {
    private static final String OTHER_CATEGORY = "Other";

    private final List<AgentDescriptor> agents;
    private final List<WorkflowDescriptor> workflows;
    private final List<DiscoveryError> errors;
    private final Map<String, CatalogEntry> byName;

    public Catalog(List<AgentDescriptor> agents, List<WorkflowDescriptor> workflows, List<DiscoveryError> errors) {
        this.agents = agents == null ? List.of() : List.copyOf(agents);
        this.workflows = workflows == null ? List.of() : List.copyOf(workflows);
        this.errors = errors == null ? List.of() : List.copyOf(errors);

        Map<String, CatalogEntry> index = new LinkedHashMap<>();
        for (AgentDescriptor agent : this.agents) {
            index.putIfAbsent(agent.name(), agent);
        }
        for (WorkflowDescriptor workflow : this.workflows) {
            index.putIfAbsent(workflow.name(), workflow);
        }
        this.byName = Map.copyOf(index);
    }

    public static Catalog empty() {
        return new Catalog(List.of(), List.of(), List.of());
    }

    public List<AgentDescriptor> agents() {
        return agents;
    }

    public List<WorkflowDescriptor> workflows() {
        return workflows;
    }

    public List<DiscoveryError> errors() {
        return errors;
    }

    public List<CatalogEntry> entries() {
        List<CatalogEntry> all = new ArrayList<>(agents.size() + workflows.size());
        all.addAll(agents);
        all.addAll(workflows);
        return List.copyOf(all);
    }

    public Optional<CatalogEntry> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        CatalogEntry exact = byName.get(name.trim());
        if (exact != null) {
            return Optional.of(exact);
        }
        return entries().stream()
            .filter(entry -> entry.name().equalsIgnoreCase(name.trim()))
            .findFirst();
    }

    public Optional<AgentDescriptor> agent(String name) {
        return agents.stream().filter(agent -> agent.name().equals(name)).findFirst();
    }

    /**
     * Position of an entry in insertion order, or {@link Integer#MAX_VALUE} when unknown.
     */
    public int orderOf(String name) {
        List<CatalogEntry> all = entries();
        for (int i = 0; i < all.size(); i++) {
            if (all.get(i).name().equals(name)) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }

    public int size() {
        return agents.size() + workflows.size();
    }

    /**
     * Entries grouped by category, categories sorted by name with "Other" (blank) last.
     */
    public Map<String, List<CatalogEntry>> byCategory() {
        Map<String, List<CatalogEntry>> groups = new LinkedHashMap<>();
        entries().stream()
            .sorted(Comparator.comparing((CatalogEntry entry) -> categoryKey(entry.category())))
            .forEach(entry -> groups
                .computeIfAbsent(entry.category().isBlank() ? OTHER_CATEGORY : entry.category(), ignored -> new ArrayList<>())
                .add(entry));
        return groups;
    }

    private static String categoryKey(String category) {
        if (category == null || category.isBlank() || OTHER_CATEGORY.equalsIgnoreCase(category)) {
            return "\uFFFF";
        }
        return category;
    }
}
