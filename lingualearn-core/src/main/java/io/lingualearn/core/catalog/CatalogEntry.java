package io.lingualearn.core.catalog;

import java.util.Set;

/**
 * Common view over agents and workflows used for ranking and presentation.
 */
public sealed interface CatalogEntry permits AgentDescriptor, WorkflowDescriptor {
    String name();

    String description();

    Set<String> keywords();

    String category();

    EntryKind kind();

    /**
     * Text that represents this entry in the embedding index.
     */
    default String descriptiveText() {
        StringBuilder out = new StringBuilder(name());
        if (!description().isBlank()) {
            out.append(". ").append(description());
        }
        if (!keywords().isEmpty()) {
            out.append(". Keywords: ").append(String.join(", ", keywords()));
        }
        if (!category().isBlank()) {
            out.append(". Category: ").append(category());
        }
        return out.toString();
    }
}
