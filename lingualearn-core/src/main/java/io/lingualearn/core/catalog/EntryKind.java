package io.lingualearn.core.catalog;

public enum EntryKind {
    AGENT,
    WORKFLOW
}
