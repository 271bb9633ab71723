package io.lingualearn.core.orchestrator;

/**
 * What the caller wants to run: an explicit catalog name, or free text to rank against the catalog.
 */
public record Selection(String name, String intent) {

    public Selection {
        boolean hasName = name != null && !name.isBlank();
        boolean hasIntent = intent != null && !intent.isBlank();
        if (hasName == hasIntent) {
            throw new IllegalArgumentException("exactly one of name or intent must be given");
        }
    }

    public static Selection byName(String name) {
        return new Selection(name, null);
    }

    public static Selection byIntent(String intent) {
        return new Selection(null, intent);
    }

    public boolean explicit() {
        return name != null && !name.isBlank();
    }
}
