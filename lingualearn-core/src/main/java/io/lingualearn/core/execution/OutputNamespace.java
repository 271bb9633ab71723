package io.lingualearn.core.execution;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Output layout: {@code <root>/<workflow-slug>/<invocation-id>/<NN>-<agent-slug>/}. Each invocation
 * owns a fresh id, so concurrent runs never share a directory.
 */
public final class OutputNamespace {

    private OutputNamespace() {
    }

    public static Path invocationDirectory(Path outputRoot, String workflowName, String invocationId) {
        return outputRoot.resolve(slug(workflowName)).resolve(invocationId);
    }

    public static Path stepDirectory(Path invocationDirectory, int stepIndex, String agentName) {
        return invocationDirectory.resolve(String.format(Locale.ROOT, "%02d-%s", stepIndex, slug(agentName)));
    }

    static String slug(String name) {
        String slug = name == null ? "" : name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("^-+", "").replaceAll("-+$", "");
        return slug.isEmpty() ? "entry" : slug;
    }
}
