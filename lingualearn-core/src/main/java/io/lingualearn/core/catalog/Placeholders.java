package io.lingualearn.core.catalog;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {{name}}} tokens inside agent arguments and environment values.
 */
public final class Placeholders {
    private static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    private Placeholders() {
    }

    public static Set<String> find(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return names;
        }
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Replaces known tokens and leaves unknown ones untouched.
     */
    public static String substitute(String text, Map<String, String> values) {
        return substitute(text, values::get);
    }

    public static String substitute(String text, Function<String, String> lookup) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher matcher = TOKEN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = lookup.apply(matcher.group(1));
            String replacement = value == null ? matcher.group() : value;
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Environment-variable spelling of a placeholder: {@code sourceText} becomes {@code SOURCE_TEXT}.
     */
    public static String toEnvironmentKey(String placeholder) {
        String snake = placeholder
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .replaceAll("[^A-Za-z0-9]+", "_");
        return snake.toUpperCase(Locale.ROOT);
    }
}
