package io.lingualearn.core.catalog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session language context, passed explicitly to every call that needs it.
 */
public record LanguagePair(String targetLanguage, String sourceLanguage) {
    public static final String TARGET_ENV = "LINGUALEARN_TARGET_LANGUAGE";
    public static final String SOURCE_ENV = "LINGUALEARN_SOURCE_LANGUAGE";

    public LanguagePair {
        targetLanguage = targetLanguage == null ? "" : targetLanguage.trim();
        sourceLanguage = sourceLanguage == null ? "" : sourceLanguage.trim();
    }

    public static LanguagePair unspecified() {
        return new LanguagePair("", "");
    }

    public Map<String, String> placeholderValues() {
        Map<String, String> values = new LinkedHashMap<>();
        if (!targetLanguage.isEmpty()) {
            values.put("targetLanguage", targetLanguage);
        }
        if (!sourceLanguage.isEmpty()) {
            values.put("sourceLanguage", sourceLanguage);
        }
        return values;
    }

    public Map<String, String> environment() {
        Map<String, String> env = new LinkedHashMap<>();
        if (!targetLanguage.isEmpty()) {
            env.put(TARGET_ENV, targetLanguage);
        }
        if (!sourceLanguage.isEmpty()) {
            env.put(SOURCE_ENV, sourceLanguage);
        }
        return env;
    }
}
