package io.lingualearn.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogConfig(
    String root,
    @JsonAlias({"target_language"}) String targetLanguage,
    @JsonAlias({"source_language"}) String sourceLanguage
) {

    public static CatalogConfig defaults() {
        return new CatalogConfig("catalog", "", "");
    }
}
