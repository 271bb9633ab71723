package io.lingualearn.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchConfig(@JsonAlias({"top_k"}) int topK) {

    public static SearchConfig defaults() {
        return new SearchConfig(3);
    }
}
