package io.lingualearn.core.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
record WorkflowManifest(
    String name,
    String description,
    @JsonAlias({"agents"}) List<String> steps,
    @JsonAlias({"output_mappings"}) Map<String, List<String>> outputMappings,
    List<String> keywords,
    String category
) {
}
