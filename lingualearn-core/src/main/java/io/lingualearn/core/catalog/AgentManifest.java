package io.lingualearn.core.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
record AgentManifest(
    String name,
    String description,
    @JsonAlias({"executable_path", "executable"}) String executablePath,
    @JsonAlias({"working_directory", "workdir"}) String workingDirectory,
    @JsonAlias({"environment_variables", "environment", "env"}) Map<String, String> environmentVariables,
    @JsonAlias({"args"}) List<String> arguments,
    List<String> keywords,
    String category
) {
}
