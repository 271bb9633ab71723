package io.lingualearn.core.execution;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDirectory, Map<String, String> environment) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.environment().putAll(environment);
        return builder.start();
    }
}
