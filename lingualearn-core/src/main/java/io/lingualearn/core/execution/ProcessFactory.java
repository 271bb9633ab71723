package io.lingualearn.core.execution;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Starts agent processes. Tests substitute scripted implementations.
 */
public interface ProcessFactory {
    /**
     * @param command executable followed by its arguments
     * @param workingDirectory directory the process starts in
     * @param environment entries layered over the base process environment
     */
    Process start(List<String> command, Path workingDirectory, Map<String, String> environment) throws IOException;
}
