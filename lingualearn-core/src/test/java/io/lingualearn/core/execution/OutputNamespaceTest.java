package io.lingualearn.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class OutputNamespaceTest {

    @Test
    void shouldLayOutInvocationAndStepDirectories() {
        Path invocation = OutputNamespace.invocationDirectory(Path.of("/out"), "Lecture Notes (FR)", "abc-123");

        assertThat(invocation).isEqualTo(Path.of("/out/lecture-notes-fr/abc-123"));
        assertThat(OutputNamespace.stepDirectory(invocation, 3, "Speech Translator"))
            .isEqualTo(Path.of("/out/lecture-notes-fr/abc-123/03-speech-translator"));
    }

    @Test
    void shouldFallBackForNamesWithoutSlugCharacters() {
        assertThat(OutputNamespace.slug("***")).isEqualTo("entry");
    }
}
