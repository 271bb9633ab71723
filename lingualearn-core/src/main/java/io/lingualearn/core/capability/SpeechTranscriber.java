package io.lingualearn.core.capability;

import java.nio.file.Path;

public interface SpeechTranscriber {
    String transcribe(Path audio);
}
