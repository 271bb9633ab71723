package io.lingualearn.core.capability;

import java.nio.file.Path;

/**
 * OCR over an image file, such as a whiteboard capture.
 */
public interface TextExtractor {
    String extractText(Path image);
}
