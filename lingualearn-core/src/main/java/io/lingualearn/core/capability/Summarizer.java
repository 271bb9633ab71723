package io.lingualearn.core.capability;

public interface Summarizer {
    String summarize(String text);
}
