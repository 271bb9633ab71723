package io.lingualearn.core.capability;

import io.lingualearn.core.catalog.LanguagePair;

public interface Translator {
    String translate(String text, LanguagePair languages);
}
