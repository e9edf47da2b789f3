package io.lighting.quill.view;

/**
 * Language-bound translation lookups used by {@code @(text)} and {@code @(#key)}.
 */
public interface Translator {
    /**
     * Returns the translation of {@code key}, or {@code [key]} when no catalog has it.
     */
    String translateKey(String key);

    /**
     * Returns the translation of a literal text, or the text itself when none exists.
     */
    String translateText(String text);

    String language();
}
