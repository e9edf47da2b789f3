package io.lighting.quill.view;

import java.io.IOException;

/**
 * Where template text comes from. Paths are relative, use {@code /} separators and include the extension.
 */
public interface TemplateSource {
    /**
     * @throws java.nio.file.NoSuchFileException when the template does not exist
     */
    String read(String path) throws IOException;

    /**
     * A version stamp that changes whenever the template changes; sources without
     * change tracking return a constant.
     */
    long lastModified(String path) throws IOException;

    boolean exists(String path);
}
