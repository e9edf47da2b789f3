package io.lighting.quill.view;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Objects;

/**
 * Templates packaged with the application. Resources never change, so the version stamp is constant.
 */
public final class ClasspathTemplateSource implements TemplateSource {
    private final ClassLoader classLoader;
    private final String prefix;

    public ClasspathTemplateSource(String prefix) {
        this(ClasspathTemplateSource.class.getClassLoader(), prefix);
    }

    public ClasspathTemplateSource(ClassLoader classLoader, String prefix) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        String normalized = Objects.requireNonNull(prefix, "prefix").replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (!normalized.isEmpty() && !normalized.endsWith("/")) {
            normalized = normalized + "/";
        }
        this.prefix = normalized;
    }

    @Override
    public String read(String path) throws IOException {
        try (InputStream input = classLoader.getResourceAsStream(prefix + path)) {
            if (input == null) {
                throw new NoSuchFileException("classpath:" + prefix + path);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Override
    public long lastModified(String path) {
        return 0L;
    }

    @Override
    public boolean exists(String path) {
        return classLoader.getResource(prefix + path) != null;
    }

    @Override
    public String toString() {
        return "ClasspathTemplateSource[" + prefix + "]";
    }
}
