package io.lighting.quill.view;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class FileSystemTemplateSource implements TemplateSource {
    private final Path root;

    public FileSystemTemplateSource(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Override
    public String read(String path) throws IOException {
        return Files.readString(resolve(path), StandardCharsets.UTF_8);
    }

    @Override
    public long lastModified(String path) throws IOException {
        return Files.getLastModifiedTime(resolve(path)).toMillis();
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    public Path root() {
        return root;
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Template path escapes the view directory: " + path);
        }
        return resolved;
    }

    @Override
    public String toString() {
        return "FileSystemTemplateSource[" + root + "]";
    }
}
