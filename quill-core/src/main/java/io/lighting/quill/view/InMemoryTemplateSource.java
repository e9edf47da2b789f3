package io.lighting.quill.view;

import java.nio.file.NoSuchFileException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Templates held in memory, for embedded views and tests. Every {@link #put} bumps the version stamp.
 */
public final class InMemoryTemplateSource implements TemplateSource {
    private final Map<String, Entry> templates = new ConcurrentHashMap<>();
    private final AtomicLong versions = new AtomicLong();

    public InMemoryTemplateSource put(String path, String source) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(source, "source");
        templates.put(path, new Entry(source, versions.incrementAndGet()));
        return this;
    }

    public InMemoryTemplateSource remove(String path) {
        templates.remove(path);
        return this;
    }

    @Override
    public String read(String path) throws NoSuchFileException {
        return entry(path).source();
    }

    @Override
    public long lastModified(String path) throws NoSuchFileException {
        return entry(path).version();
    }

    @Override
    public boolean exists(String path) {
        return templates.containsKey(path);
    }

    private Entry entry(String path) throws NoSuchFileException {
        Entry entry = templates.get(path);
        if (entry == null) {
            throw new NoSuchFileException(path);
        }
        return entry;
    }

    private record Entry(String source, long version) {
    }
}
