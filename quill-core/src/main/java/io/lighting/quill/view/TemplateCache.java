package io.lighting.quill.view;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiled templates keyed by path and validated against the source's version stamp.
 * <p>
 * Reading and compiling happen outside the lock. Two threads missing the same path may both
 * compile it; the last one to finish replaces the entry. With hot reload every lookup recompiles
 * and nothing is stored.
 */
public final class TemplateCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateCache.class);

    private final TemplateSource source;
    private final boolean hotReload;
    private final Map<String, Entry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public TemplateCache(TemplateSource source, boolean hotReload) {
        this.source = Objects.requireNonNull(source, "source");
        this.hotReload = hotReload;
    }

    /**
     * @throws TemplateRenderException when the template cannot be read
     * @throws TemplateParseException when the template does not compile
     */
    public Template get(String path) {
        Objects.requireNonNull(path, "path");
        long modified = lastModified(path);
        if (!hotReload) {
            lock.readLock().lock();
            try {
                Entry entry = entries.get(path);
                if (entry != null && entry.modified() == modified) {
                    return entry.template();
                }
            } finally {
                lock.readLock().unlock();
            }
        }
        Template template = Template.parse(read(path));
        if (hotReload) {
            LOGGER.debug("Compiled template {} (hot reload)", path);
            return template;
        }
        lock.writeLock().lock();
        try {
            Entry previous = entries.put(path, new Entry(template, modified));
            if (previous == null) {
                LOGGER.debug("Compiled template {} (version {})", path, modified);
            } else {
                LOGGER.debug("Recompiled template {} (version {} -> {})", path, previous.modified(), modified);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return template;
    }

    public boolean isCached(String path) {
        lock.readLock().lock();
        try {
            return entries.containsKey(path);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.debug("Cleared template cache");
    }

    public boolean isHotReload() {
        return hotReload;
    }

    public TemplateSource source() {
        return source;
    }

    private long lastModified(String path) {
        try {
            return source.lastModified(path);
        } catch (NoSuchFileException ex) {
            throw new TemplateRenderException(path, "Template not found: " + path, ex);
        } catch (IOException ex) {
            throw new TemplateRenderException(path, "Failed to stat template: " + path, ex);
        }
    }

    private String read(String path) {
        try {
            return source.read(path);
        } catch (NoSuchFileException ex) {
            throw new TemplateRenderException(path, "Template not found: " + path, ex);
        } catch (IOException ex) {
            throw new TemplateRenderException(path, "Failed to read template: " + path, ex);
        }
    }

    private record Entry(Template template, long modified) {
    }
}
