package io.lighting.quill.view;

import com.fasterxml.jackson.databind.JsonNode;
import io.lighting.quill.value.Values;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-language string catalogs with a fallback language.
 * <p>
 * Catalogs can be replaced at runtime; translators handed out earlier observe the new entries.
 */
public final class TranslationSystem {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationSystem.class);

    private final Map<String, Map<String, String>> catalogs = new ConcurrentHashMap<>();
    private volatile String defaultLanguage;
    private volatile String fallbackLanguage;

    public TranslationSystem() {
        this("en", "en");
    }

    public TranslationSystem(String defaultLanguage, String fallbackLanguage) {
        this.defaultLanguage = requireLanguage(defaultLanguage, "defaultLanguage");
        this.fallbackLanguage = requireLanguage(fallbackLanguage, "fallbackLanguage");
    }

    public TranslationSystem defaultLanguage(String language) {
        this.defaultLanguage = requireLanguage(language, "defaultLanguage");
        return this;
    }

    public TranslationSystem fallbackLanguage(String language) {
        this.fallbackLanguage = requireLanguage(language, "fallbackLanguage");
        return this;
    }

    public String defaultLanguage() {
        return defaultLanguage;
    }

    public String fallbackLanguage() {
        return fallbackLanguage;
    }

    public TranslationSystem addTranslations(String language, Map<String, String> translations) {
        requireLanguage(language, "language");
        Objects.requireNonNull(translations, "translations");
        catalogs.put(language, Map.copyOf(translations));
        return this;
    }

    /**
     * Loads a flat JSON object of string entries. Non-string members are ignored.
     */
    public TranslationSystem loadJson(String language, String json) {
        JsonNode root;
        try {
            root = Values.mapper().readTree(json);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid translation JSON for language " + language, ex);
        }
        return addTranslations(language, flatten(root));
    }

    public TranslationSystem loadJson(String language, InputStream input) throws IOException {
        Objects.requireNonNull(input, "input");
        return addTranslations(language, flatten(Values.mapper().readTree(input)));
    }

    /**
     * Loads every {@code <language>.json} file of a directory. Unreadable files are skipped.
     */
    public TranslationSystem loadDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            LOGGER.warn("Translation directory {} does not exist", directory);
            return this;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String language = name.substring(0, name.length() - ".json".length());
                try (InputStream input = Files.newInputStream(file)) {
                    loadJson(language, input);
                    LOGGER.info("Loaded {} translations for language '{}' from {}",
                        catalogs.get(language).size(), language, file);
                } catch (IOException ex) {
                    LOGGER.warn("Skipping unreadable translation file {}: {}", file, ex.getMessage());
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list translation directory " + directory, ex);
        }
        return this;
    }

    public boolean hasLanguage(String language) {
        return catalogs.containsKey(language);
    }

    public Set<String> availableLanguages() {
        return new TreeSet<>(catalogs.keySet());
    }

    public Translator translator() {
        return translator(defaultLanguage);
    }

    public Translator translator(String language) {
        return new CatalogTranslator(language == null ? defaultLanguage : language);
    }

    private String lookup(String language, String key) {
        Map<String, String> catalog = catalogs.get(language);
        if (catalog != null) {
            String value = catalog.get(key);
            if (value != null) {
                return value;
            }
        }
        String fallback = fallbackLanguage;
        if (!fallback.equals(language)) {
            Map<String, String> fallbackCatalog = catalogs.get(fallback);
            if (fallbackCatalog != null) {
                return fallbackCatalog.get(key);
            }
        }
        return null;
    }

    private static Map<String, String> flatten(JsonNode root) {
        Map<String, String> entries = new LinkedHashMap<>();
        if (root == null || !root.isObject()) {
            return entries;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                entries.put(field.getKey(), field.getValue().asText());
            }
        }
        return entries;
    }

    private static String requireLanguage(String language, String name) {
        Objects.requireNonNull(language, name);
        if (language.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return language;
    }

    private final class CatalogTranslator implements Translator {
        private final String language;

        private CatalogTranslator(String language) {
            this.language = language;
        }

        @Override
        public String translateKey(String key) {
            String value = lookup(language, key);
            return value == null ? "[" + key + "]" : value;
        }

        @Override
        public String translateText(String text) {
            String value = lookup(language, text);
            return value == null ? text : value;
        }

        @Override
        public String language() {
            return language;
        }
    }
}
