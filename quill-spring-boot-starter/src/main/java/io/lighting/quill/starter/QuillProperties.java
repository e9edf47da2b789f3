package io.lighting.quill.starter;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Quill.
 * <p>
 * Configure these properties under the "quill" prefix in application.yml:
 * <pre>{@code
 * quill:
 *   views:
 *     directory: views
 *     hot-reload: true
 *     default-layout: main
 *   i18n:
 *     directory: resources/translations
 *     default-language: en
 *   sql:
 *     backend: sqlite
 * }</pre>
 */
@ConfigurationProperties(prefix = "quill")
public class QuillProperties {

    private ViewProperties views = new ViewProperties();
    private I18nProperties i18n = new I18nProperties();
    private SqlProperties sql = new SqlProperties();

    public ViewProperties getViews() {
        return views;
    }

    public void setViews(ViewProperties views) {
        this.views = views;
    }

    public I18nProperties getI18n() {
        return i18n;
    }

    public void setI18n(I18nProperties i18n) {
        this.i18n = i18n;
    }

    public SqlProperties getSql() {
        return sql;
    }

    public void setSql(SqlProperties sql) {
        this.sql = sql;
    }

    public static class ViewProperties {
        private String directory = "views";
        private boolean classpath = false;
        private boolean hotReload = false;
        private boolean strict = false;
        private int maxIncludeDepth = 32;
        private String defaultLayout;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public boolean isClasspath() {
            return classpath;
        }

        public void setClasspath(boolean classpath) {
            this.classpath = classpath;
        }

        public boolean isHotReload() {
            return hotReload;
        }

        public void setHotReload(boolean hotReload) {
            this.hotReload = hotReload;
        }

        public boolean isStrict() {
            return strict;
        }

        public void setStrict(boolean strict) {
            this.strict = strict;
        }

        public int getMaxIncludeDepth() {
            return maxIncludeDepth;
        }

        public void setMaxIncludeDepth(int maxIncludeDepth) {
            this.maxIncludeDepth = maxIncludeDepth;
        }

        public String getDefaultLayout() {
            return defaultLayout;
        }

        public void setDefaultLayout(String defaultLayout) {
            this.defaultLayout = defaultLayout;
        }
    }

    public static class I18nProperties {
        private String directory;
        private String defaultLanguage = "en";
        private String fallbackLanguage = "en";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getDefaultLanguage() {
            return defaultLanguage;
        }

        public void setDefaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage;
        }

        public String getFallbackLanguage() {
            return fallbackLanguage;
        }

        public void setFallbackLanguage(String fallbackLanguage) {
            this.fallbackLanguage = fallbackLanguage;
        }
    }

    public static class SqlProperties {
        /**
         * Backend used when no DataSource is available: postgres, mysql, mariadb or sqlite.
         */
        private String backend = "sqlite";

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }
    }
}
