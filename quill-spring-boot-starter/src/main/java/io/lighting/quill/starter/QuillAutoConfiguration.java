package io.lighting.quill.starter;

import io.lighting.quill.sql.DatabaseBackend;
import io.lighting.quill.sql.dialect.DialectResolver;
import io.lighting.quill.view.ClasspathTemplateSource;
import io.lighting.quill.view.FileSystemTemplateSource;
import io.lighting.quill.view.TemplateCache;
import io.lighting.quill.view.TemplateSource;
import io.lighting.quill.view.TranslationSystem;
import io.lighting.quill.view.ViewEngine;
import java.nio.file.Path;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(ViewEngine.class)
@EnableConfigurationProperties(QuillProperties.class)
public class QuillAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuillAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TranslationSystem translationSystem(QuillProperties properties) {
        QuillProperties.I18nProperties i18n = properties.getI18n();
        TranslationSystem translations = new TranslationSystem(i18n.getDefaultLanguage(), i18n.getFallbackLanguage());
        if (i18n.getDirectory() != null && !i18n.getDirectory().isBlank()) {
            translations.loadDirectory(Path.of(i18n.getDirectory()));
        }
        return translations;
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateSource templateSource(QuillProperties properties) {
        QuillProperties.ViewProperties views = properties.getViews();
        if (views.isClasspath()) {
            return new ClasspathTemplateSource(views.getDirectory());
        }
        return new FileSystemTemplateSource(Path.of(views.getDirectory()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateCache templateCache(TemplateSource templateSource, QuillProperties properties) {
        return new TemplateCache(templateSource, properties.getViews().isHotReload());
    }

    @Bean
    @ConditionalOnMissingBean
    public ViewEngine viewEngine(
        TemplateCache templateCache,
        TranslationSystem translationSystem,
        QuillProperties properties
    ) {
        QuillProperties.ViewProperties views = properties.getViews();
        LOGGER.info(
            "Configuring Quill views from {} (hot reload: {}, strict: {})",
            templateCache.source(),
            templateCache.isHotReload(),
            views.isStrict()
        );
        return ViewEngine.builder()
            .cache(templateCache)
            .strict(views.isStrict())
            .maxIncludeDepth(views.getMaxIncludeDepth())
            .defaultLayout(views.getDefaultLayout())
            .translations(translationSystem)
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public DatabaseBackend databaseBackend(ObjectProvider<DataSource> dataSource, QuillProperties properties) {
        DataSource available = dataSource.getIfAvailable();
        if (available != null) {
            DatabaseBackend backend = DialectResolver.resolve(available);
            LOGGER.info("Resolved Quill SQL backend {} from DataSource", backend);
            return backend;
        }
        return DatabaseBackend.fromName(properties.getSql().getBackend());
    }
}
