package io.lighting.quill.starter;

import static org.assertj.core.api.Assertions.assertThat;

import io.lighting.quill.sql.DatabaseBackend;
import io.lighting.quill.value.Values;
import io.lighting.quill.view.ClasspathTemplateSource;
import io.lighting.quill.view.FileSystemTemplateSource;
import io.lighting.quill.view.InMemoryTemplateSource;
import io.lighting.quill.view.TemplateCache;
import io.lighting.quill.view.TemplateSource;
import io.lighting.quill.view.TranslationSystem;
import io.lighting.quill.view.ViewEngine;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class QuillAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(QuillAutoConfiguration.class));

    @Test
    void registersDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ViewEngine.class);
            assertThat(context).hasSingleBean(TemplateCache.class);
            assertThat(context).hasSingleBean(TranslationSystem.class);
            assertThat(context.getBean(TemplateSource.class)).isInstanceOf(FileSystemTemplateSource.class);
            assertThat(context.getBean(TemplateCache.class).isHotReload()).isFalse();
            assertThat(context.getBean(DatabaseBackend.class)).isEqualTo(DatabaseBackend.SQLITE);
        });
    }

    @Test
    void bindsViewAndTranslationProperties(@TempDir Path i18n) throws Exception {
        Files.writeString(i18n.resolve("de.json"), "{\"hello\":\"Hallo\"}");
        contextRunner
            .withPropertyValues(
                "quill.views.directory=quill-views",
                "quill.views.classpath=true",
                "quill.views.hot-reload=true",
                "quill.views.default-layout=site",
                "quill.i18n.directory=" + i18n,
                "quill.i18n.default-language=de"
            )
            .run(context -> {
                assertThat(context.getBean(TemplateSource.class)).isInstanceOf(ClasspathTemplateSource.class);
                assertThat(context.getBean(TemplateCache.class).isHotReload()).isTrue();
                assertThat(context.getBean(TranslationSystem.class).availableLanguages()).containsExactly("de");

                ViewEngine engine = context.getBean(ViewEngine.class);
                assertThat(engine.render("hello", Values.objectOf("name", "Ann")))
                    .isEqualTo("<main>Hi Ann Hallo</main>");
            });
    }

    @Test
    void readsBackendFromProperties() {
        contextRunner
            .withPropertyValues("quill.sql.backend=postgresql")
            .run(context -> assertThat(context.getBean(DatabaseBackend.class)).isEqualTo(DatabaseBackend.POSTGRES));
    }

    @Test
    void resolvesBackendFromDataSource() {
        contextRunner
            .withPropertyValues("quill.sql.backend=mysql")
            .withBean(DataSource.class, () -> {
                JdbcDataSource dataSource = new JdbcDataSource();
                dataSource.setURL("jdbc:h2:mem:starter;DB_CLOSE_DELAY=-1");
                return dataSource;
            })
            .run(context -> assertThat(context.getBean(DatabaseBackend.class)).isEqualTo(DatabaseBackend.SQLITE));
    }

    @Test
    void backsOffForUserDefinedBeans() {
        InMemoryTemplateSource source = new InMemoryTemplateSource().put("x.html", "custom");
        contextRunner
            .withBean(TemplateSource.class, () -> source)
            .run(context -> {
                assertThat(context.getBean(TemplateSource.class)).isSameAs(source);
                assertThat(context.getBean(ViewEngine.class).render("x", null)).isEqualTo("custom");
            });
    }

    @Test
    void rejectsUnknownBackendName() {
        contextRunner
            .withPropertyValues("quill.sql.backend=db2")
            .run(context -> assertThat(context).hasFailed());
    }
}
