package app.mediafill.autofill.config;

import app.mediafill.autofill.binding.MediaFiller;
import app.mediafill.autofill.client.ResourceDirectoryClient;
import app.mediafill.autofill.client.ResourceDirectoryResolver;
import app.mediafill.autofill.mapping.MappingMode;
import app.mediafill.autofill.mapping.MappingPlanRegistry;
import app.mediafill.autofill.mapping.MediaAutoFiller;
import app.mediafill.autofill.resolve.MediaResolver;
import app.mediafill.autofill.resolve.ResourceInfo;
import app.mediafill.autofill.richtext.RichTextRewriter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AutofillAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AutofillAutoConfiguration.class));

    @Test
    void withoutBaseUrl_onlyResolverIndependentBeansExist() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(RichTextRewriter.class);
            assertThat(context).hasSingleBean(MappingPlanRegistry.class);
            assertThat(context).doesNotHaveBean(ResourceDirectoryClient.class);
            assertThat(context).doesNotHaveBean(MediaFiller.class);
            assertThat(context).doesNotHaveBean(MediaAutoFiller.class);
        });
    }

    @Test
    void withBaseUrl_wiresResourceDirectoryResolver() {
        runner.withPropertyValues(
                        "app.resource.base-url=http://resource.local",
                        "app.resource.internal-token=secret",
                        "app.resource.timeout=3s",
                        "app.autofill.mapping-mode=strict",
                        "app.autofill.max-depth=8"
                )
                .run(context -> {
                    assertThat(context).hasSingleBean(ResourceDirectoryClient.class);
                    assertThat(context).hasSingleBean(ResourceDirectoryResolver.class);
                    assertThat(context).hasSingleBean(MediaAutoFiller.class);
                    assertThat(context.getBean(MediaFiller.class).defaultTimeout()).isEqualTo(Duration.ofSeconds(3));
                    assertThat(context.getBean(MappingPlanRegistry.class).mode()).isEqualTo(MappingMode.STRICT);

                    ResourceClientProps props = context.getBean(ResourceClientProps.class);
                    assertThat(props.internalToken()).isEqualTo("secret");
                    assertThat(props.maxBatchSize()).isEqualTo(100);
                    assertThat(props.expiresIn()).isEqualTo(3600L);
                    assertThat(props.includeVariants()).isTrue();
                });
    }

    @Test
    void customResolver_replacesResourceDirectoryResolver() {
        runner.withUserConfiguration(StaticResolverConfig.class)
                .withPropertyValues("app.resource.base-url=http://resource.local")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ResourceDirectoryResolver.class);
                    assertThat(context).hasSingleBean(MediaResolver.class);
                    assertThat(context).hasSingleBean(MediaAutoFiller.class);
                });
    }

    @Test
    void customAttributes_configureRichTextRewriter() {
        runner.withUserConfiguration(StaticResolverConfig.class)
                .withPropertyValues("app.autofill.marker-attribute=data-file", "app.autofill.url-attribute=href")
                .run(context -> {
                    RichTextRewriter rewriter = context.getBean(RichTextRewriter.class);
                    String output = rewriter.rewrite("<a data-file=\"f1\" href=\"#\">",
                            Map.of("f1", ResourceInfo.resolved("https://cdn/f1")));

                    assertThat(output).isEqualTo("<a data-file=\"f1\" href=\"https://cdn/f1\">");
                });
    }

    @Test
    void autofillProps_defaultToMapperDefaults() {
        runner.run(context -> {
            AutofillProps props = context.getBean(AutofillProps.class);

            assertThat(props.maxDepth()).isEqualTo(MediaAutoFiller.DEFAULT_MAX_DEPTH);
            assertThat(props.mappingMode()).isEqualTo(MappingMode.LENIENT);
            assertThat(props.markerAttribute()).isEqualTo(RichTextRewriter.DEFAULT_MARKER_ATTRIBUTE);
        });
    }

    @Test
    void invalidProperties_failStartup() {
        runner.withPropertyValues("app.autofill.max-depth=1000", "app.autofill.marker-attribute=bad attr")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    static class StaticResolverConfig {

        @Bean
        MediaResolver staticResolver() {
            return (ids, timeout) -> Map.of();
        }
    }
}
