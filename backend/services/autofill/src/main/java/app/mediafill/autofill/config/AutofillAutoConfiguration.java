package app.mediafill.autofill.config;

import app.mediafill.autofill.binding.MediaFiller;
import app.mediafill.autofill.client.ResourceDirectoryClient;
import app.mediafill.autofill.client.ResourceDirectoryResolver;
import app.mediafill.autofill.mapping.MappingPlanRegistry;
import app.mediafill.autofill.mapping.MediaAutoFiller;
import app.mediafill.autofill.resolve.MediaResolver;
import app.mediafill.autofill.richtext.RichTextRewriter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@AutoConfiguration
@EnableConfigurationProperties({ResourceClientProps.class, AutofillProps.class})
public class AutofillAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "app.resource", name = "base-url")
    static class ResourceDirectoryConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "resourceRestClient")
        public RestClient resourceRestClient(ResourceClientProps props) {
            return RestClient.builder()
                    .baseUrl(props.baseUrl())
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean
        public ResourceDirectoryClient resourceDirectoryClient(RestClient resourceRestClient, ResourceClientProps props) {
            return new ResourceDirectoryClient(resourceRestClient, props);
        }

        @Bean
        @ConditionalOnMissingBean(MediaResolver.class)
        public ResourceDirectoryResolver resourceDirectoryResolver(ResourceDirectoryClient client, ResourceClientProps props) {
            return new ResourceDirectoryResolver(client, props.maxBatchSize(), props.maxConcurrentRequests());
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public RichTextRewriter richTextRewriter(AutofillProps props) {
        return RichTextRewriter.forAttributes(props.markerAttribute(), props.urlAttribute());
    }

    @Bean
    @ConditionalOnMissingBean
    public MappingPlanRegistry mappingPlanRegistry(AutofillProps props) {
        return new MappingPlanRegistry(props.mappingMode());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MediaResolver.class)
    public MediaFiller mediaFiller(MediaResolver mediaResolver, ResourceClientProps props) {
        return new MediaFiller(mediaResolver, props.timeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MediaFiller.class)
    public MediaAutoFiller mediaAutoFiller(MediaFiller mediaFiller,
                                           MappingPlanRegistry mappingPlanRegistry,
                                           RichTextRewriter richTextRewriter,
                                           AutofillProps props) {
        return new MediaAutoFiller(mediaFiller, mappingPlanRegistry, richTextRewriter, props.maxDepth());
    }
}
