package io.jobhive.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.client.CoreApi;
import io.jobhive.client.HttpCoreApiClient;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter(JacksonAutoConfiguration.class)
@ConditionalOnProperty(prefix = "jobhive.core", name = "url")
@EnableConfigurationProperties(CoreClientProperties.class)
public class CoreClientAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(CoreApi.class)
    CoreApi coreApi(ObjectMapper mapper, CoreClientProperties properties) {
        return new HttpCoreApiClient(mapper, properties);
    }
}
