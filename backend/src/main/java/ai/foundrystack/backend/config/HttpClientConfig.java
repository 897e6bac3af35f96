package ai.foundrystack.backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration class for HTTP client beans.
 *
 * Two RestTemplates are provided:
 * - "model" for the AI model provider, with a read timeout long enough for a full completion
 * - "internal" for the downstream agent services (retriever), which answer quickly
 */
@Configuration
public class HttpClientConfig {

    /**
     * RestTemplate used for calls to the AI model provider.
     *
     * @param builder the RestTemplateBuilder provided by Spring Boot
     * @param readTimeoutSeconds read timeout for a single completion request
     * @return a configured RestTemplate
     */
    @Bean
    @Primary
    @Qualifier("model")
    public RestTemplate modelRestTemplate(
            RestTemplateBuilder builder,
            @Value("${app.model.read-timeout-seconds:120}") int readTimeoutSeconds) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(10))
            .setReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .build();
    }

    /**
     * RestTemplate used for service-to-service calls to the downstream agent services.
     *
     * @param builder the RestTemplateBuilder provided by Spring Boot
     * @param readTimeoutSeconds read timeout for downstream calls
     * @return a configured RestTemplate
     */
    @Bean
    @Qualifier("internal")
    public RestTemplate internalRestTemplate(
            RestTemplateBuilder builder,
            @Value("${agent.retriever.read-timeout-seconds:30}") int readTimeoutSeconds) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .build();
    }
}
