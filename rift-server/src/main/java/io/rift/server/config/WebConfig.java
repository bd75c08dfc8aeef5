package io.rift.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rift.server.web.RateLimitFilter;
import io.rift.server.web.WebhookSecretFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Servlet filters. Rate limiting runs first so unauthenticated floods are
 * throttled too; the secret check guards only the webhook.
 */
@Configuration(proxyBeanMethods = false)
public class WebConfig {

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(RiftServerProperties props, ObjectMapper mapper) {
        FilterRegistrationBean<RateLimitFilter> registration =
                new FilterRegistrationBean<>(new RateLimitFilter(props.getRateLimit(), mapper));
        registration.addUrlPatterns("/webhook/*", "/stats/*", "/health");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<WebhookSecretFilter> webhookSecretFilter(RiftServerProperties props,
                                                                          ObjectMapper mapper) {
        FilterRegistrationBean<WebhookSecretFilter> registration =
                new FilterRegistrationBean<>(new WebhookSecretFilter(props.getWebhookSecret(), mapper));
        registration.addUrlPatterns("/webhook/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 20);
        return registration;
    }
}
