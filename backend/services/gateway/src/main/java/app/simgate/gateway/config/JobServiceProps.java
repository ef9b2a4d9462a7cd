package app.simgate.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.job-service")
public record JobServiceProps(
        String baseUrl,
        Duration timeout,
        String userAgent
) {
}
