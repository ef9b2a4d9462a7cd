package app.simgate.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.upstream")
public record UpstreamProps(
        String proxyUrl,
        Duration connectTimeout,
        Retry retry
) {
    public record Retry(
            int maxAttempts,
            Duration initialBackoff,
            double multiplier,
            Duration maxBackoff
    ) {
    }
}
