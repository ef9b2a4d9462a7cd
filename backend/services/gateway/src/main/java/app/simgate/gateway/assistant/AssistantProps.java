package app.simgate.gateway.assistant;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.assistant")
public record AssistantProps(
        String baseUrl,
        String apiKey,
        String apiVersion,
        String model,
        Integer maxTokens,
        String systemPrompt,
        Duration timeout
) {
}
