package app.simgate.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "app.cors")
public record CorsProps(
        List<String> origins,
        List<String> methods,
        List<String> headers
) {
    public List<String> originsOrDefault() {
        return origins == null || origins.isEmpty()
                ? List.of("http://localhost:3000", "http://localhost:8000")
                : origins;
    }

    public List<String> methodsOrDefault() {
        return methods == null || methods.isEmpty() ? List.of("GET", "POST", "OPTIONS") : methods;
    }

    public List<String> headersOrDefault() {
        return headers == null || headers.isEmpty() ? List.of("*") : headers;
    }
}
