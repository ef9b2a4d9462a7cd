package app.simgate.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * @param hostTemplate base URL pattern with a {@code {tenant}} placeholder
 * @param tenantHosts  explicit tenant to base URL overrides, checked before the template
 * @param timeout      read timeout for file transfers
 */
@ConfigurationProperties(prefix = "app.file-service")
public record FileServiceProps(
        String hostTemplate,
        Map<String, String> tenantHosts,
        Duration timeout
) {
    public FileServiceProps {
        tenantHosts = tenantHosts == null ? Map.of() : Map.copyOf(tenantHosts);
    }
}
