package app.simgate.gateway.tenant;

import app.simgate.gateway.config.FileServiceProps;
import app.simgate.gateway.error.GatewayException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a job's tenant id to the base URL of that tenant's file service.
 * <p>
 * Explicit overrides win over the host template. Nothing is remembered between calls, so a
 * job belonging to another tenant is always routed to that tenant's host.
 */
@Component
public class TenantResolver {

    static final String PLACEHOLDER = "{tenant}";
    static final String DEFAULT_TEMPLATE = "https://gw-{tenant}.workloadmgr.example.com";

    // DNS label: letters, digits and inner hyphens, 1 to 63 characters.
    private static final Pattern TENANT_ID = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?$");

    private final String hostTemplate;
    private final Map<String, String> tenantHosts;

    public TenantResolver(FileServiceProps props) {
        this.hostTemplate = StringUtils.hasText(props.hostTemplate()) ? props.hostTemplate() : DEFAULT_TEMPLATE;
        this.tenantHosts = props.tenantHosts();
        if (!hostTemplate.contains(PLACEHOLDER)) {
            throw new IllegalStateException("app.file-service.host-template must contain " + PLACEHOLDER);
        }
    }

    public URI resolveFileServiceHost(String tenantId) {
        if (tenantId == null || !TENANT_ID.matcher(tenantId).matches()) {
            throw GatewayException.invalidTenant(tenantId);
        }
        String override = tenantHosts.get(tenantId);
        String base = override != null ? override : hostTemplate.replace(PLACEHOLDER, tenantId);
        return URI.create(stripTrailingSlash(base));
    }

    private static String stripTrailingSlash(String value) {
        String result = value.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
