package app.simgate.gateway.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Failure surfaced to the caller with a distinct {@link GatewayErrorKind}.
 * <p>
 * Validation failures carry the accepted values so a caller can correct the request;
 * upstream failures carry the upstream status when one was received.
 */
public class GatewayException extends RuntimeException {

    private final GatewayErrorKind kind;
    private final List<String> acceptedValues;
    private final Integer upstreamStatus;
    private final Map<String, String> details;

    private GatewayException(GatewayErrorKind kind,
                             String message,
                             List<String> acceptedValues,
                             Integer upstreamStatus,
                             Map<String, String> details,
                             Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.acceptedValues = acceptedValues == null ? List.of() : List.copyOf(acceptedValues);
        this.upstreamStatus = upstreamStatus;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static GatewayException of(GatewayErrorKind kind, String message) {
        return new GatewayException(kind, message, null, null, null, null);
    }

    public static GatewayException invalidFilter(String filter, String value, List<String> acceptedValues) {
        String message = "Invalid " + filter + " '" + value + "'. Accepted values: " + String.join(", ", acceptedValues);
        return new GatewayException(GatewayErrorKind.INVALID_FILTER, message, acceptedValues, null,
                Map.of("filter", filter), null);
    }

    public static GatewayException invalidFilter(String filter, String message) {
        return new GatewayException(GatewayErrorKind.INVALID_FILTER, message, null, null,
                Map.of("filter", filter), null);
    }

    public static GatewayException invalidTenant(String tenantId) {
        String shown = tenantId == null ? "<missing>" : "'" + tenantId + "'";
        return new GatewayException(GatewayErrorKind.INVALID_TENANT, "Invalid tenant id " + shown, null, null,
                null, null);
    }

    public static GatewayException upstream(GatewayErrorKind kind,
                                            String message,
                                            Integer upstreamStatus,
                                            Map<String, String> details,
                                            Throwable cause) {
        return new GatewayException(kind, message, null, upstreamStatus, details, cause);
    }

    public GatewayException withDetail(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new GatewayException(kind, getMessage(), acceptedValues, upstreamStatus, merged, getCause());
    }

    public GatewayErrorKind getKind() {
        return kind;
    }

    public List<String> getAcceptedValues() {
        return acceptedValues;
    }

    public Integer getUpstreamStatus() {
        return upstreamStatus;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
