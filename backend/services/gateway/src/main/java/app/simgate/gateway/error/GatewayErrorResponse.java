package app.simgate.gateway.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GatewayErrorResponse(
        String kind,
        String message,
        @JsonProperty("accepted_values") List<String> acceptedValues,
        @JsonProperty("upstream_status") Integer upstreamStatus,
        Map<String, String> details,
        Instant timestamp
) {
    public static GatewayErrorResponse from(GatewayException ex) {
        return new GatewayErrorResponse(
                ex.getKind().code(),
                ex.getMessage(),
                ex.getAcceptedValues(),
                ex.getUpstreamStatus(),
                ex.getDetails(),
                Instant.now()
        );
    }

    public static GatewayErrorResponse of(String kind, String message) {
        return new GatewayErrorResponse(kind, message, null, null, null, Instant.now());
    }
}
