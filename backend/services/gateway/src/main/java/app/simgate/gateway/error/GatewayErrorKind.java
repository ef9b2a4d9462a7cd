package app.simgate.gateway.error;

import org.springframework.http.HttpStatus;

public enum GatewayErrorKind {
    INVALID_FILTER("InvalidFilter", HttpStatus.BAD_REQUEST),
    INVALID_TENANT("InvalidTenant", HttpStatus.BAD_REQUEST),
    UNAUTHORIZED("Unauthorized", HttpStatus.UNAUTHORIZED),
    FORBIDDEN("Forbidden", HttpStatus.FORBIDDEN),
    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND),
    UPSTREAM_ERROR("UpstreamError", HttpStatus.BAD_GATEWAY),
    UPSTREAM_UNAVAILABLE("UpstreamUnavailable", HttpStatus.BAD_GATEWAY),
    UPSTREAM_TIMEOUT("UpstreamTimeout", HttpStatus.GATEWAY_TIMEOUT),
    STREAM_INTERRUPTED("StreamInterrupted", HttpStatus.BAD_GATEWAY);

    private final String code;
    private final HttpStatus status;

    GatewayErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    /**
     * Machine-readable kind rendered in error bodies.
     */
    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
