package app.simgate.gateway.upstream;

import app.simgate.gateway.error.GatewayErrorKind;

/**
 * Remote services the gateway calls, with the kind reported once 5xx retries run out.
 */
public enum Upstream {
    JOB_SERVICE("job service", GatewayErrorKind.UPSTREAM_UNAVAILABLE),
    FILE_SERVICE("file service", GatewayErrorKind.UPSTREAM_ERROR);

    private final String displayName;
    private final GatewayErrorKind serverErrorKind;

    Upstream(String displayName, GatewayErrorKind serverErrorKind) {
        this.displayName = displayName;
        this.serverErrorKind = serverErrorKind;
    }

    public String displayName() {
        return displayName;
    }

    public GatewayErrorKind serverErrorKind() {
        return serverErrorKind;
    }
}
