package app.simgate.gateway.shaping;

public enum ResourceKind {
    JOBS,
    PLATFORMS,
    INSTANCES
}
