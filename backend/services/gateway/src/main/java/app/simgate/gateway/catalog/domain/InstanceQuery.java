package app.simgate.gateway.catalog.domain;

public record InstanceQuery(
        int limit,
        int offset,
        String platformId,
        Boolean available
) {
}
