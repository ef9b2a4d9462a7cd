package app.simgate.gateway.catalog.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Platform(
        @JsonProperty("platform_id") String platformId,
        String name,
        @JsonProperty("platform_type") String platformType,
        String description,
        String version,
        @JsonProperty("memory_size") Double memorySize,
        @JsonProperty("iwps_enabled") Boolean iwpsEnabled
) {
}
