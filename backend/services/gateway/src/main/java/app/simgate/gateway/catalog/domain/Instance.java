package app.simgate.gateway.catalog.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Simulation instance. The job service already uses these snake_case names, so the same
 * record is read from upstream and written to callers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Instance(
        @JsonProperty("instance_id") String instanceId,
        String name,
        String description,
        @JsonProperty("platform_id") String platformId,
        @JsonProperty("platform_name") String platformName,
        String status,
        @JsonProperty("is_active") Boolean active,
        @JsonProperty("is_available") Boolean available,
        @JsonProperty("in_use") Boolean inUse,
        @JsonProperty("health_status") String healthStatus,
        @JsonProperty("current_job_id") String currentJobId
) {
}
