package app.simgate.gateway.client.jobservice;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Job record in the job service's wire format. Audit fields normally sit under
 * {@code Metadata}; some deployments return them at the top level instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobServiceJob(
        @JsonProperty("JobRequestID") String jobRequestId,
        @JsonProperty("Name") String name,
        @JsonProperty("Type") String type,
        @JsonProperty("JobRequestStatus") String status,
        @JsonProperty("TenantID") String tenantId,
        @JsonProperty("PlatformID") String platformId,
        @JsonProperty("Queue") String queue,
        @JsonProperty("Description") String description,
        @JsonProperty("JobRequestStatusDetails") String statusDetails,
        @JsonProperty("CompletedOn") String completedOn,
        @JsonProperty("RequestedOn") String requestedOn,
        @JsonProperty("RequestedBy") String requestedBy,
        @JsonProperty("LastUpdatedOn") String lastUpdatedOn,
        @JsonProperty("Metadata") JobServiceMetadata metadata
) {
}
