package app.simgate.gateway.job.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Simulation job as exposed to callers. {@code tenantId} is the only routing input for
 * file access and is taken from this record on every request.
 * <p>
 * Status, type and timestamps hold the job service's values verbatim, including values
 * outside {@link JobStatus} and {@link JobType}.
 */
public record Job(
        @JsonProperty("job_id") String jobId,
        String name,
        String status,
        @JsonProperty("job_type") String jobType,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("platform_id") String platformId,
        String owner,
        String queue,
        String description,
        @JsonProperty("status_details") String statusDetails,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("completed_at") String completedAt,
        @JsonProperty("last_updated_at") String lastUpdatedAt
) {

    public Optional<JobStatus> knownStatus() {
        return JobStatus.fromWire(status);
    }

    public Optional<JobType> knownType() {
        return JobType.fromWire(jobType);
    }
}
