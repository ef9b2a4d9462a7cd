package app.simgate.gateway.job.domain;

import java.util.List;

/**
 * Validated listing query. Optional filters are {@code null} when absent; {@code jobTypes}
 * is empty when no type filter applies.
 */
public record NormalizedJobQuery(
        JobStatus status,
        List<JobType> jobTypes,
        String owner,
        String queue,
        String jobRequestId,
        String parentInstanceId,
        String workloadJobRoiId,
        int limit,
        String continuationToken
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 100;

    public NormalizedJobQuery {
        jobTypes = jobTypes == null ? List.of() : List.copyOf(jobTypes);
    }

    public static NormalizedJobQuery defaults() {
        return new NormalizedJobQuery(null, List.of(), null, null, null, null, null, DEFAULT_LIMIT, null);
    }
}
