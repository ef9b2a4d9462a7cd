package app.simgate.gateway.job.domain;

/**
 * Raw listing filters as received from the caller, before validation.
 */
public record JobFilter(
        String status,
        String jobType,
        String owner,
        String queue,
        String jobRequestId,
        String parentInstanceId,
        String workloadJobRoiId,
        String limit,
        String continuationToken
) {
    public static JobFilter empty() {
        return new JobFilter(null, null, null, null, null, null, null, null, null);
    }

    public JobFilter withContinuationToken(String token) {
        return new JobFilter(status, jobType, owner, queue, jobRequestId, parentInstanceId,
                workloadJobRoiId, limit, token);
    }
}
