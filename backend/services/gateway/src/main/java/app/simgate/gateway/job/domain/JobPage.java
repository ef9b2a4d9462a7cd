package app.simgate.gateway.job.domain;

import java.util.List;

/**
 * One page of the job service's continuation-token listing. {@code nextContinuationToken}
 * is {@code null} on the last page.
 */
public record JobPage(
        List<Job> jobs,
        int totalCount,
        String nextContinuationToken
) {
    public JobPage {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public boolean hasMore() {
        return nextContinuationToken != null;
    }
}
