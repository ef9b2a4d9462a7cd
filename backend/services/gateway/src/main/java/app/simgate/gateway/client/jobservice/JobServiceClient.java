package app.simgate.gateway.client.jobservice;

import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import app.simgate.gateway.job.domain.Job;
import app.simgate.gateway.job.domain.JobPage;
import app.simgate.gateway.job.domain.JobType;
import app.simgate.gateway.job.domain.NormalizedJobQuery;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.upstream.Upstream;
import app.simgate.gateway.upstream.UpstreamCallExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only client for the job service. Every call carries the caller's own credential.
 */
@Component
public class JobServiceClient {
    private static final Logger log = LoggerFactory.getLogger(JobServiceClient.class);

    private final RestClient restClient;
    private final UpstreamCallExecutor executor;

    public JobServiceClient(RestClient jobServiceRestClient, UpstreamCallExecutor executor) {
        this.restClient = jobServiceRestClient;
        this.executor = executor;
    }

    /**
     * Fetches one page of jobs. The continuation token in the result is the job service's own
     * and is returned untouched.
     */
    public JobPage listJobs(NormalizedJobQuery query, CallerCredential credential) {
        Map<String, String> context = new LinkedHashMap<>();
        if (query.continuationToken() != null) {
            context.put("continuation_token", query.continuationToken());
        }
        log.debug("Listing jobs status={} types={} limit={} continued={}",
                query.status(), query.jobTypes(), query.limit(), query.continuationToken() != null);

        JobServiceJobPage page = executor.execute(Upstream.JOB_SERVICE, "job listing", context, () ->
                restClient.get()
                        .uri(uriBuilder -> listUri(uriBuilder, query))
                        .header(HttpHeaders.AUTHORIZATION, credential.bearerHeader())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(JobServiceJobPage.class));

        if (page == null) {
            return new JobPage(List.of(), 0, null);
        }
        List<Job> jobs = Optional.ofNullable(page.jobs()).orElse(List.of()).stream()
                .map(JobServiceJobMapper::toJob)
                .toList();
        int count = page.count() != null ? page.count() : jobs.size();
        String next = page.continuationToken() == null || page.continuationToken().isEmpty()
                ? null : page.continuationToken();
        return new JobPage(jobs, count, next);
    }

    public Job getJob(String jobId, CallerCredential credential) {
        log.debug("Fetching job jobId={}", jobId);
        JobServiceJob job = executor.execute(Upstream.JOB_SERVICE, "job lookup", Map.of("job_id", jobId), () ->
                restClient.get()
                        .uri("/jobs/job/{jobId}", jobId)
                        .header(HttpHeaders.AUTHORIZATION, credential.bearerHeader())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(JobServiceJob.class));
        if (job == null) {
            throw GatewayException.of(GatewayErrorKind.NOT_FOUND, "Job " + jobId + " not found")
                    .withDetail("job_id", jobId);
        }
        return JobServiceJobMapper.toJob(job);
    }

    private static URI listUri(UriBuilder uriBuilder, NormalizedJobQuery query) {
        // Values go through template variables so that '+' and ':' in tokens are encoded strictly.
        Map<String, Object> values = new LinkedHashMap<>();
        uriBuilder.path("/jobs");
        queryParamIfPresent(uriBuilder, values, "Limit", String.valueOf(query.limit()));
        if (query.status() != null) {
            queryParamIfPresent(uriBuilder, values, "JobRequestStatus", query.status().wireValue());
        }
        if (!query.jobTypes().isEmpty()) {
            queryParamIfPresent(uriBuilder, values, "Type", query.jobTypes().stream()
                    .map(JobType::wireValue)
                    .collect(Collectors.joining(",")));
        }
        queryParamIfPresent(uriBuilder, values, "RequestedBy", query.owner());
        queryParamIfPresent(uriBuilder, values, "Queue", query.queue());
        queryParamIfPresent(uriBuilder, values, "JobRequestID", query.jobRequestId());
        queryParamIfPresent(uriBuilder, values, "ParentInstanceID", query.parentInstanceId());
        queryParamIfPresent(uriBuilder, values, "WorkloadJobROIID", query.workloadJobRoiId());
        queryParamIfPresent(uriBuilder, values, "ContinuationToken", query.continuationToken());
        return uriBuilder.build(values);
    }

    private static void queryParamIfPresent(UriBuilder uriBuilder, Map<String, Object> values, String name, String value) {
        if (value != null) {
            uriBuilder.queryParam(name, "{" + name + "}");
            values.put(name, value);
        }
    }
}
