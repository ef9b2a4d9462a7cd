package app.simgate.gateway.client.jobservice;

import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import app.simgate.gateway.job.domain.Job;
import app.simgate.gateway.job.domain.JobFilter;
import app.simgate.gateway.job.domain.JobPage;
import app.simgate.gateway.job.domain.JobStatus;
import app.simgate.gateway.job.domain.JobType;
import app.simgate.gateway.job.domain.NormalizedJobQuery;
import app.simgate.gateway.job.service.JobQueryNormalizer;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.upstream.UpstreamTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class JobServiceClientTest {

    private static final String BASE = "http://job-service.test/v1";
    private static final CallerCredential CREDENTIAL = new CallerCredential("tok-123");

    private MockRestServiceServer server;
    private JobServiceClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new JobServiceClient(builder.build(), UpstreamTestSupport.fastExecutor());
    }

    private static NormalizedJobQuery query(String status, String types, String limit, String token) {
        return new JobQueryNormalizer().normalize(
                new JobFilter(status, types, null, null, null, null, null, limit, token));
    }

    @Test
    void listJobs_sendsFiltersAndBearerAndReadsNativeShape() {
        server.expect(requestTo(startsWith(BASE + "/jobs?")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-123"))
                .andExpect(queryParam("Limit", "5"))
                .andExpect(queryParam("JobRequestStatus", "done"))
                .andExpect(queryParam("Type", "ISIM"))
                .andExpect(queryParam("ContinuationToken", "tok-1"))
                .andRespond(withSuccess("""
                        {
                          "Jobs": [
                            {
                              "JobRequestID": "J1",
                              "Name": "boot-test",
                              "Type": "ISIM",
                              "JobRequestStatus": "done",
                              "TenantID": "acme",
                              "PlatformID": "P7",
                              "Queue": "default",
                              "Metadata": {
                                "RequestedOn": "2024-01-01T10:00:00Z",
                                "RequestedBy": "alice",
                                "LastUpdatedOn": "2024-01-01T11:30:00"
                              },
                              "SomethingNew": {"ignored": true}
                            }
                          ],
                          "Count": 42,
                          "ContinuationToken": "tok-2"
                        }
                        """, MediaType.APPLICATION_JSON));

        JobPage page = client.listJobs(query("done", "ISIM", "5", "tok-1"), CREDENTIAL);

        server.verify();
        assertThat(page.totalCount()).isEqualTo(42);
        assertThat(page.nextContinuationToken()).isEqualTo("tok-2");
        assertThat(page.jobs()).hasSize(1);
        Job job = page.jobs().get(0);
        assertThat(job.jobId()).isEqualTo("J1");
        assertThat(job.status()).isEqualTo("done");
        assertThat(job.knownStatus()).contains(JobStatus.DONE);
        assertThat(job.jobType()).isEqualTo("ISIM");
        assertThat(job.knownType()).contains(JobType.ISIM);
        assertThat(job.tenantId()).isEqualTo("acme");
        assertThat(job.owner()).isEqualTo("alice");
        assertThat(job.createdAt()).isEqualTo("2024-01-01T10:00:00Z");
        assertThat(job.lastUpdatedAt()).isEqualTo("2024-01-01T11:30:00");
    }

    @Test
    void listJobs_usesPageSizeWhenCountMissingAndDropsEmptyToken() {
        server.expect(requestTo(BASE + "/jobs?Limit=100"))
                .andRespond(withSuccess("""
                        {"Jobs": [{"JobRequestID": "J1"}, {"JobRequestID": "J2"}], "ContinuationToken": ""}
                        """, MediaType.APPLICATION_JSON));

        JobPage page = client.listJobs(NormalizedJobQuery.defaults(), CREDENTIAL);

        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.nextContinuationToken()).isNull();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void listJobs_relaysUnknownValuesAndTimestampsVerbatim() {
        server.expect(requestTo(startsWith(BASE + "/jobs")))
                .andRespond(withSuccess("""
                        {"Jobs": [{"JobRequestID": "J9", "JobRequestStatus": "cancelled", "Type": "Quantum",
                                   "CompletedOn": "2024-01-01 10:00:00",
                                   "RequestedOn": "2024-01-01T10:00:00.000000Z"}],
                         "Count": 1}
                        """, MediaType.APPLICATION_JSON));

        JobPage page = client.listJobs(NormalizedJobQuery.defaults(), CREDENTIAL);

        assertThat(page.jobs()).singleElement().satisfies(job -> {
            assertThat(job.jobId()).isEqualTo("J9");
            assertThat(job.status()).isEqualTo("cancelled");
            assertThat(job.knownStatus()).isEmpty();
            assertThat(job.jobType()).isEqualTo("Quantum");
            assertThat(job.knownType()).isEmpty();
            assertThat(job.completedAt()).isEqualTo("2024-01-01 10:00:00");
            assertThat(job.createdAt()).isEqualTo("2024-01-01T10:00:00.000000Z");
        });
    }

    @Test
    void listJobs_unauthorizedIsNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/jobs")))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.listJobs(NormalizedJobQuery.defaults(), CREDENTIAL))
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.UNAUTHORIZED);
                    assertThat(ex.getUpstreamStatus()).isEqualTo(401);
                });
        server.verify();
    }

    @Test
    void listJobs_forbiddenIsNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/jobs")))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.listJobs(NormalizedJobQuery.defaults(), CREDENTIAL))
                .isInstanceOfSatisfying(GatewayException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.FORBIDDEN));
        server.verify();
    }

    @Test
    void listJobs_serverErrorsAreRetriedThenUnavailable() {
        server.expect(ExpectedCount.times(3), requestTo(startsWith(BASE + "/jobs")))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.listJobs(NormalizedJobQuery.defaults(), CREDENTIAL))
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.UPSTREAM_UNAVAILABLE);
                    assertThat(ex.getUpstreamStatus()).isEqualTo(503);
                });
        server.verify();
    }

    @Test
    void listJobs_recoversWhenRetrySucceeds() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/jobs")))
                .andRespond(withServerError());
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/jobs")))
                .andRespond(withSuccess("{\"Jobs\": [], \"Count\": 0}", MediaType.APPLICATION_JSON));

        JobPage page = client.listJobs(NormalizedJobQuery.defaults(), CREDENTIAL);

        assertThat(page.jobs()).isEmpty();
        server.verify();
    }

    @Test
    void listJobs_timeoutIsDistinctAndNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE + "/jobs")))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> client.listJobs(NormalizedJobQuery.defaults(), CREDENTIAL))
                .isInstanceOfSatisfying(GatewayException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.UPSTREAM_TIMEOUT));
        server.verify();
    }

    @Test
    void listJobs_rejectedContinuationTokenSurfacesAsUpstreamError() {
        server.expect(requestTo(startsWith(BASE + "/jobs")))
                .andExpect(queryParam("ContinuationToken", "expired"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"message\": \"invalid token\"}"));

        assertThatThrownBy(() -> client.listJobs(query(null, null, null, "expired"), CREDENTIAL))
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.UPSTREAM_ERROR);
                    assertThat(ex.getUpstreamStatus()).isEqualTo(400);
                    assertThat(ex.getDetails()).containsEntry("continuation_token", "expired");
                    assertThat(ex.getMessage()).contains("invalid token");
                    assertThat(ex.getDetails()).containsEntry("upstream_message", "{\"message\": \"invalid token\"}");
                });
    }

    @Test
    void getJob_readsSingleJob() {
        server.expect(requestTo(BASE + "/jobs/job/J1"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-123"))
                .andRespond(withSuccess("""
                        {"JobRequestID": "J1", "Type": "WorkloadJob", "TenantID": "acme",
                         "JobRequestStatus": "inprogress", "RequestedBy": "bob"}
                        """, MediaType.APPLICATION_JSON));

        Job job = client.getJob("J1", CREDENTIAL);

        assertThat(job.knownType()).contains(JobType.WORKLOAD_JOB);
        assertThat(job.knownStatus()).contains(JobStatus.IN_PROGRESS);
        assertThat(job.owner()).isEqualTo("bob");
    }

    @Test
    void getJob_notFoundCarriesJobId() {
        server.expect(ExpectedCount.once(), requestTo(BASE + "/jobs/job/missing"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.getJob("missing", CREDENTIAL))
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.NOT_FOUND);
                    assertThat(ex.getDetails()).containsEntry("job_id", "missing");
                });
        server.verify();
    }
}
