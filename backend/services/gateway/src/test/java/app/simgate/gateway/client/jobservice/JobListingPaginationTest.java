package app.simgate.gateway.client.jobservice;

import app.simgate.gateway.job.domain.Job;
import app.simgate.gateway.job.domain.JobFilter;
import app.simgate.gateway.job.domain.JobPage;
import app.simgate.gateway.job.service.JobQueryNormalizer;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.upstream.UpstreamTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Walks a deterministic seven-job listing three at a time through continuation tokens.
 */
class JobListingPaginationTest {

    private static final String BASE = "http://job-service.test/v1";
    private static final List<String> ALL_IDS = IntStream.rangeClosed(1, 7).mapToObj(i -> "J" + i).toList();

    private static String page(List<String> ids, String token) {
        String jobs = ids.stream()
                .map(id -> "{\"JobRequestID\": \"" + id + "\", \"JobRequestStatus\": \"done\", \"TenantID\": \"acme\"}")
                .collect(Collectors.joining(","));
        String tokenField = token == null ? "" : ", \"ContinuationToken\": \"" + token + "\"";
        return "{\"Jobs\": [" + jobs + "], \"Count\": " + ids.size() + tokenField + "}";
    }

    @Test
    void listJobs_followingTokensDeliversEveryJobOnce() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        JobServiceClient client = new JobServiceClient(builder.build(), UpstreamTestSupport.fastExecutor());
        JobQueryNormalizer normalizer = new JobQueryNormalizer();

        server.expect(requestTo(not(containsString("ContinuationToken"))))
                .andExpect(queryParam("Limit", "3"))
                .andRespond(withSuccess(page(ALL_IDS.subList(0, 3), "after-J3"), MediaType.APPLICATION_JSON));
        server.expect(queryParam("ContinuationToken", "after-J3"))
                .andRespond(withSuccess(page(ALL_IDS.subList(3, 6), "after-J6"), MediaType.APPLICATION_JSON));
        server.expect(queryParam("ContinuationToken", "after-J6"))
                .andRespond(withSuccess(page(ALL_IDS.subList(6, 7), null), MediaType.APPLICATION_JSON));

        CallerCredential credential = new CallerCredential("tok");
        JobFilter filter = new JobFilter("done", null, null, null, null, null, null, "3", null);
        List<String> seen = new ArrayList<>();
        String token = null;
        int pages = 0;
        do {
            JobPage page = client.listJobs(normalizer.normalize(filter.withContinuationToken(token)), credential);
            List<String> ids = page.jobs().stream().map(Job::jobId).toList();
            assertThat(ids).isNotEmpty();
            seen.addAll(ids);
            assertThat(seen).doesNotHaveDuplicates();
            token = page.nextContinuationToken();
            pages++;
        } while (token != null);

        server.verify();
        assertThat(pages).isEqualTo(3);
        assertThat(seen).containsExactlyElementsOf(ALL_IDS);
    }
}
