package app.simgate.gateway.shaping;

import app.simgate.gateway.job.domain.Job;
import app.simgate.gateway.job.domain.JobPage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseShaperTest {

    private final ResponseShaper shaper = new ResponseShaper();
    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private static Job job(String id) {
        return new Job(id, "n", "inprogress", "NovaCoho", "acme", "P1", "alice", "q",
                null, null, "2024-01-01T10:00:00Z", null, null);
    }

    @Test
    void jobs_rendersNativeShapeWithSnakeCaseFields() {
        JobListResponse response = shaper.jobs(new JobPage(List.of(job("J1")), 10, "t-1"));

        JsonNode json = objectMapper.valueToTree(response);

        assertThat(response.kind()).isEqualTo(ResourceKind.JOBS);
        assertThat(json.path("count").asInt()).isEqualTo(10);
        assertThat(json.path("continuation_token").asText()).isEqualTo("t-1");
        JsonNode first = json.path("jobs").get(0);
        assertThat(first.path("job_id").asText()).isEqualTo("J1");
        assertThat(first.path("status").asText()).isEqualTo("inprogress");
        assertThat(first.path("job_type").asText()).isEqualTo("NovaCoho");
        assertThat(first.path("tenant_id").asText()).isEqualTo("acme");
        assertThat(json.has("meta")).isFalse();
    }

    @Test
    void jobs_omitsTokenOnLastPage() {
        JsonNode json = objectMapper.valueToTree(shaper.jobs(new JobPage(List.of(), 0, null)));

        assertThat(json.has("continuation_token")).isFalse();
        assertThat(json.path("jobs").isArray()).isTrue();
    }

    @Test
    void legacyPage_derivesNavigationFlags() {
        Map<String, String> filters = new LinkedHashMap<>();
        filters.put("PlatformType", "Simics");
        filters.put("ISIM", null);

        LegacyPageResponse<String> middle = shaper.legacyPage(ResourceKind.PLATFORMS, List.of("a", "b"),
                95, 2, 10, filters, "name", "asc");

        assertThat(middle.kind()).isEqualTo(ResourceKind.PLATFORMS);
        assertThat(middle.meta().totalPages()).isEqualTo(10);
        assertThat(middle.meta().hasNext()).isTrue();
        assertThat(middle.meta().hasPrevious()).isTrue();
        assertThat(middle.filtersApplied()).containsExactly(Map.entry("PlatformType", "Simics"));

        JsonNode json = objectMapper.valueToTree(middle);
        assertThat(json.path("meta").path("page_size").asInt()).isEqualTo(10);
        assertThat(json.path("filters_applied").path("PlatformType").asText()).isEqualTo("Simics");
        assertThat(json.path("sort_by").asText()).isEqualTo("name");
        assertThat(json.has("resourceKind")).isFalse();
    }

    @Test
    void pageMeta_firstAndLastPages() {
        PageMeta first = PageMeta.of(20, 1, 10);
        PageMeta last = PageMeta.of(20, 2, 10);
        PageMeta empty = PageMeta.of(0, 1, 10);

        assertThat(first.hasPrevious()).isFalse();
        assertThat(first.hasNext()).isTrue();
        assertThat(last.hasNext()).isFalse();
        assertThat(last.hasPrevious()).isTrue();
        assertThat(empty.totalPages()).isZero();
        assertThat(empty.hasNext()).isFalse();
    }

    @Test
    void files_preservesOrderAndCounts() {
        FileListResponse response = shaper.files("J1", List.of("z.log", "a.log"));

        JsonNode json = objectMapper.valueToTree(response);

        assertThat(json.path("files").get(0).asText()).isEqualTo("z.log");
        assertThat(json.path("total_files").asInt()).isEqualTo(2);
        assertThat(json.path("job_id").asText()).isEqualTo("J1");
    }

    @Test
    void jobDetail_omitsUnknownFileCount() {
        JsonNode withCount = objectMapper.valueToTree(shaper.jobDetail(job("J1"), 3));
        JsonNode withoutCount = objectMapper.valueToTree(shaper.jobDetail(job("J1"), null));

        assertThat(withCount.path("file_count").asInt()).isEqualTo(3);
        assertThat(withoutCount.has("file_count")).isFalse();
        assertThat(withoutCount.path("job").path("job_id").asText()).isEqualTo("J1");
    }
}
