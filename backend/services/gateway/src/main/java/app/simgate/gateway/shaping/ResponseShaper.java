package app.simgate.gateway.shaping;

import app.simgate.gateway.job.domain.Job;
import app.simgate.gateway.job.domain.JobPage;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the outbound payloads. Job listings keep the job service's count and continuation
 * token as they are; nothing here converts between the two pagination styles.
 */
@Component
public class ResponseShaper {

    public JobListResponse jobs(JobPage page) {
        return new JobListResponse(page.jobs(), page.totalCount(), page.nextContinuationToken());
    }

    public JobDetailResponse jobDetail(Job job, Integer fileCount) {
        return new JobDetailResponse(job, fileCount);
    }

    public FileListResponse files(String jobId, List<String> files) {
        List<String> ordered = List.copyOf(files);
        return new FileListResponse(ordered, ordered.size(), jobId);
    }

    public <T> LegacyPageResponse<T> legacyPage(ResourceKind kind,
                                                List<T> items,
                                                long total,
                                                int page,
                                                int pageSize,
                                                Map<String, String> filters,
                                                String sortBy,
                                                String sortOrder) {
        Map<String, String> applied = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((key, value) -> {
                if (value != null) {
                    applied.put(key, value);
                }
            });
        }
        return new LegacyPageResponse<>(kind, items, PageMeta.of(total, page, pageSize), applied, sortBy, sortOrder);
    }
}
