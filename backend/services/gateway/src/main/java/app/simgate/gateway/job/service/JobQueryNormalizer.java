package app.simgate.gateway.job.service;

import app.simgate.gateway.error.GatewayException;
import app.simgate.gateway.job.domain.JobFilter;
import app.simgate.gateway.job.domain.JobStatus;
import app.simgate.gateway.job.domain.JobType;
import app.simgate.gateway.job.domain.NormalizedJobQuery;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates caller filters before anything is sent upstream. Stateless.
 */
@Component
public class JobQueryNormalizer {

    public NormalizedJobQuery normalize(JobFilter filter) {
        if (filter == null) {
            return NormalizedJobQuery.defaults();
        }
        return new NormalizedJobQuery(
                parseStatus(filter.status()),
                parseJobTypes(filter.jobType()),
                trimToNull(filter.owner()),
                trimToNull(filter.queue()),
                trimToNull(filter.jobRequestId()),
                trimToNull(filter.parentInstanceId()),
                trimToNull(filter.workloadJobRoiId()),
                parseLimit(filter.limit()),
                StringUtils.hasText(filter.continuationToken()) ? filter.continuationToken() : null
        );
    }

    JobStatus parseStatus(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return JobStatus.fromWire(raw)
                .orElseThrow(() -> GatewayException.invalidFilter("status", raw, JobStatus.wireValues()));
    }

    List<JobType> parseJobTypes(String raw) {
        if (!StringUtils.hasText(raw)) {
            return List.of();
        }
        Set<JobType> types = new LinkedHashSet<>();
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            JobType type = JobType.fromWire(trimmed)
                    .orElseThrow(() -> GatewayException.invalidFilter("job_type", trimmed, JobType.wireValues()));
            types.add(type);
        }
        return new ArrayList<>(types);
    }

    int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return NormalizedJobQuery.DEFAULT_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw GatewayException.invalidFilter("limit",
                    "Invalid limit '" + raw + "'. Expected an integer between 1 and " + NormalizedJobQuery.MAX_LIMIT);
        }
        if (limit < 1 || limit > NormalizedJobQuery.MAX_LIMIT) {
            throw GatewayException.invalidFilter("limit",
                    "Invalid limit " + limit + ". Expected an integer between 1 and " + NormalizedJobQuery.MAX_LIMIT);
        }
        return limit;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
