package app.simgate.gateway.shaping;

import app.simgate.gateway.job.domain.Job;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record JobListResponse(
        List<Job> jobs,
        int count,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("continuation_token") String continuationToken
) implements Paginated<Job> {

    @Override
    public ResourceKind kind() {
        return ResourceKind.JOBS;
    }

    @Override
    public List<Job> entries() {
        return jobs;
    }
}
