package app.simgate.gateway.client.jobservice;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobServiceJobPage(
        @JsonProperty("Jobs") List<JobServiceJob> jobs,
        @JsonProperty("Count") Integer count,
        @JsonProperty("ContinuationToken") String continuationToken
) {
}
