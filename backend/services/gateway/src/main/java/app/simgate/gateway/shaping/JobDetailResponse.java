package app.simgate.gateway.shaping;

import app.simgate.gateway.job.domain.Job;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param fileCount number of output files, or {@code null} when the file service could not be asked
 */
public record JobDetailResponse(
        Job job,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("file_count") Integer fileCount
) {
}
