package app.simgate.gateway.shaping;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FileListResponse(
        List<String> files,
        @JsonProperty("total_files") int totalFiles,
        @JsonProperty("job_id") String jobId
) {
}
