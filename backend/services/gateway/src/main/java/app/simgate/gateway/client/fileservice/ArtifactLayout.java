package app.simgate.gateway.client.fileservice;

import app.simgate.gateway.job.domain.JobType;

import java.util.List;
import java.util.Optional;

/**
 * Where a job's output files live on the file service, by job type.
 */
public enum ArtifactLayout {
    IWPS("iwps"),
    ISIM("isim"),
    COHO("coho"),
    WORKLOAD_LOGS(null);

    private final String artifactType;

    ArtifactLayout(String artifactType) {
        this.artifactType = artifactType;
    }

    public static ArtifactLayout forJobType(JobType type) {
        if (type == null) {
            return IWPS;
        }
        return switch (type) {
            case ISIM -> ISIM;
            case COHO, NOVA_COHO -> COHO;
            case WORKLOAD_JOB, WORKLOAD_JOB_ROI -> WORKLOAD_LOGS;
            default -> IWPS;
        };
    }

    public List<String> listSegments(String jobId) {
        if (this == WORKLOAD_LOGS) {
            return List.of("fs", "files", jobId, "logs");
        }
        return List.of("fs", "files", jobId, artifactType, "artifacts", "out");
    }

    /**
     * Path of the download for {@code filename}. Workload logs are only served as the
     * {@code simics} and {@code serialconsole} archives, picked by the requested name; a name
     * matching neither has no path.
     */
    public Optional<List<String>> fileSegments(String jobId, String filename) {
        if (this == WORKLOAD_LOGS) {
            return logArchive(filename).map(archive -> List.of("fs", "files", jobId, "logs", "all", archive));
        }
        return Optional.of(List.of("fs", "files", jobId, artifactType, "artifacts", "out", filename));
    }

    static Optional<String> logArchive(String filename) {
        if (filename.contains("serialconsole")) {
            return Optional.of("serialconsole");
        }
        if (filename.contains("simics")) {
            return Optional.of("simics");
        }
        return Optional.empty();
    }

    /**
     * JSON field of the listing response that holds the entries.
     */
    public String listingField() {
        return this == WORKLOAD_LOGS ? "children" : "files";
    }
}
