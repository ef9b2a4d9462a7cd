package app.simgate.gateway.job.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle states reported by the job service. Wire values are lower case and matched
 * case-sensitively.
 */
public enum JobStatus {
    REQUESTED("requested"),
    QUEUED("queued"),
    ALLOCATING("allocating"),
    ALLOCATED("allocated"),
    BOOTING("booting"),
    IN_PROGRESS("inprogress"),
    CHECKPOINTING("checkpointing"),
    DONE("done"),
    ERROR("error"),
    RELEASING("releasing"),
    RELEASED("released"),
    COMPLETE("complete");

    private static final List<String> WIRE_VALUES = Arrays.stream(values()).map(JobStatus::wireValue).toList();

    private final String wireValue;

    JobStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<JobStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (JobStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    public static List<String> wireValues() {
        return WIRE_VALUES;
    }
}
