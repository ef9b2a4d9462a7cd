package app.simgate.gateway.job.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum JobType {
    INSTANCE("Instance"),
    WORKLOAD_JOB("WorkloadJob"),
    WORKLOAD_JOB_ROI("WorkloadJobROI"),
    IWPS("IWPS"),
    ISIM("ISIM"),
    COHO("Coho"),
    NOVA_COHO("NovaCoho"),
    CUSTOM("Custom");

    private static final List<String> WIRE_VALUES = Arrays.stream(values()).map(JobType::wireValue).toList();

    private final String wireValue;

    JobType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<JobType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireValue.equals(value))
                .findFirst();
    }

    public static List<String> wireValues() {
        return WIRE_VALUES;
    }
}
