package app.simgate.gateway.client.jobservice;

import app.simgate.gateway.job.domain.Job;
import app.simgate.gateway.job.domain.JobStatus;
import app.simgate.gateway.job.domain.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts wire records to {@link Job}. Field values are copied as received; a status or type
 * outside the known enumerations is only logged.
 */
final class JobServiceJobMapper {
    private static final Logger log = LoggerFactory.getLogger(JobServiceJobMapper.class);

    private JobServiceJobMapper() {
    }

    static Job toJob(JobServiceJob wire) {
        JobServiceMetadata metadata = wire.metadata();
        String requestedOn = metadata != null && metadata.requestedOn() != null
                ? metadata.requestedOn() : wire.requestedOn();
        String requestedBy = metadata != null && metadata.requestedBy() != null
                ? metadata.requestedBy() : wire.requestedBy();
        String lastUpdatedOn = metadata != null && metadata.lastUpdatedOn() != null
                ? metadata.lastUpdatedOn() : wire.lastUpdatedOn();

        if (wire.status() != null && JobStatus.fromWire(wire.status()).isEmpty()) {
            log.warn("Unrecognized job status jobId={} status={}", wire.jobRequestId(), wire.status());
        }
        if (wire.type() != null && JobType.fromWire(wire.type()).isEmpty()) {
            log.warn("Unrecognized job type jobId={} type={}", wire.jobRequestId(), wire.type());
        }

        return new Job(
                wire.jobRequestId(),
                wire.name(),
                wire.status(),
                wire.type(),
                wire.tenantId(),
                wire.platformId(),
                requestedBy,
                wire.queue(),
                wire.description(),
                wire.statusDetails(),
                requestedOn,
                wire.completedOn(),
                lastUpdatedOn
        );
    }
}
