package app.simgate.gateway.file.service;

import app.simgate.gateway.client.fileservice.ArtifactLayout;
import app.simgate.gateway.client.fileservice.FileAccessClient;
import app.simgate.gateway.client.fileservice.FileStream;
import app.simgate.gateway.client.jobservice.JobServiceClient;
import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import app.simgate.gateway.job.domain.Job;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.shaping.FileListResponse;
import app.simgate.gateway.shaping.ResponseShaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * File operations for a job. The tenant always comes from the job record fetched for the
 * current request.
 */
@Service
public class JobFileService {
    private static final Logger log = LoggerFactory.getLogger(JobFileService.class);

    private final JobServiceClient jobServiceClient;
    private final FileAccessClient fileAccessClient;
    private final ResponseShaper responseShaper;

    public JobFileService(JobServiceClient jobServiceClient,
                          FileAccessClient fileAccessClient,
                          ResponseShaper responseShaper) {
        this.jobServiceClient = jobServiceClient;
        this.fileAccessClient = fileAccessClient;
        this.responseShaper = responseShaper;
    }

    public FileListResponse listFiles(String jobId, CallerCredential credential) {
        Job job = jobServiceClient.getJob(jobId, credential);
        return responseShaper.files(jobId, listFiles(jobId, job, credential));
    }

    public FileStream openFile(String jobId, String filename, CallerCredential credential) {
        Job job = jobServiceClient.getJob(jobId, credential);
        return fileAccessClient.downloadFile(job.tenantId(), jobId, layout(job), filename, credential);
    }

    /**
     * Size of the job's file listing, or {@code null} when the file service is unavailable.
     * Credential rejections are not absorbed.
     */
    public Integer countFiles(String jobId, Job job, CallerCredential credential) {
        try {
            return listFiles(jobId, job, credential).size();
        } catch (GatewayException ex) {
            if (ex.getKind() == GatewayErrorKind.UNAUTHORIZED || ex.getKind() == GatewayErrorKind.FORBIDDEN) {
                throw ex;
            }
            log.warn("File count unavailable jobId={} tenantId={} kind={} message={}",
                    jobId, job.tenantId(), ex.getKind().code(), ex.getMessage());
            return null;
        }
    }

    // Keyed by the requested id; the upstream record may omit JobRequestID.
    private List<String> listFiles(String jobId, Job job, CallerCredential credential) {
        return fileAccessClient.listFiles(job.tenantId(), jobId, layout(job), credential);
    }

    private static ArtifactLayout layout(Job job) {
        return ArtifactLayout.forJobType(job.knownType().orElse(null));
    }
}
