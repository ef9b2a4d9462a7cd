package app.simgate.gateway.job.service;

import app.simgate.gateway.client.jobservice.JobServiceClient;
import app.simgate.gateway.file.service.JobFileService;
import app.simgate.gateway.job.domain.Job;
import app.simgate.gateway.job.domain.JobFilter;
import app.simgate.gateway.job.domain.JobPage;
import app.simgate.gateway.job.domain.NormalizedJobQuery;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.shaping.JobDetailResponse;
import app.simgate.gateway.shaping.JobListResponse;
import app.simgate.gateway.shaping.ResponseShaper;
import org.springframework.stereotype.Service;

@Service
public class JobQueryService {

    private final JobQueryNormalizer normalizer;
    private final JobServiceClient jobServiceClient;
    private final JobFileService jobFileService;
    private final ResponseShaper responseShaper;

    public JobQueryService(JobQueryNormalizer normalizer,
                           JobServiceClient jobServiceClient,
                           JobFileService jobFileService,
                           ResponseShaper responseShaper) {
        this.normalizer = normalizer;
        this.jobServiceClient = jobServiceClient;
        this.jobFileService = jobFileService;
        this.responseShaper = responseShaper;
    }

    public JobListResponse listJobs(JobFilter filter, CallerCredential credential) {
        NormalizedJobQuery query = normalizer.normalize(filter);
        JobPage page = jobServiceClient.listJobs(query, credential);
        return responseShaper.jobs(page);
    }

    public JobDetailResponse getJobDetail(String jobId, CallerCredential credential) {
        Job job = jobServiceClient.getJob(jobId, credential);
        Integer fileCount = jobFileService.countFiles(jobId, job, credential);
        return responseShaper.jobDetail(job, fileCount);
    }
}
