package app.simgate.gateway.job.controller;

import app.simgate.gateway.client.fileservice.FileStream;
import app.simgate.gateway.file.service.JobFileService;
import app.simgate.gateway.job.domain.JobFilter;
import app.simgate.gateway.job.service.JobQueryService;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.security.CurrentCallerProvider;
import app.simgate.gateway.shaping.FileListResponse;
import app.simgate.gateway.shaping.JobDetailResponse;
import app.simgate.gateway.shaping.JobListResponse;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobQueryService jobQueryService;
    private final JobFileService jobFileService;
    private final CurrentCallerProvider currentCallerProvider;

    public JobController(JobQueryService jobQueryService,
                         JobFileService jobFileService,
                         CurrentCallerProvider currentCallerProvider) {
        this.jobQueryService = jobQueryService;
        this.jobFileService = jobFileService;
        this.currentCallerProvider = currentCallerProvider;
    }

    // GET /jobs?status=&job_type=&limit=&continuation_token=
    @GetMapping
    public JobListResponse listJobs(Authentication authentication,
                                    @RequestParam(required = false) String status,
                                    @RequestParam(name = "job_type", required = false) String jobType,
                                    @RequestParam(name = "requested_by", required = false) String owner,
                                    @RequestParam(required = false) String queue,
                                    @RequestParam(name = "job_request_id", required = false) String jobRequestId,
                                    @RequestParam(name = "parent_instance_id", required = false) String parentInstanceId,
                                    @RequestParam(name = "workload_job_roi_id", required = false) String workloadJobRoiId,
                                    @RequestParam(required = false) String limit,
                                    @RequestParam(name = "continuation_token", required = false) String continuationToken) {
        CallerCredential credential = currentCallerProvider.requireCredential(authentication);
        JobFilter filter = new JobFilter(status, jobType, owner, queue, jobRequestId, parentInstanceId,
                workloadJobRoiId, limit, continuationToken);
        return jobQueryService.listJobs(filter, credential);
    }

    @GetMapping("/{jobId}")
    public JobDetailResponse getJob(Authentication authentication, @PathVariable String jobId) {
        return jobQueryService.getJobDetail(jobId, currentCallerProvider.requireCredential(authentication));
    }

    @GetMapping("/{jobId}/files")
    public FileListResponse listFiles(Authentication authentication, @PathVariable String jobId) {
        return jobFileService.listFiles(jobId, currentCallerProvider.requireCredential(authentication));
    }

    // Upstream failures before the first byte are mapped to error responses; the stream is
    // opened here so they surface before the status line is committed.
    @GetMapping("/{jobId}/files/{filename:.+}")
    public ResponseEntity<StreamingResponseBody> downloadFile(Authentication authentication,
                                                              @PathVariable String jobId,
                                                              @PathVariable String filename) {
        CallerCredential credential = currentCallerProvider.requireCredential(authentication);
        FileStream stream = jobFileService.openFile(jobId, filename, credential);

        StreamingResponseBody body = out -> {
            try (stream) {
                stream.transferTo(out);
            }
        };

        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .contentType(stream.contentType())
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(stream.filename(), StandardCharsets.UTF_8)
                        .build()
                        .toString());
        if (stream.contentLength() >= 0) {
            response.contentLength(stream.contentLength());
        }
        return response.body(body);
    }
}
