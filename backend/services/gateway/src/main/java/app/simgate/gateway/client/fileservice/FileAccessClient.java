package app.simgate.gateway.client.fileservice;

import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.tenant.TenantResolver;
import app.simgate.gateway.upstream.Upstream;
import app.simgate.gateway.upstream.UpstreamCallExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists and downloads job artifacts from the file service of the job's tenant.
 * <p>
 * The host is resolved for every call from the tenant id passed in; this client keeps no
 * per-tenant state.
 */
@Component
public class FileAccessClient {
    private static final Logger log = LoggerFactory.getLogger(FileAccessClient.class);

    private final RestClient restClient;
    private final TenantResolver tenantResolver;
    private final UpstreamCallExecutor executor;

    public FileAccessClient(RestClient fileServiceRestClient,
                            TenantResolver tenantResolver,
                            UpstreamCallExecutor executor) {
        this.restClient = fileServiceRestClient;
        this.tenantResolver = tenantResolver;
        this.executor = executor;
    }

    public List<String> listFiles(String tenantId, String jobId, ArtifactLayout layout, CallerCredential credential) {
        URI uri = buildUri(tenantResolver.resolveFileServiceHost(tenantId), layout.listSegments(jobId));
        Map<String, String> context = context(tenantId, jobId, null);
        log.debug("Listing files tenantId={} jobId={} layout={}", tenantId, jobId, layout);

        JsonNode listing = executor.execute(Upstream.FILE_SERVICE, "file listing", context, () ->
                restClient.get()
                        .uri(uri)
                        .header(HttpHeaders.AUTHORIZATION, credential.bearerHeader())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(JsonNode.class));
        return readEntries(listing, layout.listingField());
    }

    /**
     * Opens a download. Retries only cover establishing the response; once bytes flow, a
     * failure ends the transfer.
     */
    public FileStream downloadFile(String tenantId,
                                   String jobId,
                                   ArtifactLayout layout,
                                   String filename,
                                   CallerCredential credential) {
        Map<String, String> context = context(tenantId, jobId, filename);
        if (filename == null || filename.isBlank() || filename.equals(".") || filename.equals("..")) {
            throw GatewayException.upstream(GatewayErrorKind.NOT_FOUND,
                    "File '" + filename + "' not found", null, context, null);
        }
        List<String> segments = layout.fileSegments(jobId, filename)
                .orElseThrow(() -> GatewayException.upstream(GatewayErrorKind.NOT_FOUND,
                        "File '" + filename + "' is not part of the job logs", null, context, null));
        URI uri = buildUri(tenantResolver.resolveFileServiceHost(tenantId), segments);
        log.debug("Opening file tenantId={} jobId={} filename={}", tenantId, jobId, filename);

        return executor.execute(Upstream.FILE_SERVICE, "file download", context, () ->
                restClient.get()
                        .uri(uri)
                        .header(HttpHeaders.AUTHORIZATION, credential.bearerHeader())
                        .exchange((request, response) -> open(jobId, filename, response), false));
    }

    private static FileStream open(String jobId, String filename, ClientHttpResponse response) throws IOException {
        if (!response.getStatusCode().is2xxSuccessful()) {
            RestClientResponseException failure;
            try (response) {
                failure = new RestClientResponseException(
                        "File service returned " + response.getStatusCode().value(),
                        response.getStatusCode(),
                        response.getStatusText(),
                        response.getHeaders(),
                        StreamUtils.copyToByteArray(response.getBody()),
                        StandardCharsets.UTF_8);
            }
            throw failure;
        }
        HttpHeaders headers = response.getHeaders();
        return new FileStream(jobId, filename, headers.getContentType(), headers.getContentLength(),
                response.getBody(), response);
    }

    static List<String> readEntries(JsonNode listing, String field) {
        if (listing == null || listing.isNull()) {
            return List.of();
        }
        JsonNode entries = listing.isArray() ? listing : listing.path(field);
        if (!entries.isArray()) {
            return List.of();
        }
        List<String> names = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            if (entry.isTextual()) {
                names.add(entry.asText());
            } else if (entry.hasNonNull("name")) {
                names.add(entry.get("name").asText());
            }
        }
        return names;
    }

    private static URI buildUri(URI base, List<String> segments) {
        return UriComponentsBuilder.fromUri(base)
                .pathSegment(segments.toArray(String[]::new))
                .build()
                .encode()
                .toUri();
    }

    private static Map<String, String> context(String tenantId, String jobId, String filename) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("job_id", jobId);
        if (tenantId != null) {
            context.put("tenant_id", tenantId);
        }
        if (filename != null) {
            context.put("filename", filename);
        }
        return context;
    }
}
