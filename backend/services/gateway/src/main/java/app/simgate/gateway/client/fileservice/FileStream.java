package app.simgate.gateway.client.fileservice;

import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * Open download from the file service. Must be closed to hand the connection back to the pool.
 */
public class FileStream implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FileStream.class);

    static final int CHUNK_SIZE = 8192;

    private final String jobId;
    private final String filename;
    private final MediaType contentType;
    private final long contentLength;
    private final InputStream body;
    private final Closeable connection;
    private boolean closed;

    public FileStream(String jobId,
                      String filename,
                      MediaType contentType,
                      long contentLength,
                      InputStream body,
                      Closeable connection) {
        this.jobId = jobId;
        this.filename = filename;
        this.contentType = contentType == null ? MediaType.APPLICATION_OCTET_STREAM : contentType;
        this.contentLength = contentLength;
        this.body = body;
        this.connection = connection;
    }

    public String filename() {
        return filename;
    }

    public MediaType contentType() {
        return contentType;
    }

    /**
     * Length announced by the file service, or -1 when unknown.
     */
    public long contentLength() {
        return contentLength;
    }

    /**
     * Copies the remaining bytes to {@code out} in order. A failure reading from the file service
     * becomes {@link GatewayErrorKind#STREAM_INTERRUPTED}; a failure writing to {@code out}
     * (the caller went away) is rethrown as is.
     *
     * @return number of bytes copied
     */
    public long transferTo(OutputStream out) throws IOException {
        byte[] buffer = new byte[CHUNK_SIZE];
        long total = 0;
        while (true) {
            int read;
            try {
                read = body.read(buffer);
            } catch (IOException ex) {
                log.warn("File stream interrupted jobId={} filename={} bytes={}", jobId, filename, total);
                throw GatewayException.upstream(GatewayErrorKind.STREAM_INTERRUPTED,
                        "Download of " + filename + " was interrupted after " + total + " bytes",
                        null, Map.of("job_id", jobId, "filename", filename), ex);
            }
            if (read < 0) {
                break;
            }
            out.write(buffer, 0, read);
            total += read;
        }
        out.flush();
        log.debug("File stream completed jobId={} filename={} bytes={}", jobId, filename, total);
        return total;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            body.close();
        } catch (IOException ex) {
            log.debug("Failed to close file body jobId={} filename={}", jobId, filename, ex);
        }
        try {
            connection.close();
        } catch (IOException ex) {
            log.debug("Failed to release connection jobId={} filename={}", jobId, filename, ex);
        }
    }
}
