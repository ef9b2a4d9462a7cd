package app.simgate.gateway.upstream;

import app.simgate.gateway.config.UpstreamProps;
import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs upstream calls under a bounded exponential-backoff retry and translates failures into
 * {@link GatewayException}s.
 * <p>
 * Only 5xx responses and connection failures are retried. Auth rejections, other 4xx
 * responses and timeouts fail on the first attempt.
 */
public class UpstreamCallExecutor {
    private static final Logger log = LoggerFactory.getLogger(UpstreamCallExecutor.class);

    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    public UpstreamCallExecutor(UpstreamProps.Retry retry) {
        this.maxAttempts = Math.max(1, retry.maxAttempts());
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(millis(retry.initialBackoff(), 200));
        backOff.setMultiplier(retry.multiplier());
        backOff.setMaxInterval(millis(retry.maxBackoff(), 2000));
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .customBackoff(backOff)
                .retryOn(RetryableFailure.class)
                .build();
    }

    public <T> T execute(Upstream upstream, String operation, Map<String, String> context, Supplier<T> call) {
        try {
            return retryTemplate.execute(retryContext -> {
                int attempt = retryContext.getRetryCount() + 1;
                try {
                    return call.get();
                } catch (RestClientResponseException ex) {
                    throw translateStatus(upstream, operation, context, ex, attempt);
                } catch (ResourceAccessException ex) {
                    throw translateTransport(upstream, operation, context, ex, attempt);
                }
            });
        } catch (RetryableFailure exhausted) {
            throw exhausted.terminal();
        }
    }

    private RuntimeException translateStatus(Upstream upstream,
                                             String operation,
                                             Map<String, String> context,
                                             RestClientResponseException ex,
                                             int attempt) {
        HttpStatusCode status = ex.getStatusCode();
        int code = status.value();
        String where = upstream.displayName() + " " + operation;
        String upstreamMessage = summarizeError(ex);
        Map<String, String> details = context;
        if (upstreamMessage != null) {
            details = new LinkedHashMap<>(context);
            details.put("upstream_message", upstreamMessage);
        }
        if (code == 401) {
            return GatewayException.upstream(GatewayErrorKind.UNAUTHORIZED,
                    "The " + upstream.displayName() + " rejected the credential", code, details, ex);
        }
        if (code == 403) {
            return GatewayException.upstream(GatewayErrorKind.FORBIDDEN,
                    "The credential is not allowed to access this resource", code, details, ex);
        }
        if (code == 404) {
            return GatewayException.upstream(GatewayErrorKind.NOT_FOUND,
                    describe("Not found", context), code, details, ex);
        }
        if (status.is5xxServerError()) {
            log.warn("Upstream server error upstream={} operation={} status={} attempt={}/{} context={} body={}",
                    upstream, operation, code, attempt, maxAttempts, context, upstreamMessage);
            GatewayException terminal = GatewayException.upstream(upstream.serverErrorKind(),
                    where + " failed with status " + code, code, details, ex);
            return new RetryableFailure(terminal);
        }
        String message = where + " rejected the request with status " + code;
        if (upstreamMessage != null) {
            message = message + ": " + upstreamMessage;
        }
        return GatewayException.upstream(GatewayErrorKind.UPSTREAM_ERROR, message, code, details, ex);
    }

    /**
     * Upstream response body collapsed to one line and capped at 200 characters, or
     * {@code null} when the body is empty.
     */
    static String summarizeError(RestClientResponseException ex) {
        String body = ex.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return null;
        }
        String message = body.replaceAll("\\s+", " ").trim();
        return message.length() > 200 ? message.substring(0, 200) : message;
    }

    private RuntimeException translateTransport(Upstream upstream,
                                                String operation,
                                                Map<String, String> context,
                                                ResourceAccessException ex,
                                                int attempt) {
        String where = upstream.displayName() + " " + operation;
        if (isTimeout(ex)) {
            log.warn("Upstream timeout upstream={} operation={} context={}", upstream, operation, context);
            return GatewayException.upstream(GatewayErrorKind.UPSTREAM_TIMEOUT,
                    where + " timed out", null, context, ex);
        }
        log.warn("Upstream unreachable upstream={} operation={} attempt={}/{} error={}",
                upstream, operation, attempt, maxAttempts, ex.getMessage());
        GatewayException terminal = GatewayException.upstream(GatewayErrorKind.UPSTREAM_UNAVAILABLE,
                "The " + upstream.displayName() + " could not be reached", null, context, ex);
        return new RetryableFailure(terminal);
    }

    static boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof HttpTimeoutException || current instanceof SocketTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String describe(String prefix, Map<String, String> context) {
        if (context.isEmpty()) {
            return prefix;
        }
        StringBuilder sb = new StringBuilder(prefix).append(':');
        context.forEach((key, value) -> sb.append(' ').append(key).append('=').append(value));
        return sb.toString();
    }

    private static long millis(Duration value, long fallback) {
        return value == null ? fallback : Math.max(1, value.toMillis());
    }

    static final class RetryableFailure extends RuntimeException {
        private final GatewayException terminal;

        RetryableFailure(GatewayException terminal) {
            super(terminal.getMessage(), terminal, false, false);
            this.terminal = terminal;
        }

        GatewayException terminal() {
            return terminal;
        }
    }
}
