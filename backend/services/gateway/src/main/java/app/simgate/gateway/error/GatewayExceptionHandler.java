package app.simgate.gateway.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class GatewayExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<GatewayErrorResponse> handleGatewayException(GatewayException ex) {
        if (ex.getKind().status().is5xxServerError()) {
            log.warn("Upstream failure kind={} status={} details={} message={}",
                    ex.getKind().code(), ex.getUpstreamStatus(), ex.getDetails(), ex.getMessage());
        } else {
            log.debug("Request rejected kind={} message={}", ex.getKind().code(), ex.getMessage());
        }
        return new ResponseEntity<>(GatewayErrorResponse.from(ex), ex.getKind().status());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<GatewayErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        GatewayException invalid = GatewayException.invalidFilter(ex.getName(),
                "Invalid " + ex.getName() + " '" + ex.getValue() + "'");
        return handleGatewayException(invalid);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<GatewayErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        String kind = status == null ? "Error" : status.name();
        return new ResponseEntity<>(GatewayErrorResponse.of(kind, ex.getReason()), ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<GatewayErrorResponse> handleUnexpected(Exception ex) {
        // Framework exceptions keep their own status.
        if (ex instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.resolve(framework.getStatusCode().value());
            String kind = status == null ? "Error" : status.name();
            return new ResponseEntity<>(GatewayErrorResponse.of(kind, ex.getMessage()), framework.getStatusCode());
        }
        log.error("Unhandled exception", ex);
        return new ResponseEntity<>(GatewayErrorResponse.of("Internal", "Internal error"),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
