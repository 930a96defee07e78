package io.github.drompincen.synapsehub.gateway.controller;

import io.github.drompincen.synapsehub.protocol.api.ApiError;
import io.github.drompincen.synapsehub.runtime.error.BusinessLogicException;
import io.github.drompincen.synapsehub.runtime.error.DuplicateException;
import io.github.drompincen.synapsehub.runtime.error.ExternalServiceException;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.SynapseHubException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/** Maps the hub's error taxonomy onto HTTP statuses with an {@link ApiError} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SynapseHubException.class)
    public ResponseEntity<ApiError> handleHub(SynapseHubException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("{}: {}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.debug("{}: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ApiError(e.getMessage(), e.getErrorCode(), e.getDetails()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return badRequest("Invalid value for " + e.getName() + ": " + e.getValue(), Map.of("field", e.getName()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        return badRequest(e.getParameterName() + " is required", Map.of("field", e.getParameterName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        return badRequest("Malformed request body", Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        return badRequest(e.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("Internal server error", "INTERNAL_ERROR", Map.of()));
    }

    static HttpStatus statusOf(SynapseHubException e) {
        if (e instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (e instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof DuplicateException) return HttpStatus.CONFLICT;
        if (e instanceof BusinessLogicException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (e instanceof ExternalServiceException) return HttpStatus.SERVICE_UNAVAILABLE;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<ApiError> badRequest(String message, Map<String, Object> details) {
        return ResponseEntity.badRequest().body(new ApiError(message, "VALIDATION_ERROR", details));
    }
}
