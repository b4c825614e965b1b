package com.github.stormino.clipper.exception;

import com.github.stormino.clipper.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Duration;
import java.util.stream.Collectors;

/**
 * Maps exceptions to the JSON error body {@code {errorKind, message, retryAfter?}}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AdmissionException.class)
    public ResponseEntity<ErrorResponse> handleAdmissionException(AdmissionException ex) {
        HttpStatus status;
        switch (ex.getKind()) {
            case RATE_LIMITED:
                status = HttpStatus.TOO_MANY_REQUESTS;
                break;
            case QUEUE_FULL:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                break;
            default:
                status = HttpStatus.UNPROCESSABLE_ENTITY;
                break;
        }
        return buildErrorResponse(status, ex.getKind().name(), ex.getMessage(), ex.getRetryAfter());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .sorted()
                .collect(Collectors.joining("; "));
        log.debug("Validation error: {}", message);
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR", message, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Malformed request body: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
                "Request body is missing or is not valid JSON.", null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<ErrorResponse> handleFetchException(FetchException ex) {
        if (ex.getFailure().isPlatformSide()) {
            log.warn("[platform] Metadata lookup failed ({}): {}", ex.getFailure(), ex.getMessage());
            return buildErrorResponse(HttpStatus.BAD_GATEWAY, "FETCH_ERROR", ex.getMessage(), null);
        }
        log.error("Metadata lookup failed: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "FETCH_ERROR", ex.getMessage(), null);
    }

    @ExceptionHandler(StageTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(StageTimeoutException ex) {
        log.warn("Request timed out: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.GATEWAY_TIMEOUT, "TIMEOUT",
                "The video platform took too long to respond.", null);
    }

    @ExceptionHandler(ArtifactStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageException(ArtifactStorageException ex) {
        log.error("Clip storage error for job {}: {}", ex.getJobId(), ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR",
                "The clip could not be read. Please submit it again.", null);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex) {
        log.error("Runtime exception occurred: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An error occurred while processing your request", null);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, String errorKind,
                                                             String message, Duration retryAfter) {
        ErrorResponse body = ErrorResponse.builder()
                .errorKind(errorKind)
                .message(message)
                .retryAfter(retryAfter != null ? retryAfter.toSeconds() : null)
                .build();

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (retryAfter != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter.toSeconds()));
        }
        return response.body(body);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
