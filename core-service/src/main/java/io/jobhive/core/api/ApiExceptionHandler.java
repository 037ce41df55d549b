package io.jobhive.core.api;

import io.jobhive.job.error.ApiError;
import io.jobhive.job.error.ErrorCode;
import io.jobhive.job.error.JobHiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestValueException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps the error taxonomy onto HTTP. The content type is set explicitly so errors render as JSON
 * even on the event-stream endpoint.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
    private static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(JobHiveException.class)
    public ResponseEntity<ApiError> handle(JobHiveException e) {
        if (e.code().httpStatus() >= 500) {
            log.warn("{}: {}", e.code(), e.getMessage());
        }
        return respond(e.code(), ApiError.of(e));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handle(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getField)
            .findFirst()
            .map(field -> "Invalid value for '" + field + "'")
            .orElse("Invalid request");
        return respond(ErrorCode.INVALID_REQUEST, new ApiError(ErrorCode.INVALID_REQUEST.name(), message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
        MissingRequestValueException.class})
    public ResponseEntity<ApiError> handleMalformed(Exception e) {
        return respond(ErrorCode.INVALID_REQUEST,
            new ApiError(ErrorCode.INVALID_REQUEST.name(), "Malformed request: " + e.getMessage()));
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ApiError> handle(CannotGetJdbcConnectionException e) {
        log.warn("Database connection pool exhausted: {}", e.getMessage());
        return respond(ErrorCode.RESOURCE_EXHAUSTED,
            new ApiError(ErrorCode.RESOURCE_EXHAUSTED.name(), "Database connection pool exhausted"));
    }

    private static ResponseEntity<ApiError> respond(ErrorCode code, ApiError body) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.valueOf(code.httpStatus()))
            .contentType(MediaType.APPLICATION_JSON);
        if (code.httpStatus() == HttpStatus.SERVICE_UNAVAILABLE.value()) {
            builder.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return builder.body(body);
    }
}
