package com.bricks.sorter.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Global exception handler.
 *
 * <p>Converts pipeline failures into {@link ErrorResponse} bodies.</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * No adapter accepted the input: 422.
     */
    @ExceptionHandler(FormatUnrecognizedException.class)
    public ResponseEntity<ErrorResponse> handleFormat(FormatUnrecognizedException e, HttpServletRequest req) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), req, e.code());
    }

    /**
     * Cluster count out of range: 400.
     */
    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<ErrorResponse> handleInvalidParameter(InvalidParameterException e, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), req, e.code());
    }

    /**
     * A catalog failure that was not absorbed by a fallback: 502.
     */
    @ExceptionHandler(RemoteLookupException.class)
    public ResponseEntity<ErrorResponse> handleRemote(RemoteLookupException e, HttpServletRequest req) {
        log.warn("Remote lookup escaped the pipeline: {}", e.toString());
        return build(HttpStatus.BAD_GATEWAY, e.getMessage(), req, e.code());
    }

    /**
     * Duplicate cache key: 500.
     */
    @ExceptionHandler(CacheIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleCacheIntegrity(CacheIntegrityException e, HttpServletRequest req) {
        log.error("Cache integrity violated", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), req, e.code());
    }

    /**
     * A non-numeric {@code clusters} parameter: 400.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                            HttpServletRequest req) {
        String msg = "Parameter '" + e.getName() + "' has an invalid value";
        return build(HttpStatus.BAD_REQUEST, msg, req, "INVALID_PARAMETER");
    }

    /**
     * Upload above {@code spring.servlet.multipart.max-file-size}: 413.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadSize(MaxUploadSizeExceededException e, HttpServletRequest req) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Inventory file too large", req, "UPLOAD_TOO_LARGE");
    }

    /**
     * Part cache unavailable: 500.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDb(DataAccessException e, HttpServletRequest req) {
        log.error("Part cache access failed", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Database error", req, "DB_ERROR");
    }

    /**
     * Anything else: 500.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", req, "INTERNAL_ERROR");
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message,
                                                       HttpServletRequest req, String code) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), status.getReasonPhrase(), message,
                        req.getRequestURI(), code));
    }
}
