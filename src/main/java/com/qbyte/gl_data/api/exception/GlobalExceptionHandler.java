package com.qbyte.gl_data.api.exception;

import com.qbyte.gl_data.exception.GlDataServiceException;
import com.qbyte.gl_data.exception.InvalidRangeException;
import com.qbyte.gl_data.exception.StreamingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Global exception handler for the REST API.
 *
 * - InvalidRangeException and malformed parameters: 400, offending values echoed in details
 * - StreamingException and other service failures: 500
 * - Consumer disconnects on the stream: no response, nothing left to write to
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRangeException.class)
    public ResponseEntity<ApiError> handleInvalidRange(InvalidRangeException e) {
        log.warn("Invalid range: {} details={}", e.getMessage(), e.getDetails());

        ApiError error = ApiError.of("Invalid Range", e.getMessage(), e.getDetails());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        String value = e.getValue() != null ? e.getValue().toString() : "null";
        log.warn("Invalid parameter: {}={}", e.getName(), value);

        ApiError error = ApiError.of("Invalid Range", "Invalid value for parameter '" + e.getName() + "'", Map.of(e.getName(), value));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(StreamingException.class)
    public ResponseEntity<ApiError> handleStreaming(StreamingException e) {
        log.error("Streaming error: {} details={}", e.getMessage(), e.getDetails(), e);

        ApiError error = ApiError.of("Streaming Error", e.getMessage(), e.getDetails());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(GlDataServiceException.class)
    public ResponseEntity<ApiError> handleServiceException(GlDataServiceException e) {
        log.error("GL service exception: {} details={}", e.getMessage(), e.getDetails(), e);

        ApiError error = ApiError.of("GL Data Service Error", e.getMessage(), e.getDetails());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(AsyncRequestNotUsableException.class)
    public void handleDisconnected(AsyncRequestNotUsableException e) {
        log.debug("Stream consumer went away: {}", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.of("Internal Server Error", "An unexpected error occurred", null);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
