package com.streammeta.metadata.config;

import com.streammeta.common.exception.ErrorCode;
import com.streammeta.common.exception.StreamMetaException;
import com.streammeta.common.exception.SubsystemFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(StreamMetaException.class)
    public ResponseEntity<Map<String, Object>> handleStreamMetaException(StreamMetaException ex) {
        if (ex.getErrorCode().isClientOutcome()) {
            log.warn("{}: {}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.error("Stream metadata failure: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
        }

        HttpStatus status = mapErrorCodeToHttpStatus(ex.getErrorCode());
        Map<String, Object> response = body(status, ex.getErrorCode(), ex.getMessage());
        if (ex instanceof SubsystemFailureException) {
            response.put("stage", ((SubsystemFailureException) ex).getStage());
        }
        return ResponseEntity.status(status).body(response);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(body(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.UNKNOWN_ERROR,
                        ErrorCode.UNKNOWN_ERROR.getMessage()));
    }

    private Map<String, Object> body(HttpStatus status, ErrorCode errorCode, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now().toString());
        response.put("code", status.value());
        response.put("errorCode", errorCode.getCode());
        response.put("errorType", errorCode.name());
        response.put("message", message);
        return response;
    }

    private HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        switch (errorCode) {
            case STREAM_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case STREAM_BEING_DELETED:
                return HttpStatus.CONFLICT;
            case INVALID_REQUEST:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
