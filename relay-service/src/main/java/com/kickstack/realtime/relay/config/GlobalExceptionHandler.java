package com.kickstack.realtime.relay.config;

import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies for the status endpoints
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<Map<String, Object>> handleRelayException(RelayException ex) {
        HttpStatus status = toHttpStatus(ex.getErrorCode());
        log.warn("Status request failed with {}: {}", ex.getErrorCode(), ex.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errorCode", ex.getCode());
        body.put("errorType", ex.getErrorCode().name());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(status).body(body);
    }

    private static HttpStatus toHttpStatus(ErrorCode errorCode) {
        switch (errorCode) {
            case UNKNOWN_CONNECTION:
                return HttpStatus.NOT_FOUND;
            case STORE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
