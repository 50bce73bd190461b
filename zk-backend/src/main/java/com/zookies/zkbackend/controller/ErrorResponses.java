package com.zookies.zkbackend.controller;

import com.zookies.zkbackend.exception.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies shared by the controllers: {@code {success:false, error, code, timestamp}}.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static HttpStatus statusOf(ErrorCode errorCode) {
        if (errorCode == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (errorCode.isNeutralOutcome()) {
            return HttpStatus.OK;
        }
        return switch (errorCode) {
            case VALIDATION_ERROR, INVALID_PARAMETERS -> HttpStatus.BAD_REQUEST;
            case DUPLICATE_ERROR -> HttpStatus.CONFLICT;
            case DATABASE_ERROR, CIRCUIT_FILES_NOT_FOUND -> HttpStatus.SERVICE_UNAVAILABLE;
            case BACKEND_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static ResponseEntity<Map<String, Object>> of(ErrorCode errorCode, String message) {
        return of(statusOf(errorCode), errorCode == null ? "INTERNAL_ERROR" : errorCode.name(), message);
    }

    static ResponseEntity<Map<String, Object>> of(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(body(code, message));
    }

    static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        body.put("code", code);
        body.put("timestamp", Instant.now().toString());
        return body;
    }

}
