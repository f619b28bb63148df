package com.paxkun.pulldb.controller;

import com.paxkun.pulldb.service.LoggerService;
import com.paxkun.pulldb.service.pull.UntrustedUserException;
import com.paxkun.pulldb.store.StoreUnavailableException;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps service exceptions onto HTTP statuses with a small JSON body.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    private static final String TAG = "API";

    private final LoggerService logger;

    @ExceptionHandler(MissingUserException.class)
    public ResponseEntity<Map<String, Object>> missingUser(MissingUserException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(UntrustedUserException.class)
    public ResponseEntity<Map<String, Object>> untrusted(UntrustedUserException e) {
        logger.warn(TAG, "Untrusted access attempt: " + Identifiers.sanitizeForLog(e.getMessage()));
        return error(HttpStatus.FORBIDDEN, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> storeUnavailable(StoreUnavailableException e) {
        logger.error(TAG, "Entity store unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("message", message != null ? message : status.getReasonPhrase());
        return ResponseEntity.status(status).body(body);
    }
}
