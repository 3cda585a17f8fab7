package com.rebenew.musicParty.queuesync.controller;

import com.rebenew.musicParty.queuesync.error.ErrorCode;
import com.rebenew.musicParty.queuesync.error.InvalidTargetException;
import com.rebenew.musicParty.queuesync.error.NotAuthorizedException;
import com.rebenew.musicParty.queuesync.error.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.HashMap;
import java.util.Map;

/**
 * Respuestas de error homogéneas para los endpoints REST.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SessionNotFoundException ex, WebRequest request) {
        logger.warn("❌ {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ErrorCode.SESSION_NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(NotAuthorizedException.class)
    public ResponseEntity<Map<String, Object>> handleNotAuthorized(NotAuthorizedException ex, WebRequest request) {
        logger.warn("🚫 {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, ErrorCode.NOT_AUTHORIZED, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidTargetException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTarget(InvalidTargetException ex, WebRequest request) {
        logger.warn("⚠️ {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.INVALID_TARGET, ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        logger.warn("❌ Petición inválida: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorCode.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, WebRequest request) {
        logger.error("🚨 Error inesperado: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR, "internal_server_error", request);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, ErrorCode code, String message,
                                                      WebRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("status", status.value());
        body.put("error", code.wireName());
        body.put("message", message);
        body.put("path", request.getDescription(false));
        body.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.status(status).body(body);
    }
}
