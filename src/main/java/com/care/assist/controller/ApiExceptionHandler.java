package com.care.assist.controller;

import com.care.assist.exception.SessionClosedException;
import com.care.assist.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * 將服務層例外轉為 JSON 回應
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionClosedException.class)
    public ResponseEntity<Map<String, Object>> handleClosed(SessionClosedException e) {
        Map<String, Object> body = error("session_closed");
        body.put("sessionId", e.getSessionId());
        body.put("closeReason", e.getCloseReason());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SessionNotFoundException e) {
        Map<String, Object> body = error("session_not_found");
        body.put("sessionId", e.getSessionId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        logger.warn("無效的請求: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error("bad_request"));
    }

    private static Map<String, Object> error(String code) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", code);
        return body;
    }
}
