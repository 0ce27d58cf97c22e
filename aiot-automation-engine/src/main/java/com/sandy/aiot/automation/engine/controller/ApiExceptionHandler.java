package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps rejected definitions and malformed requests to a 400 {@link ActionResp}.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ActionResp> onConfiguration(ConfigurationException e) {
        log.warn("Rejected definition: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ActionResp.fail(e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ActionResp> onIllegalArgument(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ActionResp.fail(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ActionResp> onUnreadable(HttpMessageNotReadableException e) {
        Throwable root = e.getMostSpecificCause();
        log.warn("Unreadable request body: {}", root.getMessage());
        return ResponseEntity.badRequest().body(ActionResp.fail("Malformed request: " + root.getMessage()));
    }
}
