package org.rewardledger.controller;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class LedgerExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, String>> onLedgerException(LedgerException e) {
        log.debug("Operation failed: {} ({})", e.getMessage(), e.getError());
        return ResponseEntity.status(e.getError().getStatus())
                .body(Map.of("error", e.getMessage(), "reason", e.getError().name()));
    }
}
