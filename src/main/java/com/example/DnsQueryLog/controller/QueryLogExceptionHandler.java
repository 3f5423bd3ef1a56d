package com.example.DnsQueryLog.controller;

import com.example.DnsQueryLog.exception.EncodeException;
import com.example.DnsQueryLog.exception.PersistenceException;
import com.example.DnsQueryLog.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class QueryLogExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<String> validation(ValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<String> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("json decode: " + e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler({PersistenceException.class, EncodeException.class})
    public ResponseEntity<String> persistence(RuntimeException e) {
        log.error("Query log request failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
    }
}
