package com.example.DnsQueryLog.exception;

public class ValidationException extends QueryLogException {

    public ValidationException(String message) {
        super(message);
    }
}
