package com.example.DnsQueryLog.exception;

public class EncodeException extends QueryLogException {

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
