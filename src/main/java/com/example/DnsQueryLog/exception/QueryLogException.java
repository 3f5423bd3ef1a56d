package com.example.DnsQueryLog.exception;

/**
 * Base type for every failure raised by the query log engine.
 */
public abstract class QueryLogException extends RuntimeException {

    protected QueryLogException(String message) {
        super(message);
    }

    protected QueryLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
