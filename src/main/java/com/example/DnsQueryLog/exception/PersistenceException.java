package com.example.DnsQueryLog.exception;

/**
 * Writing, rotating or removing a query log file failed. Nothing from the affected batch is durable.
 */
public class PersistenceException extends QueryLogException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
