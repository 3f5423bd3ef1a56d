package com.example.DnsQueryLog.exception;

/**
 * The encoded batch did not decode back to the entries it was built from.
 */
public class ConsistencyException extends PersistenceException {

    public ConsistencyException(String message) {
        super(message);
    }
}
