package com.example.DnsQueryLog.exception;

/**
 * A persisted record could not be turned back into an entry. Readers skip the record and go on.
 */
public class DecodeException extends QueryLogException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
