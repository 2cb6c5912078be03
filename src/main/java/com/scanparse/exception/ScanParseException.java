package com.scanparse.exception;

/**
 * Base exception for scanparse.
 */
public class ScanParseException extends RuntimeException {

    public ScanParseException(String message) {
        super(message);
    }

    public ScanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
