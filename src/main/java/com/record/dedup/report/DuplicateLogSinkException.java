package com.record.dedup.report;

/**
 * Runtime exception thrown when a duplicate log sink cannot open, write or
 * flush its output.
 */
public class DuplicateLogSinkException extends RuntimeException {

    public DuplicateLogSinkException(String message) {
        super(message);
    }

    public DuplicateLogSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
