package com.record.dedup.report;

import java.util.Objects;

/**
 * A log sink failure reported back to the caller of a detection run.
 *
 * @param stage   where it failed
 * @param entry   the entry being recorded, or {@code null} for open/close failures
 * @param message the failure message
 */
public record LogSinkFailure(Stage stage, DuplicateLogEntry entry, String message) {

    public enum Stage {
        OPEN,
        RECORD,
        CLOSE
    }

    public LogSinkFailure {
        Objects.requireNonNull(stage, "stage is required");
        message = message != null ? message : "";
    }

    public static LogSinkFailure of(Stage stage, DuplicateLogEntry entry, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new LogSinkFailure(stage, entry, message);
    }
}
