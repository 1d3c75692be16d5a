package com.record.dedup.report;

/**
 * Receives one entry per detected duplicate.
 *
 * <p>Lifecycle per detection run: {@link #open()} once, {@link #record} once per
 * duplicate, {@link #close()} once. Implementations signal failures with
 * {@link DuplicateLogSinkException}; the detector reports them to its caller but
 * never aborts detection because of them.</p>
 */
public interface DuplicateLogSink {

    /**
     * Called before the first entry of a run.
     */
    default void open() {
    }

    /**
     * Records one duplicate.
     */
    void record(DuplicateLogEntry entry);

    /**
     * Called after the last entry of a run; flushes buffered output.
     */
    default void close() {
    }

    /**
     * A sink that discards everything.
     */
    DuplicateLogSink NOOP = entry -> {};
}
