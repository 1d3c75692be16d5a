package com.record.dedup.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each duplicate as one INFO line to the {@code com.record.dedup.duplicates}
 * logger, so duplicate reports can be routed to their own appender.
 */
public class Slf4jDuplicateLogSink implements DuplicateLogSink {

    public static final String LOGGER_NAME = "com.record.dedup.duplicates";

    private final Logger log;

    public Slf4jDuplicateLogSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public Slf4jDuplicateLogSink(Logger log) {
        this.log = log;
    }

    @Override
    public void record(DuplicateLogEntry entry) {
        log.info("duplicate.found method={} original={}#{} duplicate={}#{} originalValues={} duplicateValues={}",
                entry.methodTag(),
                entry.originalSourceId(), entry.originalIndex(),
                entry.duplicateSourceId(), entry.duplicateIndex(),
                entry.originalValues(), entry.duplicateValues());
    }
}
