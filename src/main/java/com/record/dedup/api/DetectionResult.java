package com.record.dedup.api;

import com.record.dedup.core.model.Partition;
import com.record.dedup.report.LogSinkFailure;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result of a detection run: the partition plus run statistics and any log sink
 * failures. Sink failures never affect the partition.
 */
public record DetectionResult(
        Partition partition,
        List<LogSinkFailure> logFailures,
        long fuzzyComparisons,
        long quickRejections,
        Duration elapsed
) {
    public DetectionResult {
        Objects.requireNonNull(partition, "partition is required");
        logFailures = logFailures != null ? List.copyOf(logFailures) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    /**
     * Returns true if every duplicate was reported without sink errors.
     */
    public boolean isFullyReported() {
        return logFailures.isEmpty();
    }

    public boolean hasLogFailures() {
        return !logFailures.isEmpty();
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "unique=" + partition.unique().size() +
                ", groups=" + partition.duplicates().size() +
                ", duplicates=" + partition.duplicateCount() +
                ", comparisons=" + fuzzyComparisons +
                ", quickRejections=" + quickRejections +
                ", logFailures=" + logFailures.size() +
                '}';
    }
}
