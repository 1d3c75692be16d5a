package com.record.dedup.metrics;

import com.record.dedup.core.model.MatchMethod;

import java.time.Duration;

/**
 * Interface for recording duplicate detection metrics.
 * The default {@link NoOpDetectionMetrics} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface DetectionMetrics {

    void recordDetectionDuration(Duration duration);

    void recordBatchSize(int size);

    void incrementDuplicates(MatchMethod method, int count);

    void recordFuzzyComparisons(long comparisons);

    void recordQuickRejections(long rejections);

    void incrementLogSinkFailure();
}
