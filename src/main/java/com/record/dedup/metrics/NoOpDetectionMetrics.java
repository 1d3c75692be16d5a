package com.record.dedup.metrics;

import com.record.dedup.core.model.MatchMethod;

import java.time.Duration;

/**
 * No-op implementation of {@link DetectionMetrics}.
 */
public class NoOpDetectionMetrics implements DetectionMetrics {

    @Override
    public void recordDetectionDuration(Duration duration) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementDuplicates(MatchMethod method, int count) {
    }

    @Override
    public void recordFuzzyComparisons(long comparisons) {
    }

    @Override
    public void recordQuickRejections(long rejections) {
    }

    @Override
    public void incrementLogSinkFailure() {
    }
}
