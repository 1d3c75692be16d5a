package com.record.dedup.metrics;

import com.record.dedup.core.model.MatchMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link DetectionMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.detection.duration}: Timer</li>
 *   <li>{@code dedup.batch.size}: DistributionSummary</li>
 *   <li>{@code dedup.duplicates}: Counter (tag: method)</li>
 *   <li>{@code dedup.fuzzy.comparisons}: Counter</li>
 *   <li>{@code dedup.fuzzy.quick_rejections}: Counter</li>
 *   <li>{@code dedup.log_sink.failures}: Counter</li>
 * </ul>
 */
public class MicrometerDetectionMetrics implements DetectionMetrics {

    private final Timer detectionTimer;
    private final DistributionSummary batchSizeSummary;
    private final Map<MatchMethod, Counter> duplicateCounters = new EnumMap<>(MatchMethod.class);
    private final Counter comparisonCounter;
    private final Counter quickRejectionCounter;
    private final Counter sinkFailureCounter;

    public MicrometerDetectionMetrics(MeterRegistry registry) {
        this.detectionTimer = Timer.builder("dedup.detection.duration")
                .description("Duration of duplicate detection runs")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("dedup.batch.size")
                .description("Number of records per detection run")
                .register(registry);
        for (MatchMethod method : MatchMethod.values()) {
            duplicateCounters.put(method, Counter.builder("dedup.duplicates")
                    .description("Number of duplicates detected")
                    .tag("method", method.tag())
                    .register(registry));
        }
        this.comparisonCounter = Counter.builder("dedup.fuzzy.comparisons")
                .description("Full title comparisons performed by the fuzzy pass")
                .register(registry);
        this.quickRejectionCounter = Counter.builder("dedup.fuzzy.quick_rejections")
                .description("Pairs skipped by the similarity upper bound")
                .register(registry);
        this.sinkFailureCounter = Counter.builder("dedup.log_sink.failures")
                .description("Failed duplicate log sink calls")
                .register(registry);
    }

    @Override
    public void recordDetectionDuration(Duration duration) {
        detectionTimer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementDuplicates(MatchMethod method, int count) {
        if (count > 0) {
            duplicateCounters.get(method).increment(count);
        }
    }

    @Override
    public void recordFuzzyComparisons(long comparisons) {
        comparisonCounter.increment(comparisons);
    }

    @Override
    public void recordQuickRejections(long rejections) {
        quickRejectionCounter.increment(rejections);
    }

    @Override
    public void incrementLogSinkFailure() {
        sinkFailureCounter.increment();
    }
}
