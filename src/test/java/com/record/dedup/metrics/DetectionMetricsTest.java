package com.record.dedup.metrics;

import com.record.dedup.core.model.MatchMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DetectionMetrics Tests")
class DetectionMetricsTest {

    @Nested
    @DisplayName("NoOpDetectionMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpDetectionMetrics noOp = new NoOpDetectionMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordDetectionDuration(Duration.ofMillis(100));
                noOp.recordBatchSize(50);
                noOp.incrementDuplicates(MatchMethod.FUZZY, 3);
                noOp.recordFuzzyComparisons(10);
                noOp.recordQuickRejections(5);
                noOp.incrementLogSinkFailure();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerDetectionMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerDetectionMetrics metrics = new MicrometerDetectionMetrics(registry);

        @Test
        @DisplayName("Should record detection duration as timer")
        void recordDetectionDuration() {
            metrics.recordDetectionDuration(Duration.ofMillis(150));
            metrics.recordDetectionDuration(Duration.ofMillis(250));

            Timer timer = registry.find("dedup.detection.duration").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should count duplicates per method")
        void incrementDuplicates() {
            metrics.incrementDuplicates(MatchMethod.EXACT_KEY, 2);
            metrics.incrementDuplicates(MatchMethod.EXACT_KEY, 1);
            metrics.incrementDuplicates(MatchMethod.FUZZY, 0);

            Counter exact = registry.find("dedup.duplicates").tag("method", "exact-key").counter();
            Counter fuzzy = registry.find("dedup.duplicates").tag("method", "fuzzy").counter();

            assertNotNull(exact);
            assertEquals(3.0, exact.count());
            assertNotNull(fuzzy);
            assertEquals(0.0, fuzzy.count());
        }

        @Test
        @DisplayName("Should record batch size in distribution summary")
        void recordBatchSize() {
            metrics.recordBatchSize(10);
            metrics.recordBatchSize(30);

            DistributionSummary summary = registry.find("dedup.batch.size").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(40.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count fuzzy comparisons, quick rejections and sink failures")
        void countersAccumulate() {
            metrics.recordFuzzyComparisons(7);
            metrics.recordQuickRejections(4);
            metrics.recordQuickRejections(1);
            metrics.incrementLogSinkFailure();

            assertEquals(7.0, registry.find("dedup.fuzzy.comparisons").counter().count());
            assertEquals(5.0, registry.find("dedup.fuzzy.quick_rejections").counter().count());
            assertEquals(1.0, registry.find("dedup.log_sink.failures").counter().count());
        }
    }
}
