package com.record.dedup.api;

import com.record.dedup.core.model.DuplicateGroup;
import com.record.dedup.core.model.Partition;
import com.record.dedup.core.model.Record;
import com.record.dedup.logging.LogContext;
import com.record.dedup.matching.ClaimLedger;
import com.record.dedup.matching.ExactKeyMatcher;
import com.record.dedup.matching.FuzzyMatcher;
import com.record.dedup.matching.GroupKeyMatcher;
import com.record.dedup.matching.MatchingPass;
import com.record.dedup.matching.NormalizedFieldCache;
import com.record.dedup.matching.PassResult;
import com.record.dedup.metrics.DetectionMetrics;
import com.record.dedup.metrics.NoOpDetectionMetrics;
import com.record.dedup.report.DuplicateLogEntry;
import com.record.dedup.report.DuplicateLogSink;
import com.record.dedup.report.LogSinkFailure;
import com.record.dedup.similarity.SequenceMatchSimilarity;
import com.record.dedup.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partitions a batch of records into unique records and duplicate groups.
 *
 * <p>Passes run in a fixed order: the key pass chosen by
 * {@link DetectionOptions#getKeyStrategy()} over the whole batch, then the fuzzy
 * pass over whatever is left. A claim is final, so later passes never reconsider
 * a claimed record. Once the partition is built, the log sink receives one entry
 * per duplicate; sink failures are returned in the {@link DetectionResult} and
 * never abort the run.</p>
 *
 * <p>All run state is local to {@link #detect}, so one detector can serve
 * concurrent runs as long as its sink tolerates that.</p>
 */
public class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final DetectionOptions options;
    private final DuplicateLogSink logSink;
    private final DetectionMetrics metrics;
    private final List<MatchingPass> passes;

    public DuplicateDetector(DetectionOptions options) {
        this(options, DuplicateLogSink.NOOP);
    }

    public DuplicateDetector(DetectionOptions options, DuplicateLogSink logSink) {
        this(options, logSink, new NoOpDetectionMetrics());
    }

    public DuplicateDetector(DetectionOptions options, DuplicateLogSink logSink, DetectionMetrics metrics) {
        this(options, logSink, metrics, new SequenceMatchSimilarity());
    }

    public DuplicateDetector(DetectionOptions options, DuplicateLogSink logSink, DetectionMetrics metrics,
                             SimilarityAlgorithm similarity) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.logSink = Objects.requireNonNull(logSink, "logSink is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.passes = buildPasses(options, Objects.requireNonNull(similarity, "similarity is required"));
    }

    public DetectionOptions getOptions() {
        return options;
    }

    /**
     * Returns the passes in execution order.
     */
    public List<MatchingPass> getPasses() {
        return passes;
    }

    /**
     * Detects duplicates, reporting them to the sink given at construction.
     */
    public DetectionResult detect(List<Record> records) {
        return detect(records, logSink);
    }

    /**
     * Detects duplicates, reporting them to the given sink for this run only.
     *
     * @param records the batch, in first-seen order
     * @param sink    receives one entry per duplicate
     * @return the partition plus run statistics
     */
    public DetectionResult detect(List<Record> records, DuplicateLogSink sink) {
        Objects.requireNonNull(records, "records is required");
        Objects.requireNonNull(sink, "sink is required");
        for (Record record : records) {
            Objects.requireNonNull(record, "records must not contain null");
        }

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forDetection(LogContext.generateRunId(), options.getKeyStrategy().name())) {
            log.debug("detection.started records={} options={}", records.size(), options);

            ClaimLedger ledger = new ClaimLedger(records);
            NormalizedFieldCache cache = new NormalizedFieldCache(records);
            long comparisons = 0;
            long quickRejections = 0;

            for (MatchingPass pass : passes) {
                PassResult result;
                try (LogContext passCtx = LogContext.forPass(pass.method().tag())) {
                    result = pass.apply(ledger, cache);
                }
                comparisons += result.comparisons();
                quickRejections += result.quickRejections();
                metrics.incrementDuplicates(pass.method(), result.claimed());
                log.debug("pass.completed method={} claimed={} totalClaimed={}",
                        pass.method().tag(), result.claimed(), ledger.claimedCount());
            }

            Partition partition = ledger.toPartition();
            List<LogSinkFailure> failures = report(partition, sink);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            metrics.recordBatchSize(records.size());
            metrics.recordFuzzyComparisons(comparisons);
            metrics.recordQuickRejections(quickRejections);
            metrics.recordDetectionDuration(elapsed);

            log.info("detection.completed records={} unique={} groups={} duplicates={} logFailures={} durationMs={}",
                    records.size(), partition.unique().size(), partition.duplicates().size(),
                    partition.duplicateCount(), failures.size(), elapsed.toMillis());
            return new DetectionResult(partition, failures, comparisons, quickRejections, elapsed);
        }
    }

    /**
     * Sends every duplicate to the sink exactly once. A failed open skips the
     * entries for this run; failed records and a failed close are collected.
     */
    private List<LogSinkFailure> report(Partition partition, DuplicateLogSink sink) {
        List<LogSinkFailure> failures = new ArrayList<>();
        try {
            sink.open();
        } catch (RuntimeException e) {
            recordFailure(failures, LogSinkFailure.of(LogSinkFailure.Stage.OPEN, null, e), e);
            return failures;
        }

        for (DuplicateGroup group : partition.duplicates()) {
            for (Record duplicate : group.duplicates()) {
                DuplicateLogEntry entry = DuplicateLogEntry.of(
                        group.method(), group.original(), duplicate, options.getReportFields());
                try {
                    sink.record(entry);
                } catch (RuntimeException e) {
                    recordFailure(failures, LogSinkFailure.of(LogSinkFailure.Stage.RECORD, entry, e), e);
                }
            }
        }

        try {
            sink.close();
        } catch (RuntimeException e) {
            recordFailure(failures, LogSinkFailure.of(LogSinkFailure.Stage.CLOSE, null, e), e);
        }
        return failures;
    }

    private void recordFailure(List<LogSinkFailure> failures, LogSinkFailure failure, RuntimeException cause) {
        failures.add(failure);
        metrics.incrementLogSinkFailure();
        log.warn("log_sink.failed stage={} error={}", failure.stage(), failure.message(), cause);
    }

    private static List<MatchingPass> buildPasses(DetectionOptions options, SimilarityAlgorithm similarity) {
        List<MatchingPass> passes = new ArrayList<>();
        switch (options.getKeyStrategy()) {
            case EXACT_KEY -> passes.add(new ExactKeyMatcher(options.getIdentifierField()));
            case GROUP_KEY -> passes.add(new GroupKeyMatcher(options.getGroupKeyFields()));
            case NONE -> {
            }
        }
        if (options.isFuzzyEnabled()) {
            passes.add(new FuzzyMatcher(
                    options.getTitleField(), options.getAuthorField(),
                    options.getTitleThreshold(), options.getAuthorThreshold(),
                    similarity, options.isQuickRejectEnabled()));
        }
        return List.copyOf(passes);
    }
}
