package com.record.dedup.report;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fans every call out to several sinks. A failing delegate does not keep the
 * others from receiving the call; failures are collected and rethrown as one
 * {@link DuplicateLogSinkException} afterwards.
 *
 * <p>Only delegates that opened successfully receive entries and the closing
 * call. If some delegates fail to open, the run continues with the others and
 * the open failures are rethrown from {@link #close()}; {@link #open()} itself
 * only fails when no delegate could be opened.</p>
 *
 * <p>Open state is held per instance, so one composite serves one run at a time.</p>
 */
public class CompositeDuplicateLogSink implements DuplicateLogSink {

    private final List<DuplicateLogSink> delegates;
    private List<DuplicateLogSink> opened;
    private final List<RuntimeException> pendingOpenFailures = new ArrayList<>();

    public CompositeDuplicateLogSink(List<DuplicateLogSink> delegates) {
        this.delegates = List.copyOf(delegates);
        this.opened = this.delegates;
    }

    public static CompositeDuplicateLogSink of(DuplicateLogSink... delegates) {
        return new CompositeDuplicateLogSink(List.of(delegates));
    }

    public List<DuplicateLogSink> getDelegates() {
        return delegates;
    }

    @Override
    public void open() {
        List<DuplicateLogSink> openedNow = new ArrayList<>();
        List<RuntimeException> failures = new ArrayList<>();
        for (DuplicateLogSink delegate : delegates) {
            try {
                delegate.open();
                openedNow.add(delegate);
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        opened = List.copyOf(openedNow);
        pendingOpenFailures.clear();

        if (!failures.isEmpty() && openedNow.isEmpty()) {
            throw aggregate(failures, "open");
        }
        pendingOpenFailures.addAll(failures);
    }

    @Override
    public void record(DuplicateLogEntry entry) {
        List<RuntimeException> failures = forEachOpened(sink -> sink.record(entry));
        if (!failures.isEmpty()) {
            throw aggregate(failures, "record");
        }
    }

    @Override
    public void close() {
        List<RuntimeException> failures = new ArrayList<>(pendingOpenFailures);
        failures.addAll(forEachOpened(DuplicateLogSink::close));
        String operation = pendingOpenFailures.isEmpty() ? "close" : "open or close";
        pendingOpenFailures.clear();
        opened = delegates;
        if (!failures.isEmpty()) {
            throw aggregate(failures, operation);
        }
    }

    private List<RuntimeException> forEachOpened(Consumer<DuplicateLogSink> call) {
        List<RuntimeException> failures = new ArrayList<>();
        for (DuplicateLogSink delegate : opened) {
            try {
                call.accept(delegate);
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        return failures;
    }

    private DuplicateLogSinkException aggregate(List<RuntimeException> failures, String operation) {
        DuplicateLogSinkException aggregated = new DuplicateLogSinkException(
                failures.size() + " of " + delegates.size() + " sinks failed to " + operation
                        + ": " + failures.get(0).getMessage(),
                failures.get(0));
        for (int i = 1; i < failures.size(); i++) {
            aggregated.addSuppressed(failures.get(i));
        }
        return aggregated;
    }
}
