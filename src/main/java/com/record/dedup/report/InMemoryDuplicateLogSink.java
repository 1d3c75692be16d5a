package com.record.dedup.report;

import com.record.dedup.core.model.MatchMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Keeps recorded entries in memory.
 * Thread-safe via CopyOnWriteArrayList. Entries accumulate across runs until
 * {@link #clear()} is called.
 */
public class InMemoryDuplicateLogSink implements DuplicateLogSink {

    private final List<DuplicateLogEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicInteger openCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();

    @Override
    public void open() {
        openCount.incrementAndGet();
    }

    @Override
    public void record(DuplicateLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    public List<DuplicateLogEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<DuplicateLogEntry> getEntriesByMethod(MatchMethod method) {
        return entries.stream()
                .filter(e -> e.method() == method)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    public int getOpenCount() {
        return openCount.get();
    }

    public int getCloseCount() {
        return closeCount.get();
    }

    public void clear() {
        entries.clear();
    }
}
