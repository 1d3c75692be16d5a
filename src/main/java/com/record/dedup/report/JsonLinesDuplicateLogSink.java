package com.record.dedup.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes each duplicate as one JSON object per line (JSON Lines).
 *
 * <pre>
 * {"method":"exact-key","original":{"sourceId":"a.bib","index":0,"values":{...}},"duplicate":{...}}
 * </pre>
 *
 * <p>{@link #close()} flushes the writer but does not close it; the writer is
 * owned by the caller, so the same sink can serve several runs.</p>
 */
public class JsonLinesDuplicateLogSink implements DuplicateLogSink {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesDuplicateLogSink.class);

    private final Writer writer;
    private final ObjectMapper objectMapper;
    private long written;

    public JsonLinesDuplicateLogSink(Writer writer) {
        this(writer, new ObjectMapper());
    }

    public JsonLinesDuplicateLogSink(Writer writer, ObjectMapper objectMapper) {
        this.writer = Objects.requireNonNull(writer, "writer is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    @Override
    public void open() {
        written = 0;
    }

    @Override
    public void record(DuplicateLogEntry entry) {
        String line = serialize(entry);
        try {
            writer.write(line);
            writer.write('\n');
            written++;
        } catch (IOException e) {
            throw new DuplicateLogSinkException("Failed to write duplicate entry: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            writer.flush();
            log.debug("json_sink.flushed entries={}", written);
        } catch (IOException e) {
            throw new DuplicateLogSinkException("Failed to flush duplicate report: " + e.getMessage(), e);
        }
    }

    private String serialize(DuplicateLogEntry entry) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("method", entry.methodTag());
        payload.put("original", side(entry.originalSourceId(), entry.originalIndex(), entry.originalValues()));
        payload.put("duplicate", side(entry.duplicateSourceId(), entry.duplicateIndex(), entry.duplicateValues()));
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DuplicateLogSinkException("Failed to serialize duplicate entry", e);
        }
    }

    private static Map<String, Object> side(String sourceId, int index, Map<String, String> values) {
        Map<String, Object> side = new LinkedHashMap<>();
        side.put("sourceId", sourceId);
        side.put("index", index);
        side.put("values", values);
        return side;
    }
}
