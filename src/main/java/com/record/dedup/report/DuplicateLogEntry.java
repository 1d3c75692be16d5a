package com.record.dedup.report;

import com.record.dedup.core.model.MatchMethod;
import com.record.dedup.core.model.Record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One detected duplicate as handed to a {@link DuplicateLogSink}: the method plus
 * provenance and selected field values of both records.
 */
public record DuplicateLogEntry(
        MatchMethod method,
        String originalSourceId,
        int originalIndex,
        Map<String, String> originalValues,
        String duplicateSourceId,
        int duplicateIndex,
        Map<String, String> duplicateValues
) {
    public DuplicateLogEntry {
        Objects.requireNonNull(method, "method is required");
        originalValues = originalValues != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(originalValues)) : Map.of();
        duplicateValues = duplicateValues != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(duplicateValues)) : Map.of();
    }

    /**
     * Builds an entry, copying the given logical fields from both records.
     * Absent fields are reported as empty strings.
     */
    public static DuplicateLogEntry of(MatchMethod method, Record original, Record duplicate,
                                       List<String> reportFields) {
        return new DuplicateLogEntry(
                method,
                original.getSourceId(), original.getOriginIndex(), selectValues(original, reportFields),
                duplicate.getSourceId(), duplicate.getOriginIndex(), selectValues(duplicate, reportFields));
    }

    /**
     * The method's report tag, e.g. {@code fuzzy}.
     */
    public String methodTag() {
        return method.tag();
    }

    private static Map<String, String> selectValues(Record record, List<String> fields) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String field : fields) {
            String value = record.value(field);
            values.put(field, value != null ? value : "");
        }
        return values;
    }
}
