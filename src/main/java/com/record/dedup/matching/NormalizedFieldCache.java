package com.record.dedup.matching;

import com.record.dedup.core.model.Record;
import com.record.dedup.rules.TextNormalizer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lazily computed normalized field values, one slot per record per field.
 * Scoped to a single detection run.
 */
public final class NormalizedFieldCache {

    private final List<Record> records;
    private final Map<String, String[]> valuesByField = new HashMap<>();

    public NormalizedFieldCache(List<Record> records) {
        this.records = records;
    }

    /**
     * Returns the normalized value of a logical field for the record at {@code index}.
     * Missing fields yield the empty string.
     */
    public String get(int index, String field) {
        String[] values = valuesByField.computeIfAbsent(field, f -> new String[records.size()]);
        String value = values[index];
        if (value == null) {
            value = TextNormalizer.normalize(records.get(index).value(field));
            values[index] = value;
        }
        return value;
    }
}
