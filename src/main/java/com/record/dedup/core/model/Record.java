package com.record.dedup.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable record produced by a source parser: ordered field values plus the
 * provenance needed to report where it came from.
 *
 * <p>Equality is by provenance ({@code sourceId}, {@code originIndex}) and content,
 * so two identical rows from the same position compare equal. The engine never
 * relies on equality or identity to track records; it works on batch indexes.</p>
 */
public final class Record {

    private final String sourceId;
    private final int originIndex;
    private final Map<String, String> fields;
    private final FieldMapping fieldMapping;

    private Record(Builder builder) {
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId is required");
        this.originIndex = builder.originIndex;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.fieldMapping = builder.fieldMapping != null ? builder.fieldMapping : FieldMapping.identity();
    }

    public String getSourceId() {
        return sourceId;
    }

    public int getOriginIndex() {
        return originIndex;
    }

    /**
     * Returns the raw source fields in their original order.
     */
    public Map<String, String> getFields() {
        return fields;
    }

    public FieldMapping getFieldMapping() {
        return fieldMapping;
    }

    /**
     * Resolves a logical field through this record's mapping.
     *
     * @return the raw value, or {@code null} if the field is absent
     */
    public String value(String logicalField) {
        return fieldMapping.resolve(logicalField, fields);
    }

    /**
     * Checks whether a logical field is present (possibly with an empty value).
     */
    public boolean hasField(String logicalField) {
        for (String sourceName : fieldMapping.sourceNames(logicalField)) {
            if (fields.containsKey(sourceName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Short provenance label used in logs, e.g. {@code refs.bib#12}.
     */
    public String provenance() {
        return sourceId + "#" + originIndex;
    }

    /**
     * Convenience factory for a record using logical field names directly.
     */
    public static Record of(String sourceId, int originIndex, Map<String, String> fields) {
        return builder().sourceId(sourceId).originIndex(originIndex).fields(fields).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record record = (Record) o;
        return originIndex == record.originIndex
                && sourceId.equals(record.sourceId)
                && fields.equals(record.fields)
                && fieldMapping.equals(record.fieldMapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, originIndex, fields, fieldMapping);
    }

    @Override
    public String toString() {
        return "Record{" +
                "source=" + provenance() +
                ", fields=" + fields +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceId;
        private int originIndex;
        private final Map<String, String> fields = new LinkedHashMap<>();
        private FieldMapping fieldMapping;

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder originIndex(int originIndex) {
            if (originIndex < 0) {
                throw new IllegalArgumentException("originIndex must be non-negative");
            }
            this.originIndex = originIndex;
            return this;
        }

        public Builder field(String name, String value) {
            fields.put(Objects.requireNonNull(name, "field name is required"), value);
            return this;
        }

        public Builder fields(Map<String, String> values) {
            values.forEach(this::field);
            return this;
        }

        public Builder fieldMapping(FieldMapping fieldMapping) {
            this.fieldMapping = fieldMapping;
            return this;
        }

        public Record build() {
            return new Record(this);
        }
    }
}
