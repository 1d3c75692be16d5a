package com.record.dedup.api;

import com.record.dedup.core.model.FieldMapping;
import com.record.dedup.matching.FuzzyMatcher;

import java.util.List;
import java.util.Objects;

/**
 * Options for duplicate detection runs.
 * Configures the key strategy, the fields each pass reads and the fuzzy thresholds.
 * Field names are logical names resolved through each record's {@link FieldMapping}.
 */
public class DetectionOptions {

    private static final List<String> DEFAULT_GROUP_KEY_FIELDS =
            List.of(FieldMapping.TITLE, FieldMapping.AUTHOR, FieldMapping.YEAR);
    private static final List<String> DEFAULT_REPORT_FIELDS =
            List.of(FieldMapping.TITLE, FieldMapping.AUTHOR, FieldMapping.YEAR, FieldMapping.DOI);

    private final KeyStrategy keyStrategy;
    private final String identifierField;
    private final List<String> groupKeyFields;
    private final boolean fuzzyEnabled;
    private final String titleField;
    private final String authorField;
    private final double titleThreshold;
    private final double authorThreshold;
    private final boolean quickRejectEnabled;
    private final List<String> reportFields;

    private DetectionOptions(Builder builder) {
        this.keyStrategy = builder.keyStrategy;
        this.identifierField = builder.identifierField;
        this.groupKeyFields = List.copyOf(builder.groupKeyFields);
        this.fuzzyEnabled = builder.fuzzyEnabled;
        this.titleField = builder.titleField;
        this.authorField = builder.authorField;
        this.titleThreshold = builder.titleThreshold;
        this.authorThreshold = builder.authorThreshold;
        this.quickRejectEnabled = builder.quickRejectEnabled;
        this.reportFields = List.copyOf(builder.reportFields);
    }

    public KeyStrategy getKeyStrategy() {
        return keyStrategy;
    }

    public String getIdentifierField() {
        return identifierField;
    }

    public List<String> getGroupKeyFields() {
        return groupKeyFields;
    }

    public boolean isFuzzyEnabled() {
        return fuzzyEnabled;
    }

    public String getTitleField() {
        return titleField;
    }

    public String getAuthorField() {
        return authorField;
    }

    public double getTitleThreshold() {
        return titleThreshold;
    }

    public double getAuthorThreshold() {
        return authorThreshold;
    }

    public boolean isQuickRejectEnabled() {
        return quickRejectEnabled;
    }

    public List<String> getReportFields() {
        return reportFields;
    }

    /**
     * Creates default options: exact-key on {@code doi}, then fuzzy title/author matching.
     */
    public static DetectionOptions defaults() {
        return builder().build();
    }

    /**
     * Options for bibliography entries: identifier match on DOI followed by fuzzy matching.
     */
    public static DetectionOptions bibliography() {
        return builder()
                .keyStrategy(KeyStrategy.EXACT_KEY)
                .identifierField(FieldMapping.DOI)
                .fuzzyEnabled(true)
                .build();
    }

    /**
     * Options for spreadsheet rows: composite key over the given fields, no fuzzy pass.
     */
    public static DetectionOptions spreadsheet(String... groupKeyFields) {
        return builder()
                .keyStrategy(KeyStrategy.GROUP_KEY)
                .groupKeyFields(List.of(groupKeyFields))
                .fuzzyEnabled(false)
                .build();
    }

    /**
     * Creates conservative options (higher fuzzy thresholds).
     */
    public static DetectionOptions strict() {
        return builder()
                .titleThreshold(0.98)
                .authorThreshold(0.9)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private KeyStrategy keyStrategy = KeyStrategy.EXACT_KEY;
        private String identifierField = FieldMapping.DOI;
        private List<String> groupKeyFields = DEFAULT_GROUP_KEY_FIELDS;
        private boolean fuzzyEnabled = true;
        private String titleField = FieldMapping.TITLE;
        private String authorField = FieldMapping.AUTHOR;
        private double titleThreshold = FuzzyMatcher.DEFAULT_TITLE_THRESHOLD;
        private double authorThreshold = FuzzyMatcher.DEFAULT_AUTHOR_THRESHOLD;
        private boolean quickRejectEnabled = true;
        private List<String> reportFields = DEFAULT_REPORT_FIELDS;

        public Builder keyStrategy(KeyStrategy keyStrategy) {
            this.keyStrategy = Objects.requireNonNull(keyStrategy, "keyStrategy is required");
            return this;
        }

        public Builder identifierField(String identifierField) {
            this.identifierField = requireFieldName(identifierField, "identifierField");
            return this;
        }

        public Builder groupKeyFields(List<String> groupKeyFields) {
            Objects.requireNonNull(groupKeyFields, "groupKeyFields is required");
            groupKeyFields.forEach(f -> requireFieldName(f, "groupKeyFields"));
            this.groupKeyFields = List.copyOf(groupKeyFields);
            return this;
        }

        public Builder fuzzyEnabled(boolean fuzzyEnabled) {
            this.fuzzyEnabled = fuzzyEnabled;
            return this;
        }

        public Builder titleField(String titleField) {
            this.titleField = requireFieldName(titleField, "titleField");
            return this;
        }

        public Builder authorField(String authorField) {
            this.authorField = requireFieldName(authorField, "authorField");
            return this;
        }

        public Builder titleThreshold(double titleThreshold) {
            validateThreshold(titleThreshold, "titleThreshold");
            this.titleThreshold = titleThreshold;
            return this;
        }

        public Builder authorThreshold(double authorThreshold) {
            validateThreshold(authorThreshold, "authorThreshold");
            this.authorThreshold = authorThreshold;
            return this;
        }

        public Builder quickRejectEnabled(boolean quickRejectEnabled) {
            this.quickRejectEnabled = quickRejectEnabled;
            return this;
        }

        public Builder reportFields(List<String> reportFields) {
            Objects.requireNonNull(reportFields, "reportFields is required");
            reportFields.forEach(f -> requireFieldName(f, "reportFields"));
            this.reportFields = List.copyOf(reportFields);
            return this;
        }

        public DetectionOptions build() {
            if (keyStrategy == KeyStrategy.GROUP_KEY && groupKeyFields.isEmpty()) {
                throw new IllegalArgumentException("groupKeyFields must not be empty for GROUP_KEY");
            }
            return new DetectionOptions(this);
        }

        private static String requireFieldName(String name, String option) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException(option + " must not be blank");
            }
            return name;
        }

        private static void validateThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "DetectionOptions{" +
                "keyStrategy=" + keyStrategy +
                ", identifierField='" + identifierField + '\'' +
                ", groupKeyFields=" + groupKeyFields +
                ", fuzzyEnabled=" + fuzzyEnabled +
                ", titleField='" + titleField + '\'' +
                ", authorField='" + authorField + '\'' +
                ", titleThreshold=" + titleThreshold +
                ", authorThreshold=" + authorThreshold +
                ", quickRejectEnabled=" + quickRejectEnabled +
                ", reportFields=" + reportFields +
                '}';
    }
}
