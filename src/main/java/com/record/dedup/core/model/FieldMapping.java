package com.record.dedup.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the engine's logical field names (title, author, doi, ...) to the column
 * or key names a particular source format uses.
 *
 * <p>A logical field may map to several source names; the first one present on a
 * record wins. Logical names without a mapping resolve to a source field of the
 * same name.</p>
 */
public final class FieldMapping {

    public static final String TITLE = "title";
    public static final String AUTHOR = "author";
    public static final String DOI = "doi";
    public static final String YEAR = "year";
    public static final String JOURNAL = "journal";

    private static final FieldMapping IDENTITY = new FieldMapping("identity", Map.of());

    private final String name;
    private final Map<String, List<String>> aliases;

    private FieldMapping(String name, Map<String, List<String>> aliases) {
        this.name = name;
        this.aliases = Map.copyOf(aliases);
    }

    /**
     * Logical names are used verbatim as source names.
     */
    public static FieldMapping identity() {
        return IDENTITY;
    }

    /**
     * BibTeX entries already use the logical names.
     */
    public static FieldMapping bibtex() {
        return builder("bibtex")
                .map(TITLE, "title")
                .map(AUTHOR, "author")
                .map(DOI, "doi")
                .map(YEAR, "year")
                .map(JOURNAL, "journal", "booktitle")
                .build();
    }

    /**
     * Search-result exports with "Item Title" style columns.
     */
    public static FieldMapping springerCsv() {
        return builder("springer-csv")
                .map(TITLE, "Item Title")
                .map(AUTHOR, "Authors")
                .map(DOI, "Item DOI")
                .map(YEAR, "Publication Year")
                .map(JOURNAL, "Publication Title")
                .build();
    }

    /**
     * Citation-index spreadsheet exports with "Article Title" style columns.
     */
    public static FieldMapping webOfScience() {
        return builder("web-of-science")
                .map(TITLE, "Article Title")
                .map(AUTHOR, "Authors")
                .map(DOI, "DOI")
                .map(YEAR, "Publication Year")
                .map(JOURNAL, "Source Title")
                .build();
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the source names to try, in order, for a logical field.
     */
    public List<String> sourceNames(String logicalField) {
        List<String> names = aliases.get(logicalField);
        return names != null ? names : List.of(logicalField);
    }

    /**
     * Looks up a logical field in the given source fields.
     *
     * @return the first present value, or {@code null} if none of the source names is present
     */
    public String resolve(String logicalField, Map<String, String> fields) {
        for (String sourceName : sourceNames(logicalField)) {
            if (fields.containsKey(sourceName)) {
                return fields.get(sourceName);
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldMapping that = (FieldMapping) o;
        return name.equals(that.name) && aliases.equals(that.aliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, aliases);
    }

    @Override
    public String toString() {
        return "FieldMapping{name='" + name + "', aliases=" + aliases + '}';
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final Map<String, List<String>> aliases = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name is required");
        }

        public Builder map(String logicalField, String... sourceNames) {
            Objects.requireNonNull(logicalField, "logicalField is required");
            if (sourceNames.length == 0) {
                throw new IllegalArgumentException("At least one source name is required for " + logicalField);
            }
            aliases.put(logicalField, List.of(sourceNames));
            return this;
        }

        public FieldMapping build() {
            return new FieldMapping(name, aliases);
        }
    }
}
