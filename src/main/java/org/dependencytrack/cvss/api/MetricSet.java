package org.dependencytrack.cvss.api;

import org.dependencytrack.cvss.metric.MetricDefinition;
import org.dependencytrack.cvss.metric.MetricGroup;
import org.dependencytrack.cvss.metric.MetricTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A complete, validated assignment of values to the metrics of one CVSS {@link Version}.
 * <p>
 * Every metric of the version's {@link MetricTable} is present, in canonical order.
 * Optional metrics that were not provided hold {@link MetricDefinition#NOT_DEFINED}.
 */
public final class MetricSet {

    private final Version version;
    private final Map<String, String> values;

    private MetricSet(final Version version, final Map<String, String> values) {
        this.version = version;
        this.values = values;
    }

    /**
     * @param version The {@link Version} the values belong to
     * @param values  Values keyed by metric code; optional metrics may be omitted
     * @return A {@link MetricSet} holding a value for every metric of {@code version}
     * @throws IllegalArgumentException When a code is unknown, a required metric is missing,
     *                                  or a value is not legal for its metric
     */
    public static MetricSet of(final Version version, final Map<String, String> values) {
        requireNonNull(version, "version must not be null");
        requireNonNull(values, "values must not be null");

        final MetricTable table = MetricTable.forVersion(version);
        for (final String code : values.keySet()) {
            if (table.definition(code).isEmpty()) {
                throw new IllegalArgumentException(
                        "Metric %s is not defined for CVSS %s".formatted(code, version.number()));
            }
        }

        final var completeValues = new LinkedHashMap<String, String>();
        for (final MetricDefinition definition : table.definitions()) {
            final String value = values.get(definition.code());
            if (value == null) {
                if (definition.required()) {
                    throw new IllegalArgumentException(
                            "Required metric %s is missing".formatted(definition.code()));
                }

                completeValues.put(definition.code(), MetricDefinition.NOT_DEFINED);
                continue;
            }

            if (!definition.isLegal(value)) {
                throw new IllegalArgumentException(
                        "Value %s is not legal for metric %s".formatted(value, definition.code()));
            }

            completeValues.put(definition.code(), value);
        }

        return new MetricSet(version, Collections.unmodifiableMap(completeValues));
    }

    public Version version() {
        return version;
    }

    public String get(final String code) {
        final String value = values.get(code);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Metric %s is not defined for CVSS %s".formatted(code, version.number()));
        }

        return value;
    }

    public boolean isDefined(final String code) {
        return !MetricDefinition.NOT_DEFINED.equals(get(code));
    }

    public boolean anyDefined(final MetricGroup group) {
        return MetricTable.forVersion(version).definitions(group).stream()
                .map(MetricDefinition::code)
                .anyMatch(this::isDefined);
    }

    /**
     * @return All values keyed by metric code, in canonical order
     */
    public Map<String, String> asMap() {
        return values;
    }

    /**
     * @param replacements Values to put in place of the current ones
     * @return A new {@link MetricSet} with the given values replaced
     */
    public MetricSet with(final Map<String, String> replacements) {
        final var newValues = new LinkedHashMap<>(values);
        newValues.putAll(replacements);
        return of(version, newValues);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final MetricSet other)) {
            return false;
        }
        return version == other.version && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, values);
    }

    @Override
    public String toString() {
        return "MetricSet{version=%s, values=%s}".formatted(version, values);
    }

}
