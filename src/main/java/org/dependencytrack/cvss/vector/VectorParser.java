package org.dependencytrack.cvss.vector;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.api.Version;
import org.dependencytrack.cvss.metric.MetricDefinition;
import org.dependencytrack.cvss.metric.MetricTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for CVSS v3.1 and v4.0 vector strings.
 * <p>
 * Parsing is strict: unknown metrics, duplicates, empty segments and illegal values are all
 * rejected, rather than ignored, so that typos surface before a score is computed from them.
 */
public final class VectorParser {

    private static final String SEGMENT_SEPARATOR = "/";
    private static final char KEY_VALUE_SEPARATOR = ':';

    private VectorParser() {
    }

    /**
     * @param text The vector string, e.g. {@code CVSS:3.1/AV:N/AC:L/PR:N/UI:N/S:U/C:H/I:H/A:H}
     * @return The validated {@link MetricSet}
     * @throws InvalidVectorException When {@code text} is not a valid vector
     */
    public static MetricSet parse(final String text) throws InvalidVectorException {
        if (text == null || text.isBlank()) {
            throw new UnsupportedVersionException(null);
        }

        final String[] segments = text.strip().split(SEGMENT_SEPARATOR, -1);
        final Version version = Version.ofTag(segments[0])
                .orElseThrow(() -> new UnsupportedVersionException(segments[0]));
        final MetricTable table = MetricTable.forVersion(version);

        final var rawValues = new LinkedHashMap<String, String>();
        for (int i = 1; i < segments.length; i++) {
            final String segment = segments[i];

            final int separatorIndex = segment.indexOf(KEY_VALUE_SEPARATOR);
            if (separatorIndex <= 0
                || separatorIndex == segment.length() - 1
                || separatorIndex != segment.lastIndexOf(KEY_VALUE_SEPARATOR)) {
                throw new MalformedSegmentException(segment);
            }

            final String key = segment.substring(0, separatorIndex);
            final String value = segment.substring(separatorIndex + 1);
            if (table.definition(key).isEmpty()) {
                throw new UnknownMetricException(version, key);
            }
            if (rawValues.putIfAbsent(key, value) != null) {
                throw new DuplicateMetricException(key);
            }
        }

        final var missingMetrics = new ArrayList<String>();
        for (final MetricDefinition definition : table.definitions()) {
            if (definition.required() && !rawValues.containsKey(definition.code())) {
                missingMetrics.add(definition.code());
            }
        }
        if (!missingMetrics.isEmpty()) {
            throw new MissingRequiredMetricException(version, missingMetrics);
        }

        for (final Map.Entry<String, String> entry : rawValues.entrySet()) {
            final MetricDefinition definition = table.require(entry.getKey());
            if (!definition.isLegal(entry.getValue())) {
                throw new InvalidMetricValueException(version, definition.code(), entry.getValue(), definition.values());
            }
        }

        return MetricSet.of(version, rawValues);
    }

    /**
     * @return Codes of the metrics every vector of the given {@link Version} must contain
     */
    public static List<String> requiredMetrics(final Version version) {
        return MetricTable.forVersion(version).definitions().stream()
                .filter(MetricDefinition::required)
                .map(MetricDefinition::code)
                .toList();
    }

}
