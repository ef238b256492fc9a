package org.dependencytrack.cvss.vector;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.metric.MetricDefinition;
import org.dependencytrack.cvss.metric.MetricTable;

import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

public final class VectorSerializer {

    private VectorSerializer() {
    }

    /**
     * Renders a {@link MetricSet} in canonical form: version tag first, then metrics in the
     * order of the version's {@link MetricTable}. Optional metrics that are not defined are omitted.
     *
     * @param metrics The {@link MetricSet} to serialize
     * @return The canonical vector string
     */
    public static String serialize(final MetricSet metrics) {
        requireNonNull(metrics, "metrics must not be null");

        final var joiner = new StringJoiner("/");
        joiner.add(metrics.version().tag());
        for (final MetricDefinition definition : MetricTable.forVersion(metrics.version()).definitions()) {
            final String value = metrics.get(definition.code());
            if (MetricDefinition.NOT_DEFINED.equals(value)) {
                continue;
            }

            joiner.add(definition.code() + ":" + value);
        }

        return joiner.toString();
    }

}
