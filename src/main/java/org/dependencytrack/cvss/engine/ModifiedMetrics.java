package org.dependencytrack.cvss.engine;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.metric.MetricDefinition;
import org.dependencytrack.cvss.metric.MetricTable;

import java.util.LinkedHashMap;

public final class ModifiedMetrics {

    private ModifiedMetrics() {
    }

    /**
     * Makes every modified metric explicit, so that environmental formulas never
     * need to fall back to base metrics themselves.
     *
     * @param metrics The {@link MetricSet} as parsed
     * @return A derived {@link MetricSet} in which each undefined modified metric
     * carries the value of the base metric it modifies
     */
    public static MetricSet resolve(final MetricSet metrics) {
        final var resolvedValues = new LinkedHashMap<String, String>();
        for (final MetricDefinition definition : MetricTable.forVersion(metrics.version()).definitions()) {
            if (definition.isModified() && !metrics.isDefined(definition.code())) {
                resolvedValues.put(definition.code(), metrics.get(definition.modifies()));
            }
        }

        return resolvedValues.isEmpty() ? metrics : metrics.with(resolvedValues);
    }

}
