package org.dependencytrack.cvss.engine;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.api.ScoreResult;
import org.dependencytrack.cvss.api.Severity;
import org.dependencytrack.cvss.api.Version;
import org.dependencytrack.cvss.metric.MetricDefinition;
import org.dependencytrack.cvss.metric.MetricGroup;
import org.dependencytrack.cvss.metric.MetricTable;
import org.dependencytrack.cvss.vector.VectorSerializer;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.dependencytrack.cvss.engine.Rounding.roundUp;

/**
 * Scores CVSS v4.0 vectors additively: exploitability plus the highest impact on the
 * vulnerable system plus the highest impact on subsequent systems.
 */
public final class Cvss40ScoreEngine implements ScoreEngine {

    private static final String BASE_PREFIX = "";
    private static final String MODIFIED_PREFIX = "M";

    private static final double EXPLOITABILITY_COEFFICIENT = 8.22;

    private final MetricTable table = MetricTable.forVersion(Version.V4_0);

    @Override
    public Version version() {
        return Version.V4_0;
    }

    @Override
    public ScoreResult score(final MetricSet metrics) {
        if (metrics.version() != Version.V4_0) {
            throw new IllegalArgumentException("Expected CVSS 4.0 metrics, but got " + metrics.version());
        }

        final double vulnerableSystemImpact = maxWeight(metrics, "VC", "VI", "VA");
        final double subsequentSystemImpact = maxWeight(metrics, "SC", "SI", "SA");
        final double exploitability = exploitability(metrics, BASE_PREFIX);
        final double baseScore = combine(exploitability, vulnerableSystemImpact, subsequentSystemImpact);

        Double threatScore = null;
        if (metrics.anyDefined(MetricGroup.TEMPORAL)) {
            threatScore = roundUp(baseScore * weight(metrics, "E"));
        }

        Double environmentalScore = null;
        String environmentalVector = null;
        if (metrics.anyDefined(MetricGroup.ENVIRONMENTAL)) {
            final MetricSet resolvedMetrics = ModifiedMetrics.resolve(metrics);
            environmentalScore = environmentalScore(resolvedMetrics);
            environmentalVector = VectorSerializer.serialize(resolvedMetrics);
        }

        return new ScoreResult(
                Version.V4_0,
                VectorSerializer.serialize(metrics),
                baseScore,
                Severity.ofScore(baseScore),
                threatScore,
                threatScore != null ? Severity.ofScore(threatScore) : null,
                environmentalScore,
                environmentalScore != null ? Severity.ofScore(environmentalScore) : null,
                environmentalVector,
                supplementalMetrics(metrics),
                vulnerableSystemImpact + subsequentSystemImpact,
                exploitability);
    }

    private double environmentalScore(final MetricSet metrics) {
        final double modifiedBaseScore = combine(
                exploitability(metrics, MODIFIED_PREFIX),
                maxWeight(metrics, MODIFIED_PREFIX + "VC", MODIFIED_PREFIX + "VI", MODIFIED_PREFIX + "VA"),
                maxWeight(metrics, MODIFIED_PREFIX + "SC", MODIFIED_PREFIX + "SI", MODIFIED_PREFIX + "SA"));
        if (modifiedBaseScore == 0) {
            return 0;
        }

        final double requirementMultiplier = maxWeight(metrics, "CR", "IR", "AR");
        return roundUp(Math.min(modifiedBaseScore * requirementMultiplier, 10));
    }

    private double exploitability(final MetricSet metrics, final String prefix) {
        return EXPLOITABILITY_COEFFICIENT
               * weight(metrics, prefix + "AV")
               * weight(metrics, prefix + "AC")
               * weight(metrics, prefix + "AT")
               * weight(metrics, prefix + "PR")
               * weight(metrics, prefix + "UI");
    }

    private static double combine(
            final double exploitability,
            final double vulnerableSystemImpact,
            final double subsequentSystemImpact) {
        if (vulnerableSystemImpact == 0 && subsequentSystemImpact == 0) {
            return 0;
        }

        return roundUp(Math.min(exploitability + vulnerableSystemImpact + subsequentSystemImpact, 10));
    }

    private Map<String, String> supplementalMetrics(final MetricSet metrics) {
        final var supplementalMetrics = new LinkedHashMap<String, String>();
        for (final MetricDefinition definition : table.definitions(MetricGroup.SUPPLEMENTAL)) {
            if (metrics.isDefined(definition.code())) {
                supplementalMetrics.put(definition.code(), metrics.get(definition.code()));
            }
        }

        return supplementalMetrics;
    }

    private double maxWeight(final MetricSet metrics, final String... codes) {
        double max = 0;
        for (final String code : codes) {
            max = Math.max(max, weight(metrics, code));
        }

        return max;
    }

    private double weight(final MetricSet metrics, final String code) {
        return table.weight(code, metrics.get(code));
    }

}
