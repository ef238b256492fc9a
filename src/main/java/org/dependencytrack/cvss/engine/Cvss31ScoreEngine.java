package org.dependencytrack.cvss.engine;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.api.ScoreResult;
import org.dependencytrack.cvss.api.Severity;
import org.dependencytrack.cvss.api.Version;
import org.dependencytrack.cvss.metric.MetricGroup;
import org.dependencytrack.cvss.metric.MetricTable;
import org.dependencytrack.cvss.vector.VectorSerializer;

import static org.dependencytrack.cvss.engine.Rounding.roundUp;

/**
 * Implements the equations of section 7 of the CVSS v3.1 specification.
 */
public final class Cvss31ScoreEngine implements ScoreEngine {

    private static final String BASE_PREFIX = "";
    private static final String MODIFIED_PREFIX = "M";

    private static final String SCOPE_CHANGED = "C";
    private static final double SCOPE_CHANGED_FACTOR = 1.08;
    private static final double EXPLOITABILITY_COEFFICIENT = 8.22;
    private static final double MODIFIED_IMPACT_CAP = 0.915;

    private final MetricTable table = MetricTable.forVersion(Version.V3_1);

    @Override
    public Version version() {
        return Version.V3_1;
    }

    @Override
    public ScoreResult score(final MetricSet metrics) {
        if (metrics.version() != Version.V3_1) {
            throw new IllegalArgumentException("Expected CVSS 3.1 metrics, but got " + metrics.version());
        }

        final boolean scopeChanged = SCOPE_CHANGED.equals(metrics.get("S"));
        final double impact = impactSubScore(
                1 - (1 - weight(metrics, "C")) * (1 - weight(metrics, "I")) * (1 - weight(metrics, "A")),
                scopeChanged);
        final double exploitability = exploitabilitySubScore(metrics, BASE_PREFIX, scopeChanged);
        final double baseScore = combine(impact, exploitability, scopeChanged);

        Double temporalScore = null;
        if (metrics.anyDefined(MetricGroup.TEMPORAL)) {
            temporalScore = roundUp(baseScore * temporalMultiplier(metrics));
        }

        Double environmentalScore = null;
        String environmentalVector = null;
        if (metrics.anyDefined(MetricGroup.ENVIRONMENTAL)) {
            final MetricSet resolvedMetrics = ModifiedMetrics.resolve(metrics);
            environmentalScore = environmentalScore(resolvedMetrics);
            environmentalVector = VectorSerializer.serialize(resolvedMetrics);
        }

        return new ScoreResult(
                Version.V3_1,
                VectorSerializer.serialize(metrics),
                baseScore,
                Severity.ofScore(baseScore),
                temporalScore,
                temporalScore != null ? Severity.ofScore(temporalScore) : null,
                environmentalScore,
                environmentalScore != null ? Severity.ofScore(environmentalScore) : null,
                environmentalVector,
                /* supplementalMetrics */ null,
                impact,
                exploitability);
    }

    private double environmentalScore(final MetricSet metrics) {
        final boolean scopeChanged = SCOPE_CHANGED.equals(metrics.get("MS"));

        final double modifiedIss = Math.min(
                1 - (1 - weight(metrics, "CR") * weight(metrics, "MC"))
                    * (1 - weight(metrics, "IR") * weight(metrics, "MI"))
                    * (1 - weight(metrics, "AR") * weight(metrics, "MA")),
                MODIFIED_IMPACT_CAP);

        final double modifiedImpact = scopeChanged
                ? 7.52 * (modifiedIss - 0.029) - 3.25 * Math.pow(modifiedIss * 0.9731 - 0.02, 13)
                : 6.42 * modifiedIss;
        final double modifiedExploitability = exploitabilitySubScore(metrics, MODIFIED_PREFIX, scopeChanged);

        final double modifiedBaseScore = combine(modifiedImpact, modifiedExploitability, scopeChanged);
        return roundUp(modifiedBaseScore * temporalMultiplier(metrics));
    }

    private static double impactSubScore(final double iss, final boolean scopeChanged) {
        if (scopeChanged) {
            return 7.52 * (iss - 0.029) - 3.25 * Math.pow(iss - 0.02, 15);
        }

        return 6.42 * iss;
    }

    private double exploitabilitySubScore(final MetricSet metrics, final String prefix, final boolean scopeChanged) {
        final String privilegesRequiredCode = prefix + "PR";
        return EXPLOITABILITY_COEFFICIENT
               * weight(metrics, prefix + "AV")
               * weight(metrics, prefix + "AC")
               * table.require(privilegesRequiredCode).weight(metrics.get(privilegesRequiredCode), scopeChanged)
               * weight(metrics, prefix + "UI");
    }

    private static double combine(final double impact, final double exploitability, final boolean scopeChanged) {
        if (impact <= 0) {
            return 0;
        }

        final double factor = scopeChanged ? SCOPE_CHANGED_FACTOR : 1;
        return roundUp(Math.min(factor * (impact + exploitability), 10));
    }

    private double temporalMultiplier(final MetricSet metrics) {
        return weight(metrics, "E") * weight(metrics, "RL") * weight(metrics, "RC");
    }

    private double weight(final MetricSet metrics, final String code) {
        return table.weight(code, metrics.get(code));
    }

}
