package org.dependencytrack.cvss.api;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of scoring a single vector.
 * <p>
 * For CVSS v4.0, {@code temporalScore} and {@code temporalSeverity} hold the threat score,
 * also exposed as {@link #threatScore()} and {@link #threatSeverity()}.
 *
 * @param version               The CVSS {@link Version} that was applied
 * @param vectorString          Canonical form of the scored vector
 * @param baseScore             The base score
 * @param baseSeverity          The {@link Severity} of the base score
 * @param temporalScore         The temporal (v3.1) or threat (v4.0) score, if any of its metrics is defined
 * @param temporalSeverity      The {@link Severity} of {@code temporalScore}
 * @param environmentalScore    The environmental score, if any environmental metric is defined
 * @param environmentalSeverity The {@link Severity} of {@code environmentalScore}
 * @param environmentalVector   Canonical vector of the metric set the environmental score was computed on
 * @param supplementalMetrics   Defined supplemental metrics (v4.0), echoed as-is in canonical order
 * @param impactScore           The impact sub-score
 * @param exploitabilityScore   The exploitability sub-score
 */
public record ScoreResult(
        Version version,
        String vectorString,
        double baseScore,
        Severity baseSeverity,
        @Nullable Double temporalScore,
        @Nullable Severity temporalSeverity,
        @Nullable Double environmentalScore,
        @Nullable Severity environmentalSeverity,
        @Nullable String environmentalVector,
        Map<String, String> supplementalMetrics,
        double impactScore,
        double exploitabilityScore) {

    public ScoreResult {
        requireNonNull(version, "version must not be null");
        requireNonNull(vectorString, "vectorString must not be null");
        requireNonNull(baseSeverity, "baseSeverity must not be null");
        supplementalMetrics = supplementalMetrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(supplementalMetrics))
                : Collections.emptyMap();
    }

    public @Nullable Double threatScore() {
        return version == Version.V4_0 ? temporalScore : null;
    }

    public @Nullable Severity threatSeverity() {
        return version == Version.V4_0 ? temporalSeverity : null;
    }

}
