package org.dependencytrack.cvss.engine;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.api.ScoreResult;
import org.dependencytrack.cvss.api.Version;
import org.dependencytrack.cvss.vector.InvalidVectorException;
import org.dependencytrack.cvss.vector.VectorParser;

import static java.util.Objects.requireNonNull;

/**
 * Entry point for scoring CVSS vectors of any supported {@link Version}.
 * <p>
 * Instances hold no state between calls and may be shared freely between threads.
 */
public final class CvssCalculator {

    private final ScoreEngine cvss31Engine = new Cvss31ScoreEngine();
    private final ScoreEngine cvss40Engine = new Cvss40ScoreEngine();

    /**
     * @param vector The vector string to score
     * @return The {@link ScoreResult}
     * @throws InvalidVectorException When {@code vector} is missing or invalid
     */
    public ScoreResult calculate(final String vector) throws InvalidVectorException {
        return calculate(VectorParser.parse(vector));
    }

    public ScoreResult calculate(final MetricSet metrics) {
        requireNonNull(metrics, "metrics must not be null");
        return engineFor(metrics.version()).score(metrics);
    }

    public boolean isValid(final String vector) {
        try {
            VectorParser.parse(vector);
            return true;
        } catch (InvalidVectorException e) {
            return false;
        }
    }

    ScoreEngine engineFor(final Version version) {
        return switch (version) {
            case V3_1 -> cvss31Engine;
            case V4_0 -> cvss40Engine;
        };
    }

}
