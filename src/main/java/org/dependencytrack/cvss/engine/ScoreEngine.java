package org.dependencytrack.cvss.engine;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.api.ScoreResult;
import org.dependencytrack.cvss.api.Version;

/**
 * Computes scores of a single CVSS {@link Version}.
 * <p>
 * Implementations are stateless and may be shared between threads.
 */
public interface ScoreEngine {

    Version version();

    /**
     * @param metrics A {@link MetricSet} of this engine's {@link #version()}
     * @return The {@link ScoreResult}
     * @throws IllegalArgumentException When {@code metrics} belongs to another version
     */
    ScoreResult score(MetricSet metrics);

}
