package org.dependencytrack.cvss.vector;

import org.dependencytrack.cvss.api.Version;

import java.util.List;

public final class MissingRequiredMetricException extends InvalidVectorException {

    private final Version version;
    private final List<String> missingMetrics;

    MissingRequiredMetricException(final Version version, final List<String> missingMetrics) {
        super("Missing required metrics for CVSS %s: %s".formatted(
                version.number(), String.join(", ", missingMetrics)));
        this.version = version;
        this.missingMetrics = List.copyOf(missingMetrics);
    }

    public Version getVersion() {
        return version;
    }

    /**
     * @return Codes of the missing metrics, in canonical order
     */
    public List<String> getMissingMetrics() {
        return missingMetrics;
    }

}
