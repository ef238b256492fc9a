package org.dependencytrack.cvss.vector;

import org.dependencytrack.cvss.api.Version;

public final class UnknownMetricException extends InvalidVectorException {

    private final Version version;
    private final String metric;

    UnknownMetricException(final Version version, final String metric) {
        super("Metric %s is not defined for CVSS %s".formatted(metric, version.number()));
        this.version = version;
        this.metric = metric;
    }

    public Version getVersion() {
        return version;
    }

    public String getMetric() {
        return metric;
    }

}
