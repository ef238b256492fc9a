package org.dependencytrack.cvss.vector;

public final class DuplicateMetricException extends InvalidVectorException {

    private final String metric;

    DuplicateMetricException(final String metric) {
        super("Metric %s is specified more than once".formatted(metric));
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }

}
