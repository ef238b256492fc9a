package org.dependencytrack.cvss.vector;

import org.dependencytrack.cvss.api.Version;

import java.util.List;

public final class InvalidMetricValueException extends InvalidVectorException {

    private final Version version;
    private final String metric;
    private final String value;
    private final List<String> legalValues;

    InvalidMetricValueException(
            final Version version,
            final String metric,
            final String value,
            final List<String> legalValues) {
        super("Invalid value %s for metric %s of CVSS %s; expected one of %s".formatted(
                value, metric, version.number(), String.join(", ", legalValues)));
        this.version = version;
        this.metric = metric;
        this.value = value;
        this.legalValues = List.copyOf(legalValues);
    }

    public Version getVersion() {
        return version;
    }

    public String getMetric() {
        return metric;
    }

    public String getValue() {
        return value;
    }

    public List<String> getLegalValues() {
        return legalValues;
    }

}
