package org.dependencytrack.cvss.metric;

/**
 * Metric groups, in the order their metrics appear in a canonical vector.
 * CVSS v4.0 calls the {@link #TEMPORAL} group "threat".
 */
public enum MetricGroup {

    BASE,
    TEMPORAL,
    ENVIRONMENTAL,
    SUPPLEMENTAL

}
