package org.dependencytrack.cvss.metric;

import org.dependencytrack.cvss.api.Version;

import java.util.List;

import static org.dependencytrack.cvss.metric.MetricGroup.BASE;
import static org.dependencytrack.cvss.metric.MetricGroup.ENVIRONMENTAL;
import static org.dependencytrack.cvss.metric.MetricGroup.TEMPORAL;

/**
 * Metrics of CVSS v3.1, with the weights published in section 7.4 of the
 * <a href="https://www.first.org/cvss/v3.1/specification-document">specification</a>.
 */
final class Cvss31Metrics {

    static final MetricTable TABLE = new MetricTable(Version.V3_1, List.of(
            attackVector("AV", "Attack Vector", BASE).required().build(),
            attackComplexity("AC", "Attack Complexity", BASE).required().build(),
            privilegesRequired("PR", "Privileges Required", BASE).required().build(),
            userInteraction("UI", "User Interaction", BASE).required().build(),
            scope("S", "Scope", BASE).required().build(),
            impact("C", "Confidentiality", BASE).required().build(),
            impact("I", "Integrity", BASE).required().build(),
            impact("A", "Availability", BASE).required().build(),

            MetricDefinition.builder("E", "Exploit Code Maturity", TEMPORAL)
                    .value("X", 1.0)
                    .value("H", 1.0)
                    .value("F", 0.97)
                    .value("P", 0.94)
                    .value("U", 0.91)
                    .build(),
            MetricDefinition.builder("RL", "Remediation Level", TEMPORAL)
                    .value("X", 1.0)
                    .value("U", 1.0)
                    .value("W", 0.97)
                    .value("T", 0.96)
                    .value("O", 0.95)
                    .build(),
            MetricDefinition.builder("RC", "Report Confidence", TEMPORAL)
                    .value("X", 1.0)
                    .value("C", 1.0)
                    .value("R", 0.96)
                    .value("U", 0.92)
                    .build(),

            requirement("CR", "Confidentiality Requirement"),
            requirement("IR", "Integrity Requirement"),
            requirement("AR", "Availability Requirement"),
            attackVector("MAV", "Modified Attack Vector", ENVIRONMENTAL).value("X").modifies("AV").build(),
            attackComplexity("MAC", "Modified Attack Complexity", ENVIRONMENTAL).value("X").modifies("AC").build(),
            privilegesRequired("MPR", "Modified Privileges Required", ENVIRONMENTAL).value("X").modifies("PR").build(),
            userInteraction("MUI", "Modified User Interaction", ENVIRONMENTAL).value("X").modifies("UI").build(),
            scope("MS", "Modified Scope", ENVIRONMENTAL).value("X").modifies("S").build(),
            impact("MC", "Modified Confidentiality", ENVIRONMENTAL).value("X").modifies("C").build(),
            impact("MI", "Modified Integrity", ENVIRONMENTAL).value("X").modifies("I").build(),
            impact("MA", "Modified Availability", ENVIRONMENTAL).value("X").modifies("A").build()));

    private Cvss31Metrics() {
    }

    private static MetricDefinition.Builder attackVector(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("N", 0.85)
                .value("A", 0.62)
                .value("L", 0.55)
                .value("P", 0.2);
    }

    private static MetricDefinition.Builder attackComplexity(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("L", 0.77)
                .value("H", 0.44);
    }

    private static MetricDefinition.Builder privilegesRequired(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("N", 0.85, 0.85)
                .value("L", 0.62, 0.68)
                .value("H", 0.27, 0.5);
    }

    private static MetricDefinition.Builder userInteraction(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("N", 0.85)
                .value("R", 0.62);
    }

    private static MetricDefinition.Builder scope(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("U")
                .value("C");
    }

    private static MetricDefinition.Builder impact(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("H", 0.56)
                .value("L", 0.22)
                .value("N", 0);
    }

    private static MetricDefinition requirement(final String code, final String name) {
        return MetricDefinition.builder(code, name, ENVIRONMENTAL)
                .value("X", 1.0)
                .value("H", 1.5)
                .value("M", 1.0)
                .value("L", 0.5)
                .build();
    }

}
