package org.dependencytrack.cvss.metric;

import org.dependencytrack.cvss.api.Version;

import java.util.List;

import static org.dependencytrack.cvss.metric.MetricGroup.BASE;
import static org.dependencytrack.cvss.metric.MetricGroup.ENVIRONMENTAL;
import static org.dependencytrack.cvss.metric.MetricGroup.SUPPLEMENTAL;
import static org.dependencytrack.cvss.metric.MetricGroup.TEMPORAL;

/**
 * Metrics of CVSS v4.0, in the order of section 7 of the
 * <a href="https://www.first.org/cvss/v4.0/specification-document">specification</a>.
 * <p>
 * Exploitability weights follow their v3.1 counterparts. Impact weights are expressed
 * directly on the score scale, as v4.0 sums them with exploitability instead of combining
 * them into an impact sub-score first.
 */
final class Cvss40Metrics {

    static final MetricTable TABLE = new MetricTable(Version.V4_0, List.of(
            attackVector("AV", "Attack Vector", BASE).required().build(),
            attackComplexity("AC", "Attack Complexity", BASE).required().build(),
            attackRequirements("AT", "Attack Requirements", BASE).required().build(),
            privilegesRequired("PR", "Privileges Required", BASE).required().build(),
            userInteraction("UI", "User Interaction", BASE).required().build(),
            vulnerableSystemImpact("VC", "Vulnerable System Confidentiality Impact", BASE).required().build(),
            vulnerableSystemImpact("VI", "Vulnerable System Integrity Impact", BASE).required().build(),
            vulnerableSystemImpact("VA", "Vulnerable System Availability Impact", BASE).required().build(),
            subsequentSystemImpact("SC", "Subsequent System Confidentiality Impact", BASE).required().build(),
            subsequentSystemImpact("SI", "Subsequent System Integrity Impact", BASE).required().build(),
            subsequentSystemImpact("SA", "Subsequent System Availability Impact", BASE).required().build(),

            MetricDefinition.builder("E", "Exploit Maturity", TEMPORAL)
                    .value("X", 1.0)
                    .value("A", 1.0)
                    .value("P", 0.94)
                    .value("U", 0.91)
                    .build(),

            requirement("CR", "Confidentiality Requirement"),
            requirement("IR", "Integrity Requirement"),
            requirement("AR", "Availability Requirement"),
            attackVector("MAV", "Modified Attack Vector", ENVIRONMENTAL).value("X").modifies("AV").build(),
            attackComplexity("MAC", "Modified Attack Complexity", ENVIRONMENTAL).value("X").modifies("AC").build(),
            attackRequirements("MAT", "Modified Attack Requirements", ENVIRONMENTAL).value("X").modifies("AT").build(),
            privilegesRequired("MPR", "Modified Privileges Required", ENVIRONMENTAL).value("X").modifies("PR").build(),
            userInteraction("MUI", "Modified User Interaction", ENVIRONMENTAL).value("X").modifies("UI").build(),
            vulnerableSystemImpact("MVC", "Modified Vulnerable System Confidentiality", ENVIRONMENTAL).value("X").modifies("VC").build(),
            vulnerableSystemImpact("MVI", "Modified Vulnerable System Integrity", ENVIRONMENTAL).value("X").modifies("VI").build(),
            vulnerableSystemImpact("MVA", "Modified Vulnerable System Availability", ENVIRONMENTAL).value("X").modifies("VA").build(),
            subsequentSystemImpact("MSC", "Modified Subsequent System Confidentiality", ENVIRONMENTAL).value("X").modifies("SC").build(),
            // Safety (S) can only be assessed for integrity and availability of subsequent systems.
            subsequentSystemImpact("MSI", "Modified Subsequent System Integrity", ENVIRONMENTAL).value("S", 3.0).value("X").modifies("SI").build(),
            subsequentSystemImpact("MSA", "Modified Subsequent System Availability", ENVIRONMENTAL).value("S", 3.0).value("X").modifies("SA").build(),

            MetricDefinition.builder("S", "Safety", SUPPLEMENTAL)
                    .value("X").value("N").value("P")
                    .build(),
            MetricDefinition.builder("AU", "Automatable", SUPPLEMENTAL)
                    .value("X").value("N").value("Y")
                    .build(),
            MetricDefinition.builder("R", "Recovery", SUPPLEMENTAL)
                    .value("X").value("A").value("U").value("I")
                    .build(),
            MetricDefinition.builder("V", "Value Density", SUPPLEMENTAL)
                    .value("X").value("D").value("C")
                    .build(),
            MetricDefinition.builder("RE", "Vulnerability Response Effort", SUPPLEMENTAL)
                    .value("X").value("L").value("M").value("H")
                    .build(),
            MetricDefinition.builder("U", "Provider Urgency", SUPPLEMENTAL)
                    .value("X").value("Clear").value("Green").value("Amber").value("Red")
                    .build()));

    private Cvss40Metrics() {
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

    private static MetricDefinition.Builder attackRequirements(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("N", 1.0)
                .value("P", 0.62);
    }

    private static MetricDefinition.Builder privilegesRequired(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("N", 0.85)
                .value("L", 0.62)
                .value("H", 0.27);
    }

    private static MetricDefinition.Builder userInteraction(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("N", 0.85)
                .value("P", 0.62)
                .value("A", 0.5);
    }

    private static MetricDefinition.Builder vulnerableSystemImpact(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("H", 5.9)
                .value("L", 1.4)
                .value("N", 0);
    }

    private static MetricDefinition.Builder subsequentSystemImpact(final String code, final String name, final MetricGroup group) {
        return MetricDefinition.builder(code, name, group)
                .value("H", 2.0)
                .value("L", 0.5)
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
