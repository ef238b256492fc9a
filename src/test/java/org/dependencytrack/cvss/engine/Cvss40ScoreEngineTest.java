package org.dependencytrack.cvss.engine;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.api.ScoreResult;
import org.dependencytrack.cvss.api.Severity;
import org.dependencytrack.cvss.api.Version;
import org.dependencytrack.cvss.vector.VectorParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class Cvss40ScoreEngineTest {

    private static final String CRITICAL_VECTOR = "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:H/VI:H/VA:H/SC:N/SI:N/SA:N";

    private final Cvss40ScoreEngine engine = new Cvss40ScoreEngine();

    @ParameterizedTest
    @CsvSource({
            "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:H/VI:H/VA:H/SC:H/SI:H/SA:H, 10.0, CRITICAL",
            "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:H/VI:H/VA:H/SC:N/SI:N/SA:N, 9.8, CRITICAL",
            "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:N/VI:N/VA:N/SC:H/SI:N/SA:N, 5.9, MEDIUM",
            "CVSS:4.0/AV:L/AC:H/AT:P/PR:H/UI:A/VC:L/VI:N/VA:N/SC:N/SI:N/SA:N, 1.6, LOW",
            "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:N/VI:N/VA:N/SC:N/SI:N/SA:N, 0.0, NONE"
    })
    void scoreShouldComputeBaseScore(final String vector, final double expectedScore, final Severity expectedSeverity) throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(vector));

        assertThat(result.version()).isEqualTo(Version.V4_0);
        assertThat(result.baseScore()).isEqualTo(expectedScore);
        assertThat(result.baseSeverity()).isEqualTo(expectedSeverity);
    }

    @Test
    void scoreShouldReturnSubScores() throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(
                "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:H/VI:L/VA:N/SC:L/SI:N/SA:N"));

        assertThat(result.exploitabilityScore()).isCloseTo(3.8870, within(0.0001));
        assertThat(result.impactScore()).isCloseTo(6.4, within(0.0001));
    }

    @Test
    void scoreShouldNotComputeOptionalScoresWhenTheirMetricsAreAbsent() throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(CRITICAL_VECTOR));

        assertThat(result.threatScore()).isNull();
        assertThat(result.threatSeverity()).isNull();
        assertThat(result.environmentalScore()).isNull();
        assertThat(result.environmentalSeverity()).isNull();
        assertThat(result.environmentalVector()).isNull();
        assertThat(result.supplementalMetrics()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "E:A, 9.8, CRITICAL",
            "E:P, 9.3, CRITICAL",
            "E:U, 9.0, CRITICAL"
    })
    void scoreShouldComputeThreatScore(final String exploitMaturity, final double expectedScore, final Severity expectedSeverity) throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(CRITICAL_VECTOR + "/" + exploitMaturity));

        assertThat(result.threatScore()).isEqualTo(expectedScore);
        assertThat(result.threatSeverity()).isEqualTo(expectedSeverity);
        assertThat(result.temporalScore()).isEqualTo(expectedScore);
        assertThat(result.baseScore()).isEqualTo(9.8);
    }

    @ParameterizedTest
    @CsvSource({
            "CR:L/IR:L/AR:L, 4.9, MEDIUM",
            "CR:L, 9.8, CRITICAL",
            "MAV:P, 6.9, MEDIUM",
            "MAV:P/CR:H, 10.0, CRITICAL",
            "MVC:N/MVI:N/MVA:N/MSC:N/MSI:N/MSA:N, 0.0, NONE",
            "MVC:N/MVI:N/MVA:N/MSC:N/MSI:N/MSA:N/CR:H, 0.0, NONE"
    })
    void scoreShouldComputeEnvironmentalScore(final String optionalMetrics, final double expectedScore, final Severity expectedSeverity) throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(CRITICAL_VECTOR + "/" + optionalMetrics));

        assertThat(result.environmentalScore()).isEqualTo(expectedScore);
        assertThat(result.environmentalSeverity()).isEqualTo(expectedSeverity);
        assertThat(result.baseScore()).isEqualTo(9.8);
    }

    @Test
    void scoreShouldNotApplyThreatToEnvironmentalScore() throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(CRITICAL_VECTOR + "/E:U/CR:L"));

        assertThat(result.threatScore()).isEqualTo(9.0);
        assertThat(result.environmentalScore()).isEqualTo(9.8);
    }

    @Test
    void scoreShouldWeighSafetyImpactOnSubsequentSystems() throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(
                "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:L/VI:N/VA:N/SC:N/SI:N/SA:N/MSI:S"));

        assertThat(result.baseScore()).isEqualTo(5.3);
        assertThat(result.environmentalScore()).isEqualTo(8.3);
        assertThat(result.environmentalSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void scoreShouldReportResolvedEnvironmentalVector() throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(CRITICAL_VECTOR + "/CR:L/IR:L/AR:L"));

        assertThat(result.environmentalVector()).isEqualTo(CRITICAL_VECTOR
                + "/CR:L/IR:L/AR:L/MAV:N/MAC:L/MAT:N/MPR:N/MUI:N/MVC:H/MVI:H/MVA:H/MSC:N/MSI:N/MSA:N");
    }

    @Test
    void scoreShouldEchoSupplementalMetricsWithoutAffectingScores() throws Exception {
        final ScoreResult result = engine.score(VectorParser.parse(CRITICAL_VECTOR + "/U:Red/AU:Y/S:P/R:A"));

        assertThat(result.supplementalMetrics()).containsExactly(
                entry("S", "P"),
                entry("AU", "Y"),
                entry("R", "A"),
                entry("U", "Red"));
        assertThat(result.baseScore()).isEqualTo(9.8);
        assertThat(result.threatScore()).isNull();
        assertThat(result.environmentalScore()).isNull();
        assertThat(result.vectorString()).isEqualTo(CRITICAL_VECTOR + "/S:P/AU:Y/R:A/U:Red");
    }

    @Test
    void baseScoreShouldBeMonotonicInEachImpactMetric() throws Exception {
        final List<String> impactValues = List.of("N", "L", "H");
        final List<String> codes = List.of("VC", "VI", "VA", "SC", "SI", "SA");

        for (final String av : List.of("N", "A", "L", "P")) {
            for (final String fixed : impactValues) {
                for (final String varyingCode : codes) {
                    double previous = -1;
                    for (final String varying : impactValues) {
                        final var vector = new StringBuilder("CVSS:4.0/AV:%s/AC:L/AT:N/PR:N/UI:N".formatted(av));
                        for (final String code : codes) {
                            vector.append('/').append(code).append(':').append(code.equals(varyingCode) ? varying : fixed);
                        }

                        final double score = engine.score(VectorParser.parse(vector.toString())).baseScore();
                        assertThat(score).isGreaterThanOrEqualTo(previous);
                        previous = score;
                    }
                }
            }
        }
    }

    @Test
    void scoreShouldThrowForMetricsOfOtherVersion() throws Exception {
        final MetricSet metrics = VectorParser.parse("CVSS:3.1/AV:N/AC:L/PR:N/UI:N/S:U/C:H/I:H/A:H");

        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> engine.score(metrics));
    }

}
