package org.dependencytrack.cvss.engine;

import org.dependencytrack.cvss.api.MetricSet;
import org.dependencytrack.cvss.vector.VectorParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModifiedMetricsTest {

    @Test
    void resolveShouldFillUndefinedModifiedMetricsFromBaseMetrics() throws Exception {
        final MetricSet metrics = VectorParser.parse("CVSS:3.1/AV:N/AC:H/PR:L/UI:R/S:C/C:H/I:L/A:N/MAV:L");

        final MetricSet resolved = ModifiedMetrics.resolve(metrics);

        assertThat(resolved.get("MAV")).isEqualTo("L");
        assertThat(resolved.get("MAC")).isEqualTo("H");
        assertThat(resolved.get("MPR")).isEqualTo("L");
        assertThat(resolved.get("MUI")).isEqualTo("R");
        assertThat(resolved.get("MS")).isEqualTo("C");
        assertThat(resolved.get("MC")).isEqualTo("H");
        assertThat(resolved.get("MI")).isEqualTo("L");
        assertThat(resolved.get("MA")).isEqualTo("N");
    }

    @Test
    void resolveShouldLeaveOtherMetricsUntouched() throws Exception {
        final MetricSet metrics = VectorParser.parse("CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:H/VI:H/VA:H/SC:N/SI:N/SA:N/E:P/U:Red");

        final MetricSet resolved = ModifiedMetrics.resolve(metrics);

        assertThat(resolved.version()).isEqualTo(metrics.version());
        assertThat(resolved.get("E")).isEqualTo("P");
        assertThat(resolved.get("U")).isEqualTo("Red");
        assertThat(resolved.isDefined("CR")).isFalse();
        assertThat(resolved.get("MSC")).isEqualTo("N");
        assertThat(metrics.isDefined("MSC")).isFalse();
    }

    @Test
    void resolveShouldReturnSameSetWhenAllModifiedMetricsAreDefined() throws Exception {
        final MetricSet metrics = VectorParser.parse(
                "CVSS:3.1/AV:N/AC:L/PR:N/UI:N/S:U/C:H/I:H/A:H/MAV:N/MAC:L/MPR:N/MUI:N/MS:U/MC:H/MI:H/MA:H");

        assertThat(ModifiedMetrics.resolve(metrics)).isSameAs(metrics);
    }

}
