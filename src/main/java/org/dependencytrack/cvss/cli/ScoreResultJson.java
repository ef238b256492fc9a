package org.dependencytrack.cvss.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dependencytrack.cvss.api.ScoreResult;
import org.dependencytrack.cvss.api.Severity;
import org.dependencytrack.cvss.api.Version;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

final class ScoreResultJson {

    private ScoreResultJson() {
    }

    static ObjectNode toJson(final ObjectMapper objectMapper, final ScoreResult result) {
        final String temporalName = result.version() == Version.V4_0 ? "threat" : "temporal";

        final ObjectNode node = objectMapper.createObjectNode();
        node.put("version", result.version().number());
        node.put("vector_string", result.vectorString());
        node.put("base_score", result.baseScore());
        node.put("base_severity", result.baseSeverity().label());
        node.put(temporalName + "_score", result.temporalScore());
        node.put(temporalName + "_severity", label(result.temporalSeverity()));
        node.put("environmental_score", result.environmentalScore());
        node.put("environmental_severity", label(result.environmentalSeverity()));
        node.put("environmental_vector", result.environmentalVector());
        if (!result.supplementalMetrics().isEmpty()) {
            final ObjectNode supplementalNode = node.putObject("supplemental");
            for (final Map.Entry<String, String> entry : result.supplementalMetrics().entrySet()) {
                supplementalNode.put(entry.getKey(), entry.getValue());
            }
        }
        node.put("impact_score", oneDecimal(result.impactScore()));
        node.put("exploitability_score", oneDecimal(result.exploitabilityScore()));
        return node;
    }

    static BigDecimal oneDecimal(final double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP);
    }

    private static @Nullable String label(final @Nullable Severity severity) {
        return severity != null ? severity.label() : null;
    }

}
