package org.dependencytrack.cvss.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dependencytrack.cvss.api.ScoreResult;
import org.dependencytrack.cvss.engine.CvssCalculator;
import org.dependencytrack.cvss.vector.InvalidVectorException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import static org.dependencytrack.cvss.cli.ScoreResultJson.oneDecimal;

@Command(name = "score", description = "Compute the scores of CVSS vectors.")
public class ScoreCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-f", "--format"}, defaultValue = "JSON",
            description = "Output format, one of: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    OutputFormat format;

    @Parameters(arity = "1..*", description = "CVSS v3.1 or v4.0 vectors to score")
    List<String> vectors;

    @Override
    public Integer call() throws JsonProcessingException {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        final var calculator = new CvssCalculator();
        final var objectMapper = new ObjectMapper();

        int vectorsFailed = 0;
        for (final String vector : vectors) {
            final ScoreResult result;
            try {
                result = calculator.calculate(vector);
            } catch (InvalidVectorException e) {
                err.println("%s: %s".formatted(vector, e.getMessage()));
                vectorsFailed++;
                continue;
            }

            switch (format) {
                case JSON -> out.println(objectMapper
                        .writerWithDefaultPrettyPrinter()
                        .writeValueAsString(ScoreResultJson.toJson(objectMapper, result)));
                case TEXT -> printText(out, result);
            }
        }

        out.flush();
        err.flush();
        return vectorsFailed == 0 ? 0 : 1;
    }

    private static void printText(final PrintWriter out, final ScoreResult result) {
        final String temporalName = result.threatScore() != null ? "Threat" : "Temporal";

        out.println("Vector: " + result.vectorString());
        out.println("Base Score: %s (%s)".formatted(result.baseScore(), result.baseSeverity().label()));
        out.println("Impact Score: " + oneDecimal(result.impactScore()));
        out.println("Exploitability Score: " + oneDecimal(result.exploitabilityScore()));
        if (result.temporalScore() != null) {
            out.println("%s Score: %s (%s)".formatted(
                    temporalName, result.temporalScore(), result.temporalSeverity().label()));
        }
        if (result.environmentalScore() != null) {
            out.println("Environmental Score: %s (%s)".formatted(
                    result.environmentalScore(), result.environmentalSeverity().label()));
            out.println("Environmental Vector: " + result.environmentalVector());
        }
        for (final Map.Entry<String, String> entry : result.supplementalMetrics().entrySet()) {
            out.println("Supplemental %s: %s".formatted(entry.getKey(), entry.getValue()));
        }
        out.println();
    }

}
