package org.dependencytrack.cvss.cli;

import org.dependencytrack.cvss.vector.InvalidVectorException;
import org.dependencytrack.cvss.vector.VectorParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Check CVSS vectors without scoring them.")
public class ValidateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", description = "CVSS v3.1 or v4.0 vectors to validate")
    List<String> vectors;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();

        int vectorsInvalid = 0;
        for (final String vector : vectors) {
            try {
                VectorParser.parse(vector);
                out.println("%s: OK".formatted(vector));
            } catch (InvalidVectorException e) {
                out.println("%s: %s".formatted(vector, e.getMessage()));
                vectorsInvalid++;
            }
        }

        out.flush();
        return vectorsInvalid == 0 ? 0 : 1;
    }

}
