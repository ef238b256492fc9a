package org.dependencytrack.cvss;

import org.dependencytrack.cvss.cli.BatchCommand;
import org.dependencytrack.cvss.cli.ScoreCommand;
import org.dependencytrack.cvss.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
        name = "cvss",
        version = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                BatchCommand.class,
                ScoreCommand.class,
                ValidateCommand.class})
public class Application implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    public static void main(final String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Application())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

}
