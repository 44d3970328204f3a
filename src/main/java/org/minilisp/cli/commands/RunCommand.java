package org.minilisp.cli.commands;

import org.minilisp.cli.CommandLineInterface;
import org.minilisp.cli.ReplSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Feeds a source file through the same line-by-line evaluation as the REPL, without prompts.
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Evaluates a source file line by line, printing each result."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file.")
    private File file;

    @Option(names = "--fail-fast", description = "Stop at the first line that fails.")
    private boolean failFast;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        if (!file.isFile()) {
            spec.commandLine().getErr().println("Error: File not found: " + file.getPath());
            return 2;
        }

        final ReplSession session = new ReplSession(parent.createInterpreter(),
                spec.commandLine().getOut(), spec.commandLine().getErr());
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                final int failuresBefore = session.getFailureCount();
                if (!session.handleLine(line)) {
                    break;
                }
                if (session.getFailureCount() > failuresBefore) {
                    log.debug("{}:{} failed", file.getName(), lineNumber);
                    if (failFast) {
                        break;
                    }
                }
            }
        }
        log.debug("Processed {} lines of {}", lineNumber, file.getName());
        return session.getFailureCount() == 0 ? 0 : 1;
    }
}
