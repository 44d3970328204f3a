package org.minilisp.cli.commands;

import org.minilisp.cli.CommandLineInterface;
import org.minilisp.cli.ReplSession;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "eval",
    mixinStandardHelpOptions = true,
    description = "Evaluates each argument as one line, in order, against a shared global environment."
)
public class EvalCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(arity = "1..*", paramLabel = "EXPR", description = "The expressions to evaluate.")
    private List<String> expressions;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final ReplSession session = new ReplSession(parent.createInterpreter(),
                spec.commandLine().getOut(), spec.commandLine().getErr());
        for (String expression : expressions) {
            if (!session.handleLine(expression)) {
                break;
            }
        }
        return session.getFailureCount() == 0 ? 0 : 1;
    }
}
