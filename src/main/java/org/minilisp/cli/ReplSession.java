package org.minilisp.cli;

import org.minilisp.ExpressionPrinter;
import org.minilisp.api.EvaluationResult;
import org.minilisp.api.IInterpreter;
import org.minilisp.model.Expression;

import java.io.PrintWriter;
import java.util.Map;

/**
 * Handles the lines of one read-eval-print session: each line is evaluated against the
 * interpreter's persistent global environment and the result or error is printed.
 * <p>
 * Lines starting with ':' are session commands rather than source text.
 * The session does no console I/O of its own, so it serves the terminal REPL, script files
 * and command-line expressions alike.
 */
public class ReplSession {

    private final IInterpreter interpreter;
    private final PrintWriter out;
    private final PrintWriter err;
    private int failures = 0;

    /**
     * @param interpreter The interpreter whose global environment the session uses.
     * @param out Where results are printed.
     * @param err Where errors are printed.
     */
    public ReplSession(IInterpreter interpreter, PrintWriter out, PrintWriter err) {
        this.interpreter = interpreter;
        this.out = out;
        this.err = err;
    }

    /**
     * Processes one input line.
     *
     * @param line The line as read, without its terminator.
     * @return {@code false} if the session should end.
     */
    public boolean handleLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        if (trimmed.startsWith(":")) {
            return handleCommand(trimmed);
        }

        EvaluationResult result = interpreter.evaluate(line);
        if (result instanceof EvaluationResult.Success success) {
            out.println(ExpressionPrinter.render(success.value()));
        } else if (result instanceof EvaluationResult.Failure failure) {
            failures++;
            err.println("Error: " + failure.message());
        }
        out.flush();
        err.flush();
        return true;
    }

    private boolean handleCommand(String command) {
        switch (command) {
            case ":quit":
            case ":q":
                return false;
            case ":help":
                printHelp();
                break;
            case ":env":
                for (Map.Entry<String, Expression> binding : interpreter.globalEnvironment().localBindings().entrySet()) {
                    out.println(binding.getKey() + " = " + ExpressionPrinter.render(binding.getValue()));
                }
                break;
            default:
                failures++;
                err.println("Error: Unknown command: " + command + ". Type ':help' for a list of commands.");
                break;
        }
        out.flush();
        err.flush();
        return true;
    }

    private void printHelp() {
        out.println("Enter one expression per line, e.g. (define square (lambda (x) (* x x))).");
        out.println("Special forms: define, lambda, if. Built-ins: + - * / % < > ==");
        out.println("Commands:");
        out.println("  :env   - List the global bindings");
        out.println("  :help  - Show this help");
        out.println("  :quit  - Leave the session (Ctrl+D also works)");
    }

    /**
     * @return The number of lines that failed so far.
     */
    public int getFailureCount() {
        return failures;
    }
}
