package org.minilisp.cli.commands;

import com.typesafe.config.Config;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.minilisp.cli.CommandLineInterface;
import org.minilisp.cli.ReplSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * The interactive read-eval-print loop. One line is one expression; definitions persist
 * across lines for the lifetime of the session.
 */
@Command(
    name = "repl",
    mixinStandardHelpOptions = true,
    description = "Starts the interactive read-eval-print loop."
)
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);
    private static final String PROMPT_PATH = "minilisp.repl.prompt";
    private static final String DEFAULT_PROMPT = "lisp> ";

    @ParentCommand
    private CommandLineInterface parent;

    /**
     * Sets the parent when the command is run without going through picocli.
     * @param parent The root command.
     */
    public void setParent(CommandLineInterface parent) {
        this.parent = parent;
    }

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        final String prompt = config.hasPath(PROMPT_PATH) ? config.getString(PROMPT_PATH) : DEFAULT_PROMPT;

        try (Terminal terminal = openTerminal()) {
            final LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            final PrintWriter out = terminal.writer();
            final ReplSession session = new ReplSession(parent.createInterpreter(), out, out);

            log.debug("REPL started.");
            while (true) {
                final String line;
                try {
                    line = lineReader.readLine(prompt);
                } catch (UserInterruptException | EndOfFileException e) {
                    // Ctrl+C or Ctrl+D
                    break;
                }
                if (line == null || !session.handleLine(line)) {
                    break;
                }
            }
            log.debug("REPL finished after {} failed lines.", session.getFailureCount());
        }
        return 0;
    }

    private Terminal openTerminal() throws java.io.IOException {
        try {
            // Temporarily suppress JLine warnings
            final java.util.logging.Logger jlineLogger = java.util.logging.Logger.getLogger("org.jline");
            final java.util.logging.Level originalLevel = jlineLogger.getLevel();
            jlineLogger.setLevel(java.util.logging.Level.SEVERE);
            try {
                return TerminalBuilder.builder().system(true).build();
            } finally {
                jlineLogger.setLevel(originalLevel);
            }
        } catch (Exception e) {
            // Fallback to dumb terminal if system terminal is not available (e.g., in an IDE)
            log.debug("System terminal unavailable, falling back to a dumb terminal: {}", e.getMessage());
            return TerminalBuilder.builder().dumb(true).build();
        }
    }
}
