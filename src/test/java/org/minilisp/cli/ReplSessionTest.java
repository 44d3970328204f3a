package org.minilisp.cli;

import org.minilisp.Interpreter;
import org.minilisp.api.EvaluationResult;
import org.minilisp.api.IInterpreter;
import org.minilisp.api.LispErrorCode;
import org.minilisp.model.Expression.Num;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link ReplSession}.
 * The interpreter is mocked for the printing and command tests; the last test drives a real
 * {@link Interpreter} to check that definitions persist from line to line.
 */
@ExtendWith(MockitoExtension.class)
public class ReplSessionTest {

    @Mock
    private IInterpreter interpreter;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private ReplSession session(IInterpreter target) {
        return new ReplSession(target, new PrintWriter(out), new PrintWriter(err));
    }

    /**
     * Verifies that a successful result is rendered on standard output and nothing goes to the error stream.
     * This is a unit test for the session's output handling.
     */
    @Test
    @Tag("unit")
    void testPrintsRenderedResult() {
        // Arrange
        when(interpreter.evaluate("(+ 1 2)")).thenReturn(new EvaluationResult.Success(new Num(3)));

        // Act
        boolean keepGoing = session(interpreter).handleLine("(+ 1 2)");

        // Assert
        assertThat(keepGoing).isTrue();
        assertThat(out.toString().trim()).isEqualTo("3");
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that a failure prints one {@code Error:} line, is counted, and does not end the session.
     */
    @Test
    @Tag("unit")
    void testPrintsErrorLineAndCountsFailure() {
        // Arrange
        when(interpreter.evaluate("(foo)")).thenReturn(
                new EvaluationResult.Failure(LispErrorCode.NAME_UNDEFINED_SYMBOL, "Undefined symbol: foo"));
        ReplSession session = session(interpreter);

        // Act
        boolean keepGoing = session.handleLine("(foo)");

        // Assert
        assertThat(keepGoing).isTrue();
        assertThat(err.toString().trim()).isEqualTo("Error: Undefined symbol: foo");
        assertThat(session.getFailureCount()).isEqualTo(1);
    }

    /**
     * Verifies that a blank line is skipped without reaching the interpreter.
     */
    @Test
    @Tag("unit")
    void testBlankLinesAreSkipped() {
        // Arrange
        ReplSession session = session(interpreter);

        // Act
        boolean keepGoing = session.handleLine("   ");

        // Assert
        assertThat(keepGoing).isTrue();
        verify(interpreter, never()).evaluate(anyString());
        assertThat(out.toString()).isEmpty();
    }

    /**
     * Verifies that both spellings of the quit command end the session.
     */
    @Test
    @Tag("unit")
    void testQuitEndsSession() {
        // Arrange
        ReplSession session = session(interpreter);

        // Act / Assert
        assertThat(session.handleLine(":quit")).isFalse();
        assertThat(session.handleLine(":q")).isFalse();
        verify(interpreter, never()).evaluate(anyString());
    }

    /**
     * Verifies that an unrecognized colon command is reported and counted as a failure.
     */
    @Test
    @Tag("unit")
    void testUnknownCommandIsAnError() {
        // Arrange
        ReplSession session = session(interpreter);

        // Act
        boolean keepGoing = session.handleLine(":bogus");

        // Assert
        assertThat(keepGoing).isTrue();
        assertThat(err.toString()).contains("Unknown command: :bogus");
        assertThat(session.getFailureCount()).isEqualTo(1);
    }

    /**
     * Verifies that the help text lists the session commands and the special forms.
     */
    @Test
    @Tag("unit")
    void testHelpListsCommands() {
        // Act
        session(interpreter).handleLine(":help");

        // Assert
        assertThat(out.toString()).contains(":env", ":quit", "define, lambda, if");
    }

    /**
     * Verifies that definitions made on one line are visible on later lines and are listed by {@code :env},
     * and that an error in between does not disturb them.
     * This is an integration test against a real interpreter.
     */
    @Test
    @Tag("integration")
    void testDefinitionsPersistAndShowUpInEnv() {
        // Arrange
        ReplSession session = session(new Interpreter());

        // Act
        session.handleLine("(define square (lambda (x) (* x x)))");
        session.handleLine("(square 5)");
        session.handleLine("(foo 1 2)");
        session.handleLine("(define answer 42)");
        session.handleLine(":env");

        // Assert
        assertThat(out.toString().lines()).contains("<function>", "25", "42", "answer = 42", "square = <function>", "+ = <function>");
        assertThat(err.toString().lines()).containsExactly("Error: Undefined symbol: foo");
        assertThat(session.getFailureCount()).isEqualTo(1);
    }
}
