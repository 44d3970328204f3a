package org.minilisp.parser;

import org.minilisp.api.LispErrorCode;
import org.minilisp.api.LispException;
import org.minilisp.lexer.Lexer;
import org.minilisp.lexer.Token;
import org.minilisp.lexer.TokenType;
import org.minilisp.model.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * A recursive-descent parser with one token of lookahead. It consumes the tokens produced by
 * the {@link Lexer} and builds one {@link Expression} tree per call to {@link #parseExpression()}.
 */
public class Parser {

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse.
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Tokenizes the source and parses its first top-level expression.
     * Anything after that expression is ignored.
     *
     * @param source The source text.
     * @return The parsed expression.
     * @throws LispException if lexing or parsing fails.
     */
    public static Expression parse(String source) {
        return new Parser(new Lexer(source).scanTokens()).parseExpression();
    }

    /**
     * Parses one expression starting at the cursor and advances the cursor past it.
     * @return The parsed expression.
     * @throws LispException if the tokens do not form an expression.
     */
    public Expression parseExpression() {
        if (isAtEnd()) {
            throw new LispException(LispErrorCode.PARSE_UNEXPECTED_TOKEN, "Unexpected token: end of input");
        }
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return number(token);
            case SYMBOL:
                return new Expression.Sym(token.text());
            case PAREN_OPEN:
                return list();
            default:
                throw new LispException(LispErrorCode.PARSE_UNEXPECTED_TOKEN,
                        "Unexpected token: '" + token.text() + "' at column " + token.column());
        }
    }

    private Expression list() {
        List<Expression> elements = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.PAREN_CLOSE)) {
            elements.add(parseExpression());
        }
        if (isAtEnd()) {
            throw new LispException(LispErrorCode.PARSE_MISSING_CLOSING_PAREN, "Missing closing parenthesis");
        }
        advance(); // consume ')'
        return elements.isEmpty() ? Expression.ListVal.EMPTY : new Expression.ListVal(elements);
    }

    private Expression number(Token token) {
        try {
            return new Expression.Num(Double.parseDouble(token.text()));
        } catch (NumberFormatException e) {
            throw new LispException(LispErrorCode.PARSE_INVALID_NUMBER,
                    "Invalid number format: " + token.text(), e);
        }
    }

    /**
     * @return {@code true} if tokens are left after the expressions parsed so far.
     */
    public boolean hasRemainingTokens() {
        return !isAtEnd();
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }
}
