package org.pytch.compiler.frontend.lexer;

/**
 * Represents a single token of a Pytch token stream, either scanned by the {@link Lexer}
 * or inserted by the preparser.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code; empty for dummy tokens.
 * @param value The decoded value: a {@link java.math.BigInteger} for integer literals,
 *              the unescaped body for string literals, otherwise {@code null}.
 * @param span The region of source text the token covers.
 * @param indentation The number of leading spaces on the line the token is on.
 * @param fileName The logical file name of the source the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        SourceSpan span,
        int indentation,
        String fileName
) {

    /**
     * Creates a zero-width synthetic token placed at the token that caused its insertion.
     * @param type The synthetic token type.
     * @param anchor The token in front of which the synthetic token is inserted.
     * @return The synthetic token.
     */
    public static Token dummy(TokenType type, Token anchor) {
        return new Token(type, "", null,
                SourceSpan.point(anchor.line(), anchor.column()), anchor.indentation(), anchor.fileName());
    }

    /**
     * @return The line the token starts on.
     */
    public int line() {
        return span.startLine();
    }

    /**
     * @return The column the token starts at.
     */
    public int column() {
        return span.startColumn();
    }

    public boolean isDummy() {
        return type.isDummy();
    }
}
