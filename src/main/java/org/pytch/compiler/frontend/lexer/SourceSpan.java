package org.pytch.compiler.frontend.lexer;

/**
 * The region of source text a token covers. Lines and columns are 1-based; the end
 * column is exclusive, so a zero-width span has equal start and end.
 *
 * @param startLine The line of the first character.
 * @param startColumn The column of the first character.
 * @param endLine The line of the position after the last character.
 * @param endColumn The column of the position after the last character.
 */
public record SourceSpan(int startLine, int startColumn, int endLine, int endColumn) {

    /**
     * Creates a zero-width span.
     * @param line The line of the position.
     * @param column The column of the position.
     * @return A span that starts and ends at the given position.
     */
    public static SourceSpan point(int line, int column) {
        return new SourceSpan(line, column, line, column);
    }

    public boolean isEmpty() {
        return startLine == endLine && startColumn == endColumn;
    }
}
