package org.pytch.compiler.frontend.preparser;

import org.pytch.compiler.frontend.lexer.Token;

/**
 * One open layout context on the preparser's stack.
 *
 * @param kind What pushed the entry.
 * @param indentationLevel The indentation the entry is compared against; always 0 for brackets.
 * @param line The line of the token that pushed the entry.
 * @param trigger The token that pushed the entry, used to position bracket errors.
 */
public record IndentationStackEntry(
        ConstructKind kind,
        int indentationLevel,
        int line,
        Token trigger
) {

    /**
     * Creates the entry for a binding or conditional introducer.
     * @param kind {@link ConstructKind#BINDING} or {@link ConstructKind#CONDITIONAL}.
     * @param introducer The 'let' or 'if' token.
     * @return The entry, at the indentation of the introducer's line.
     */
    public static IndentationStackEntry construct(ConstructKind kind, Token introducer) {
        return new IndentationStackEntry(kind, introducer.indentation(), introducer.line(), introducer);
    }

    /**
     * Creates the entry for an opening bracket. Its indentation is pinned to 0 so that
     * no dedent can unwind it; only the matching closer does.
     * @param opener The opening bracket token.
     * @return The bracket entry.
     */
    public static IndentationStackEntry bracket(Token opener) {
        return new IndentationStackEntry(ConstructKind.BRACKET, 0, opener.line(), opener);
    }

    /**
     * Creates the entry for the first token of a line.
     * @param first The first token on its line.
     * @return The line-start entry.
     */
    public static IndentationStackEntry lineStart(Token first) {
        return new IndentationStackEntry(ConstructKind.LINE_START, first.indentation(), first.line(), first);
    }

    public boolean isBracket() {
        return kind == ConstructKind.BRACKET;
    }
}
