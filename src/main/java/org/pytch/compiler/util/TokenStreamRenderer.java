package org.pytch.compiler.util;

import org.pytch.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * Renders a token stream as text, one token per line. A token whose text is empty or
 * already spelled out by its type's description is rendered as the description alone,
 * any other token as the description followed by its quoted text:
 * <pre>
 * 'let'
 * identifier 'foo'
 * '='
 * integer literal '1'
 * the end of a 'let' binding
 * </pre>
 */
public final class TokenStreamRenderer {

    private TokenStreamRenderer() {}

    /**
     * @param tokens The tokens to render.
     * @return One line per token, each terminated by a newline.
     */
    public static String render(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(renderToken(token)).append('\n');
        }
        return sb.toString();
    }

    /**
     * @param token The token to render.
     * @return The token's line in a rendered stream.
     */
    public static String renderToken(Token token) {
        String description = token.type().description();
        String quoted = quote(token.text());
        if (token.text().isEmpty() || description.equals(quoted)) {
            return description;
        }
        return description + " " + quoted;
    }

    private static String quote(String text) {
        return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
