package org.pytch.compiler.frontend.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * Defines the different types of tokens in a Pytch token stream. Every type carries the
 * description used when the type is named in a diagnostic or a rendered token stream.
 */
public enum TokenType {
    // Literals.
    /** An identifier, such as a binding or function name. */
    IDENTIFIER("identifier"),
    /** A decimal integer literal; its value is a {@link java.math.BigInteger}. */
    INT_LITERAL("integer literal"),
    /** A single- or double-quoted string literal; its value is the decoded body. */
    STRING_LITERAL("string literal"),

    // Keywords.
    /** The 'and' operator. */
    AND("'and'"),
    /** The 'def' keyword. */
    DEF("'def'"),
    /** The 'else' keyword of a conditional. */
    ELSE("'else'"),
    /** The 'if' keyword, which introduces a conditional. */
    IF("'if'"),
    /** The 'let' keyword, which introduces a binding. */
    LET("'let'"),
    /** The 'or' operator. */
    OR("'or'"),
    /** The 'then' keyword of a conditional. */
    THEN("'then'"),

    // Operators and punctuation.
    /** The '+' operator. */
    PLUS("'+'"),
    /** The '-' operator. */
    MINUS("'-'"),
    /** A ';' written in the source. */
    SEMICOLON("';'"),
    /** The '(' character. */
    LPAREN("'('"),
    /** The ')' character. */
    RPAREN("')'"),
    /** The ',' character. */
    COMMA("','"),
    /** The '=' character. */
    EQUALS("'='"),
    /** The '->' arrow. */
    ARROW("'->'"),
    /** The '...' ellipsis. */
    ELLIPSIS("'...'"),

    // Synthetic tokens, inserted by the preparser.
    /** Closes the value of a 'let' binding; the binding's body follows. */
    DUMMY_IN("the end of a 'let' binding"),
    /** Closes an 'if' expression. */
    DUMMY_ENDIF("the end of an 'if' expression"),
    /** Sequences two statement-expressions at the same indentation. */
    DUMMY_SEMICOLON("the end of a statement"),

    // Miscellaneous.
    /** Represents the end of the source file. */
    END_OF_FILE("the end of the file");

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", AND,
            "def", DEF,
            "else", ELSE,
            "if", IF,
            "let", LET,
            "or", OR,
            "then", THEN
    );

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    /**
     * Looks up the keyword spelled exactly like the given lexeme.
     * @param lexeme The scanned identifier text.
     * @return The keyword type, or empty if the lexeme is an ordinary identifier.
     */
    public static Optional<TokenType> keyword(String lexeme) {
        return Optional.ofNullable(KEYWORDS.get(lexeme));
    }

    /**
     * @return How this type is named in diagnostics, e.g. {@code 'let'} or {@code identifier}.
     */
    public String description() {
        return description;
    }

    public boolean isKeyword() {
        return KEYWORDS.containsValue(this);
    }

    /**
     * Dummy tokens are never written by the user. The end-of-input token counts as one.
     * @return {@code true} for the synthetic types and {@link #END_OF_FILE}.
     */
    public boolean isDummy() {
        return switch (this) {
            case DUMMY_IN, DUMMY_ENDIF, DUMMY_SEMICOLON, END_OF_FILE -> true;
            default -> false;
        };
    }
}
