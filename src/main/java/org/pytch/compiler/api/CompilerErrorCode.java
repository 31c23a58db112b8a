package org.pytch.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while turning
 * source text into a token stream. Each code carries a stable numeric id that is
 * printed in rendered diagnostics.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Scanner Errors
    /** A character that may not appear at this position, such as a tab or a non-ASCII letter. */
    ILLEGAL_CHARACTER(1000),
    /** A string literal reached a newline or the end of the input before its closing quote. */
    UNTERMINATED_STRING(1001),
    /** A backslash inside a string literal was the last character of the input. */
    BAD_ESCAPE_AT_EOF(1002),
    // endregion

    // region Preparser Errors
    /** A closing bracket had no open bracket to match. */
    UNMATCHED_CLOSE_BRACKET(1100),
    /** An open bracket was still unclosed when the input ended. */
    UNCLOSED_BRACKET_AT_EOF(1101);
    // endregion

    private final int id;

    CompilerErrorCode(int id) {
        this.id = id;
    }

    /**
     * @return The stable numeric id of this code.
     */
    public int id() {
        return id;
    }
}
