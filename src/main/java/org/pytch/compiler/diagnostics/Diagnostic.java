package org.pytch.compiler.diagnostics;

import org.pytch.compiler.api.CompilerErrorCode;
import org.pytch.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error or note) produced while
 * tokenizing a compilation unit.
 *
 * @param type The type of the diagnostic.
 * @param code The error code, or {@code null} for notes.
 * @param message The diagnostic message.
 * @param location The position the diagnostic points at.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        SourceInfo location
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that halts tokenization. */
        ERROR,
        /** Additional context attached to the preceding error. */
        NOTE
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, location.fileName(), location.lineNumber(),
                location.columnNumber(), message);
    }
}
