package org.pytch.compiler.diagnostics;

import org.pytch.compiler.api.CompilationException;
import org.pytch.compiler.api.CompilerErrorCode;
import org.pytch.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the diagnostic messages of one compilation unit.
 * <p>
 * This decouples error reporting from the scanner and preparser: they report here
 * and then halt by throwing the returned {@link CompilationException}.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error and builds the exception that halts tokenization.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param location The position of the offending token.
     * @return The exception to throw.
     */
    public CompilationException reportError(CompilerErrorCode code, String message, SourceInfo location) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, location));
        return new CompilationException(code, message, location);
    }

    /**
     * Reports a bracket error together with a note pointing at the open bracket.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param location The position of the offending token.
     * @param opener   The position of the open bracket, or {@code null} if there is none.
     * @param note     The message of the note attached to the open bracket.
     * @return The exception to throw.
     */
    public CompilationException reportBracketError(CompilerErrorCode code, String message, SourceInfo location,
                                                   SourceInfo opener, String note) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, location));
        if (opener != null) {
            diagnostics.add(new Diagnostic(Diagnostic.Type.NOTE, null, note, opener));
        }
        return new CompilationException(code, message, location, opener);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
