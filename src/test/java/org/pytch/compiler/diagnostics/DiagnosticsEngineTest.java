package org.pytch.compiler.diagnostics;

import org.pytch.compiler.api.CompilationException;
import org.pytch.compiler.api.CompilerErrorCode;
import org.pytch.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link DiagnosticsEngine}.
 */
public class DiagnosticsEngineTest {

    private static final SourceInfo HERE = new SourceInfo("a.pytch", 2, 5, "  x )");
    private static final SourceInfo OPENER = new SourceInfo("a.pytch", 1, 3, "f(");

    @Test
    @Tag("unit")
    void testReportErrorBuildsMatchingException() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        CompilationException e = diagnostics.reportError(CompilerErrorCode.ILLEGAL_CHARACTER, "Bad.", HERE);

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics()).containsExactly(
                new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.ILLEGAL_CHARACTER, "Bad.", HERE));
        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.ILLEGAL_CHARACTER);
        assertThat(e.getSourceInfo()).isEqualTo(HERE);
        assertThat(e.getOpenerInfo()).isEmpty();
        assertThat(e.getMessage()).isEqualTo("Bad. at a.pytch:2:5");
    }

    @Test
    @Tag("unit")
    void testBracketErrorAddsNote() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        CompilationException e = diagnostics.reportBracketError(CompilerErrorCode.UNCLOSED_BRACKET_AT_EOF,
                "Unclosed.", HERE, OPENER, "Opened here.");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::type, Diagnostic::location)
                .containsExactly(
                        tuple(Diagnostic.Type.ERROR, HERE),
                        tuple(Diagnostic.Type.NOTE, OPENER));
        assertThat(e.getOpenerInfo()).contains(OPENER);
        assertThat(diagnostics.summary()).isEqualTo(
                "[ERROR] a.pytch:2:5: Unclosed.\n[NOTE] a.pytch:1:3: Opened here.");
    }

    @Test
    @Tag("unit")
    void testBracketErrorWithoutOpener() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        diagnostics.reportBracketError(CompilerErrorCode.UNMATCHED_CLOSE_BRACKET, "Unmatched.", HERE, null, null);

        assertThat(diagnostics.getDiagnostics()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testDiagnosticsAreReadOnly() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.summary()).isEmpty();
        assertThatThrownBy(() -> diagnostics.getDiagnostics().add(null))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @Tag("unit")
    void testErrorCodeIds() {
        assertThat(CompilerErrorCode.ILLEGAL_CHARACTER.id()).isEqualTo(1000);
        assertThat(CompilerErrorCode.UNTERMINATED_STRING.id()).isEqualTo(1001);
        assertThat(CompilerErrorCode.BAD_ESCAPE_AT_EOF.id()).isEqualTo(1002);
        assertThat(CompilerErrorCode.UNMATCHED_CLOSE_BRACKET.id()).isEqualTo(1100);
        assertThat(CompilerErrorCode.UNCLOSED_BRACKET_AT_EOF.id()).isEqualTo(1101);
    }
}
