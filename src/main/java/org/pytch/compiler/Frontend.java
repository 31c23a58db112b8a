package org.pytch.compiler;

import org.pytch.compiler.api.CompilationException;
import org.pytch.compiler.api.IFrontend;
import org.pytch.compiler.api.TokenSource;
import org.pytch.compiler.config.ConfigLoader;
import org.pytch.compiler.config.FrontendOptions;
import org.pytch.compiler.diagnostics.CompilerLogger;
import org.pytch.compiler.diagnostics.DiagnosticRenderer;
import org.pytch.compiler.diagnostics.DiagnosticsEngine;
import org.pytch.compiler.frontend.io.SourceText;
import org.pytch.compiler.frontend.lexer.Lexer;
import org.pytch.compiler.frontend.lexer.Token;
import org.pytch.compiler.frontend.preparser.PreParser;
import org.pytch.compiler.util.DebugDump;

import java.util.Iterator;
import java.util.List;

/**
 * The front-end implementation. This class wires the lexer and the preparser together
 * for each compilation unit. Every call gets its own diagnostics and indentation stack;
 * the instance itself is not thread-safe.
 */
public class Frontend implements IFrontend {

    private final FrontendOptions options;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private int verbosity;

    /**
     * Creates a front end with the defaults from {@code reference.conf}.
     */
    public Frontend() {
        this(FrontendOptions.defaults());
    }

    /**
     * Creates a front end with explicit options.
     * @param options The front-end options.
     */
    public Frontend(FrontendOptions options) {
        this.options = options;
        this.verbosity = options.verbosity();
    }

    /**
     * Creates a front end configured through {@link ConfigLoader}.
     * @param configFileName The configuration file to merge over the defaults.
     * @return The configured front end.
     */
    public static Frontend fromConfig(String configFileName) {
        return new Frontend(FrontendOptions.fromConfig(ConfigLoader.load(configFileName)));
    }

    @Override
    public List<Token> tokenize(String source, String fileName) throws CompilationException {
        CompilerLogger.setLevel(verbosity);
        SourceText text = new SourceText(fileName != null ? fileName : options.defaultFileName(), source);
        diagnostics = new DiagnosticsEngine();

        try {
            Lexer lexer = new Lexer(text, diagnostics);
            TokenSource rawTokens = lexer;
            if (options.dumpTokens()) {
                List<Token> raw = lexer.scanTokens();
                DebugDump.dumpTokens(options.dumpDirectory(), text.fileName(), "raw", raw);
                Iterator<Token> replay = raw.iterator();
                rawTokens = replay::next;
            }

            List<Token> tokens = new PreParser(rawTokens, text, diagnostics).preparse();
            if (options.dumpTokens()) {
                DebugDump.dumpTokens(options.dumpDirectory(), text.fileName(), "preparsed", tokens);
            }
            CompilerLogger.debug("Tokenized {} into {} tokens", text.fileName(), tokens.size());
            return tokens;
        } catch (CompilationException e) {
            CompilerLogger.warn("Tokenization of {} failed:\n{}", text.fileName(),
                    DiagnosticRenderer.render(diagnostics.getDiagnostics()));
            throw e;
        }
    }

    @Override
    public TokenSource open(String source, String fileName) {
        CompilerLogger.setLevel(verbosity);
        SourceText text = new SourceText(fileName != null ? fileName : options.defaultFileName(), source);
        diagnostics = new DiagnosticsEngine();
        return new PreParser(new Lexer(text, diagnostics), text, diagnostics);
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics of the most recently started compilation unit.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
