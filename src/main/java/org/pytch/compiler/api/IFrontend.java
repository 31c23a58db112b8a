package org.pytch.compiler.api;

import org.pytch.compiler.frontend.lexer.Token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the Pytch front end: turning source text into the
 * flat, layout-free token stream that the parser consumes.
 */
public interface IFrontend {

    /**
     * Tokenizes the given source code completely.
     *
     * @param source The decoded source text.
     * @param fileName A name for the source, used in diagnostics.
     * @return The augmented token stream, ending with the end-of-input token.
     * @throws CompilationException if the source is malformed.
     */
    List<Token> tokenize(String source, String fileName) throws CompilationException;

    /**
     * Opens a lazy token stream over the given source code. Tokens are scanned and
     * preparsed only as the caller pulls them.
     *
     * @param source The decoded source text.
     * @param fileName A name for the source, used in diagnostics.
     * @return A pull-based source of augmented tokens.
     */
    TokenSource open(String source, String fileName);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE).
     */
    void setVerbosity(int level);

    /**
     * Tokenizes the source code of a UTF-8 file.
     * @param sourcePath The path to the source file.
     * @return The augmented token stream, ending with the end-of-input token.
     * @throws CompilationException if the source is malformed.
     * @throws IOException if the file cannot be read or is not valid UTF-8.
     */
    default List<Token> tokenize(Path sourcePath) throws CompilationException, IOException {
        return tokenize(Files.readString(sourcePath, StandardCharsets.UTF_8), sourcePath.toString().replace('\\', '/'));
    }
}
