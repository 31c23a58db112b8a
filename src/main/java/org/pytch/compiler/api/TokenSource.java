package org.pytch.compiler.api;

import org.pytch.compiler.frontend.lexer.Token;
import org.pytch.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * A pull-based producer of tokens. Each call produces the next token on demand, so a
 * consumer can interleave its own work with tokenization instead of buffering a whole file.
 * <p>
 * The sequence is finite and ends with a {@link TokenType#END_OF_FILE} token; calling
 * {@link #nextToken()} after that keeps returning the end-of-input token. Once a call has
 * failed, every later call rethrows the same exception.
 */
public interface TokenSource {

    /**
     * Produces the next token.
     * @return The next token of the sequence.
     * @throws CompilationException if the input is malformed.
     */
    Token nextToken() throws CompilationException;

    /**
     * Pulls every remaining token, up to and including the end-of-input token.
     * @return The remaining tokens in order.
     * @throws CompilationException if the input is malformed.
     */
    default List<Token> readAll() throws CompilationException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }
}
