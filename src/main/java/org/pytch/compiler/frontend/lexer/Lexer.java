package org.pytch.compiler.frontend.lexer;

import org.pytch.compiler.api.CompilationException;
import org.pytch.compiler.api.CompilerErrorCode;
import org.pytch.compiler.api.TokenSource;
import org.pytch.compiler.diagnostics.DiagnosticsEngine;
import org.pytch.compiler.frontend.io.SourceText;

import java.math.BigInteger;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand by {@link #nextToken()}. Every lexical element is the
 * longest match the grammar allows, except string bodies, which end at the first
 * unescaped closing quote. Spaces and newlines separate tokens; the number of spaces
 * before the first token of a line is that line's indentation and is recorded on every
 * token of the line. Comments run from {@code #} to the end of the line.
 * <p>
 * The first error halts the lexer: it is reported to the {@link DiagnosticsEngine} and
 * every later call rethrows it.
 */
public class Lexer implements TokenSource {

    private final SourceText sourceText;
    private final String source;
    private final DiagnosticsEngine diagnostics;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private int indentation = 0;
    private boolean atLineStart = true;
    private Token endOfFile;
    private CompilationException failure;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this(new SourceText(logicalFileName, source), diagnostics);
    }

    /**
     * Creates a new Lexer over an already wrapped source text.
     * @param sourceText The source code and its logical file name.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(SourceText sourceText, DiagnosticsEngine diagnostics) {
        this.sourceText = sourceText;
        this.source = sourceText.content();
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire remaining source code.
     * @return A list of the recognized tokens, ending with the end-of-input token.
     * @throws CompilationException if the source contains a lexical error.
     */
    public List<Token> scanTokens() throws CompilationException {
        return readAll();
    }

    @Override
    public Token nextToken() throws CompilationException {
        if (failure != null) {
            throw failure;
        }
        if (endOfFile != null) {
            return endOfFile;
        }
        try {
            return scanToken();
        } catch (CompilationException e) {
            failure = e;
            throw e;
        }
    }

    private Token scanToken() throws CompilationException {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            char c = advance();
            switch (c) {
                case ' ':
                    if (atLineStart) indentation++;
                    break;
                case '\n':
                    line++;
                    column = 1;
                    indentation = 0;
                    atLineStart = true;
                    break;
                case '#':
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) {
                        if (peek() == '\t' || peek() == '\r') {
                            throw illegalCharacter(current, line, column);
                        }
                        advance();
                    }
                    break;
                case '(': return makeToken(TokenType.LPAREN);
                case ')': return makeToken(TokenType.RPAREN);
                case ',': return makeToken(TokenType.COMMA);
                case '+': return makeToken(TokenType.PLUS);
                case ';': return makeToken(TokenType.SEMICOLON);
                case '=': return makeToken(TokenType.EQUALS);
                case '-': return makeToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
                case '.':
                    if (match('.') && match('.')) {
                        return makeToken(TokenType.ELLIPSIS);
                    }
                    throw diagnostics.reportError(CompilerErrorCode.ILLEGAL_CHARACTER,
                            "I found a '.' here, but dots can only appear as part of '...'.",
                            sourceText.sourceInfo(startLine, startColumn));
                case '\'', '"':
                    return string(c);
                default:
                    if (isDigit(c)) {
                        return number();
                    } else if (isAlpha(c)) {
                        return identifier();
                    }
                    throw illegalCharacter(start, startLine, startColumn);
            }
        }
        endOfFile = new Token(TokenType.END_OF_FILE, "", null, SourceSpan.point(line, column), 0,
                sourceText.fileName());
        return endOfFile;
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        return makeToken(TokenType.keyword(text).orElse(TokenType.IDENTIFIER));
    }

    private Token number() throws CompilationException {
        while (isDigit(peek())) advance();
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            throw diagnostics.reportError(CompilerErrorCode.ILLEGAL_CHARACTER,
                    "I found '" + source.substring(start, current) + "' here, but identifiers must start "
                            + "with a letter or an underscore, not a digit.",
                    sourceText.sourceInfo(startLine, startColumn));
        }
        return makeToken(TokenType.INT_LITERAL, new BigInteger(source.substring(start, current)));
    }

    private Token string(char quote) throws CompilationException {
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                throw diagnostics.reportError(CompilerErrorCode.UNTERMINATED_STRING,
                        "I was expecting a closing " + quote + " for this string literal, but the "
                                + (isAtEnd() ? "file" : "line") + " ended first.",
                        sourceText.sourceInfo(startLine, startColumn));
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c == '\\') {
                if (isAtEnd()) {
                    throw diagnostics.reportError(CompilerErrorCode.BAD_ESCAPE_AT_EOF,
                            "I found a backslash here, but the file ended before the character it escapes.",
                            sourceText.sourceInfo(line, column - 1));
                }
                if (peek() == '\n') {
                    continue;
                }
                // Escapes are taken literally: '\x' stands for 'x'.
                c = advance();
            }
            if (c == '\t') {
                throw illegalCharacter(current - 1, line, column - 1);
            }
            value.append(c);
        }
        return makeToken(TokenType.STRING_LITERAL, value.toString());
    }

    private CompilationException illegalCharacter(int offset, int errorLine, int errorColumn) {
        int codePoint = source.codePointAt(offset);
        String message;
        if (codePoint == '\t') {
            message = "I found a tab character here, but only spaces can be used for indentation and spacing.";
        } else if (codePoint == '\r') {
            message = "I found a carriage return here, but lines must end with a plain newline.";
        } else if (Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint)) {
            message = String.format("I found the whitespace character U+%04X here, but only spaces and newlines "
                    + "can separate tokens.", codePoint);
        } else {
            message = String.format("I found the character '%s' (U+%04X) here, but it can only appear inside "
                    + "a string literal.", new String(Character.toChars(codePoint)), codePoint);
        }
        return diagnostics.reportError(CompilerErrorCode.ILLEGAL_CHARACTER, message,
                sourceText.sourceInfo(errorLine, errorColumn));
    }

    private Token makeToken(TokenType type) {
        return makeToken(type, null);
    }

    private Token makeToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        atLineStart = false;
        return new Token(type, text, value, new SourceSpan(startLine, startColumn, line, column),
                indentation, sourceText.fileName());
    }

    // Columns count code points: the low half of a surrogate pair does not advance them.
    private char advance() {
        char c = source.charAt(current++);
        if (!Character.isLowSurrogate(c)) column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
