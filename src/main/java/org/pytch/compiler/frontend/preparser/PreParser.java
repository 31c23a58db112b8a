package org.pytch.compiler.frontend.preparser;

import org.pytch.compiler.api.CompilationException;
import org.pytch.compiler.api.CompilerErrorCode;
import org.pytch.compiler.api.TokenSource;
import org.pytch.compiler.diagnostics.CompilerLogger;
import org.pytch.compiler.diagnostics.DiagnosticsEngine;
import org.pytch.compiler.frontend.io.SourceText;
import org.pytch.compiler.frontend.lexer.Token;
import org.pytch.compiler.frontend.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The preparser for the Pytch language. It runs after the lexer and before the parser.
 * It removes all layout sensitivity from the token stream by inserting dummy tokens
 * where the indentation implies structure:
 * <pre>
 * let foo =
 *   print("calculating foo")
 *   "foo"
 * print(foo)
 * </pre>
 * becomes {@code let foo = print("calculating foo") $; "foo" $in print(foo)}.
 * <p>
 * An {@link IndentationStack} tracks the open constructs. The first token of every line is
 * compared against the top of the stack:
 * <ol>
 *     <li>entries indented deeper than the line are unwound, emitting their closers;</li>
 *     <li>entries at the line's own indentation are closed too; a line-start entry at that
 *     indentation is replaced by one for the new line, emitting {@code $;} unless the binding
 *     closed just above it already separates the two;</li>
 *     <li>if the stack is then empty or topped by a shallower construct, a line-start entry is
 *     pushed. Lines inside brackets push nothing.</li>
 * </ol>
 * Lines starting with 'then' or 'else' continue the open conditional at their indentation.
 * Bracket entries are pinned to indentation 0 and are exempt from both rules: only their
 * closer, or the end of the input, removes them.
 * <p>
 * Tokens are pulled from the underlying source only when the caller asks for one, so the
 * memory used is bounded by the nesting depth of the input.
 */
public class PreParser implements TokenSource {

    private final TokenSource tokens;
    private final SourceText sourceText;
    private final DiagnosticsEngine diagnostics;
    private final IndentationStack stack = new IndentationStack();
    private final Deque<Token> pending = new ArrayDeque<>();
    private int previousLine = 0;
    private Token endOfFile;
    private CompilationException failure;

    /**
     * Constructs a new PreParser.
     * @param tokens The raw tokens, usually a {@link org.pytch.compiler.frontend.lexer.Lexer}.
     * @param sourceText The source the tokens were scanned from, for error positions.
     * @param diagnostics The engine for reporting errors.
     */
    public PreParser(TokenSource tokens, SourceText sourceText, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.sourceText = sourceText;
        this.diagnostics = diagnostics;
    }

    /**
     * Runs the preparser over the rest of the token stream.
     * @return The augmented tokens, ending with the end-of-input token.
     * @throws CompilationException if the input is malformed.
     */
    public List<Token> preparse() throws CompilationException {
        return readAll();
    }

    @Override
    public Token nextToken() throws CompilationException {
        if (failure != null) {
            throw failure;
        }
        try {
            while (pending.isEmpty()) {
                if (endOfFile != null) {
                    return endOfFile;
                }
                process(tokens.nextToken());
            }
            return pending.poll();
        } catch (CompilationException e) {
            failure = e;
            throw e;
        }
    }

    private void process(Token token) throws CompilationException {
        switch (token.type()) {
            case END_OF_FILE -> finish(token);
            case RPAREN -> closeBracket(token);
            default -> {
                if (token.line() > previousLine) {
                    applyLayout(token);
                }
                switch (token.type()) {
                    case LET -> push(IndentationStackEntry.construct(ConstructKind.BINDING, token));
                    case IF -> push(IndentationStackEntry.construct(ConstructKind.CONDITIONAL, token));
                    case LPAREN -> push(IndentationStackEntry.bracket(token));
                    default -> { }
                }
                emit(token);
            }
        }
        previousLine = token.line();
    }

    private void applyLayout(Token first) {
        int line = first.line();
        int indentation = first.indentation();

        while (!stack.isEmpty()) {
            IndentationStackEntry top = stack.peek();
            if (top.isBracket() || top.indentationLevel() <= indentation || top.line() >= line) {
                break;
            }
            unwind(stack.pop(), first);
        }

        boolean continuesConditional = first.type() == TokenType.THEN || first.type() == TokenType.ELSE;
        ConstructKind lastClosed = null;
        while (!stack.isEmpty()) {
            IndentationStackEntry top = stack.peek();
            if (top.isBracket() || top.indentationLevel() != indentation || top.line() >= line) {
                break;
            }
            if (continuesConditional
                    && (top.kind() == ConstructKind.CONDITIONAL || top.kind() == ConstructKind.LINE_START)) {
                return;
            }
            if (top.kind() == ConstructKind.LINE_START) {
                stack.pop();
                if (lastClosed != ConstructKind.BINDING) {
                    DummyTokenCatalog.separatorFor(top.kind()).ifPresent(type -> emit(Token.dummy(type, first)));
                }
                push(IndentationStackEntry.lineStart(first));
                return;
            }
            lastClosed = top.kind();
            unwind(stack.pop(), first);
        }

        if (stack.isEmpty() || !stack.peek().isBracket()) {
            push(IndentationStackEntry.lineStart(first));
        }
    }

    private void closeBracket(Token closer) throws CompilationException {
        while (true) {
            if (stack.isEmpty()) {
                throw diagnostics.reportBracketError(CompilerErrorCode.UNMATCHED_CLOSE_BRACKET,
                        "I found a ')' here, but there is no '(' for it to close.",
                        sourceText.sourceInfo(closer.line(), closer.column()), null, null);
            }
            IndentationStackEntry entry = stack.pop();
            if (entry.isBracket()) {
                CompilerLogger.trace("Closed bracket from {}:{} at {}:{}", entry.line(), entry.trigger().column(),
                        closer.line(), closer.column());
                break;
            }
            unwind(entry, closer);
        }
        emit(closer);
    }

    private void finish(Token eof) throws CompilationException {
        while (!stack.isEmpty()) {
            IndentationStackEntry entry = stack.pop();
            if (entry.isBracket()) {
                Token opener = entry.trigger();
                throw diagnostics.reportBracketError(CompilerErrorCode.UNCLOSED_BRACKET_AT_EOF,
                        String.format("I was expecting a ')' to close the '(' on line %d, character %d, "
                                + "but the file ended first.", opener.line(), opener.column()),
                        sourceText.sourceInfo(eof.line(), eof.column()),
                        sourceText.sourceInfo(opener.line(), opener.column()),
                        "This is the '(' that was never closed.");
            }
            unwind(entry, eof);
        }
        emit(eof);
        endOfFile = eof;
    }

    private void push(IndentationStackEntry entry) {
        stack.push(entry);
        if (CompilerLogger.isEnabled(CompilerLogger.TRACE)) {
            CompilerLogger.trace("Push {} at line {}, indentation {} (depth {})", entry.kind(), entry.line(),
                    entry.indentationLevel(), stack.depth());
        }
    }

    private void unwind(IndentationStackEntry entry, Token anchor) {
        if (CompilerLogger.isEnabled(CompilerLogger.TRACE)) {
            CompilerLogger.trace("Unwind {} from line {} at {}:{}", entry.kind(), entry.line(), anchor.line(),
                    anchor.column());
        }
        DummyTokenCatalog.closerFor(entry.kind()).ifPresent(type -> emit(Token.dummy(type, anchor)));
    }

    private void emit(Token token) {
        pending.add(token);
    }
}
