package org.pytch.compiler.frontend.preparser;

import org.pytch.compiler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The single table that decides which synthetic token an unwound stack entry leaves behind.
 * <ul>
 *     <li>A <em>closer</em> is emitted whenever the entry is popped, whatever the reason.</li>
 *     <li>A <em>separator</em> is emitted only when a new line at the entry's own indentation
 *     replaces it.</li>
 * </ul>
 */
public final class DummyTokenCatalog {

    private static final Map<ConstructKind, TokenType> CLOSERS;
    private static final Map<ConstructKind, TokenType> SEPARATORS;

    static {
        Map<ConstructKind, TokenType> closers = new EnumMap<>(ConstructKind.class);
        closers.put(ConstructKind.BINDING, TokenType.DUMMY_IN);
        closers.put(ConstructKind.CONDITIONAL, TokenType.DUMMY_ENDIF);
        CLOSERS = Collections.unmodifiableMap(closers);

        Map<ConstructKind, TokenType> separators = new EnumMap<>(ConstructKind.class);
        separators.put(ConstructKind.LINE_START, TokenType.DUMMY_SEMICOLON);
        SEPARATORS = Collections.unmodifiableMap(separators);
    }

    private DummyTokenCatalog() {}

    /**
     * @param kind The kind of the popped entry.
     * @return The synthetic token emitted when such an entry is popped, if any.
     */
    public static Optional<TokenType> closerFor(ConstructKind kind) {
        return Optional.ofNullable(CLOSERS.get(kind));
    }

    /**
     * @param kind The kind of the replaced entry.
     * @return The synthetic token emitted when a same-level line replaces such an entry, if any.
     */
    public static Optional<TokenType> separatorFor(ConstructKind kind) {
        return Optional.ofNullable(SEPARATORS.get(kind));
    }
}
