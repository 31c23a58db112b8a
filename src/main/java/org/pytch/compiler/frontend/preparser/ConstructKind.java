package org.pytch.compiler.frontend.preparser;

/**
 * Identifies what pushed an {@link IndentationStackEntry}.
 */
public enum ConstructKind {
    /** A 'let' binding; its value ends where the binding is unwound. */
    BINDING,
    /** An 'if' expression. */
    CONDITIONAL,
    /** An opening bracket; only the matching closer removes it. */
    BRACKET,
    /** The start of a statement-expression at some indentation. */
    LINE_START
}
