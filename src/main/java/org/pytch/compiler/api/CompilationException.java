package org.pytch.compiler.api;

import java.util.Optional;

/**
 * An exception that is thrown when an error halts the tokenization of a compilation unit.
 * <p>
 * It is part of the public API and hides the internal types of the scanner and preparser.
 * Every instance carries the error code and the position of the offending token; bracket
 * errors additionally carry the position of the bracket that was left open.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final SourceInfo sourceInfo;
    private final SourceInfo openerInfo;

    /**
     * Constructs a new compilation exception.
     * @param errorCode The code identifying the kind of error.
     * @param message The detail message.
     * @param sourceInfo The position of the offending token.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        this(errorCode, message, sourceInfo, null);
    }

    /**
     * Constructs a new compilation exception for a bracket error.
     * @param errorCode The code identifying the kind of error.
     * @param message The detail message.
     * @param sourceInfo The position of the offending token.
     * @param openerInfo The position of the unmatched open bracket, or {@code null} if there is none.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, SourceInfo openerInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
        this.openerInfo = openerInfo;
    }

    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * @return The position of the open bracket involved in a bracket error, if any.
     */
    public Optional<SourceInfo> getOpenerInfo() {
        return Optional.ofNullable(openerInfo);
    }
}
