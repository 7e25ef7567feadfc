package com.smartexam.compiler.exception;

/**
 * Raised when an AST interchange document cannot be mapped back to a paper.
 */
public class AstFormatException extends RuntimeException {
    public AstFormatException(String message) {
        super(message);
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
