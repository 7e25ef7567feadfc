package com.smartexam.compiler.exception;

/**
 * Fatal failure of one compilation. The pipeline stops at the first one and
 * reports it as a diagnostic instead of producing a paper.
 */
public abstract class CompilationException extends RuntimeException {
    private final int line;

    protected CompilationException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int line() {
        return line;
    }

    public abstract String code();
}
