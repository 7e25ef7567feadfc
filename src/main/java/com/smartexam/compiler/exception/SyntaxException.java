package com.smartexam.compiler.exception;

public class SyntaxException extends CompilationException {
    private final String expected;
    private final String found;

    public SyntaxException(int line, String expected, String found) {
        super("line " + line + ": expected " + expected + " but found " + found, line);
        this.expected = expected;
        this.found = found;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }

    @Override
    public String code() {
        return "SYNTAX_ERROR";
    }
}
