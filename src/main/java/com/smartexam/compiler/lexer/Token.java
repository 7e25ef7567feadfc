package com.smartexam.compiler.lexer;

public record Token(TokenKind kind, String lexeme, int line, int column) {

    /** Column just past the last character of this token. */
    public int endColumn() {
        return column + lexeme.length();
    }

    public boolean is(TokenKind kind, String lexeme) {
        return this.kind == kind && this.lexeme.equals(lexeme);
    }

    @Override
    public String toString() {
        String shown = kind == TokenKind.NEWLINE ? "\\n" : lexeme;
        return kind + "('" + shown + "')@" + line + ":" + column;
    }
}
