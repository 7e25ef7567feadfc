package com.smartexam.compiler.exception;

public class LexicalException extends CompilationException {
    private final char character;
    private final int column;

    public LexicalException(char character, int line, int column) {
        super(String.format("line %d:%d: unrecognized character '%s' (U+%04X)",
                line, column, printable(character), (int) character), line);
        this.character = character;
        this.column = column;
    }

    public char character() {
        return character;
    }

    public int column() {
        return column;
    }

    @Override
    public String code() {
        return "LEXICAL_ERROR";
    }

    private static String printable(char c) {
        return Character.isISOControl(c) ? "\\u" + String.format("%04x", (int) c) : String.valueOf(c);
    }
}
