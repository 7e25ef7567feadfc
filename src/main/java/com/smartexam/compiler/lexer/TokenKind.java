package com.smartexam.compiler.lexer;

public enum TokenKind {

    // structure
    KEYWORD,
    QUESTION_MARKER,
    KIND_TAG,
    DIFFICULTY,
    OPTION_MARKER,
    SEPARATOR,

    // free text
    WORD,
    NUMBER,
    PUNCTUATION,

    NEWLINE,
    EOF
}
