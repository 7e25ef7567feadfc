package com.smartexam.compiler.lexer;

import com.smartexam.compiler.exception.LexicalException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Single-pass scanner over question paper DSL text. Tokens are produced on
 * demand by {@link #nextToken()}; a lexer instance is used for one pass only.
 * Line breaks are significant and come out as {@link TokenKind#NEWLINE}.
 */
public class DslLexer {

    private static final String ASCII_PUNCTUATION = ".,;:?!'\"()[]{}-+*/=<>|&%^_#~$\\";
    private static final List<String> KIND_TAGS = List.of("[MCQ]", "[Short]", "[Long]", "[Other]");
    private static final Map<String, String> DIFFICULTY_WORDS = Map.of(
            "easy", "Easy",
            "medium", "Medium",
            "hard", "Hard"
    );

    private final String source;

    private int pos = 0;
    private int line = 1;
    private int col = 1;
    private boolean lineStart = true;

    public DslLexer(String source) {
        this.source = source == null ? "" : source;
    }

    public static List<Token> tokenize(String source) {
        DslLexer lexer = new DslLexer(source);
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = lexer.nextToken();
            tokens.add(t);
        } while (t.kind() != TokenKind.EOF);
        return tokens;
    }

    public Token nextToken() {
        skipBlanks();
        int startLine = line;
        int startCol = col;

        if (isAtEnd()) return new Token(TokenKind.EOF, "", startLine, startCol);

        boolean atLineStart = lineStart;
        lineStart = false;
        char c = peek();

        if (c == '\n') {
            advance();
            line++;
            col = 1;
            lineStart = true;
            return new Token(TokenKind.NEWLINE, "\n", startLine, startCol);
        }

        if (atLineStart) {
            Token marker = lineMarker(startLine, startCol);
            if (marker != null) return marker;
        }

        if (c == '[') {
            Token tag = kindTag(startLine, startCol);
            if (tag != null) return tag;
        }

        if (isDigit(c)) return number(startLine, startCol);
        if (Character.isLetter(c)) return word(startLine, startCol);
        if (isPunctuation(c)) {
            advance();
            return new Token(TokenKind.PUNCTUATION, String.valueOf(c), startLine, startCol);
        }

        throw new LexicalException(c, startLine, startCol);
    }

    // ================= line-start markers =================

    private Token lineMarker(int startLine, int startCol) {
        if (source.startsWith("---", pos) && restOfLineBlank(pos + 3)) {
            consume(3);
            return new Token(TokenKind.SEPARATOR, "---", startLine, startCol);
        }

        char c = peek();
        if (c == 'Q' && isDigit(peekAt(pos + 1))) {
            int end = pos + 1;
            while (isDigit(peekAt(end))) end++;
            if (peekAt(end) == '.' && isDigit(peekAt(end + 1))) {
                end++;
                while (isDigit(peekAt(end))) end++;
            }
            if (!Character.isLetterOrDigit(peekAt(end))) {
                String lexeme = source.substring(pos, end);
                consume(end - pos);
                return new Token(TokenKind.QUESTION_MARKER, lexeme, startLine, startCol);
            }
        }

        if (c >= 'a' && c <= 'z' && peekAt(pos + 1) == '.') {
            char after = peekAt(pos + 2);
            if (after == '\0' || Character.isWhitespace(after)) {
                String lexeme = source.substring(pos, pos + 2);
                consume(2);
                return new Token(TokenKind.OPTION_MARKER, lexeme, startLine, startCol);
            }
        }
        return null;
    }

    private Token kindTag(int startLine, int startCol) {
        for (String tag : KIND_TAGS) {
            if (source.regionMatches(true, pos, tag, 0, tag.length())) {
                String lexeme = source.substring(pos, pos + tag.length());
                consume(tag.length());
                return new Token(TokenKind.KIND_TAG, lexeme, startLine, startCol);
            }
        }
        return null;
    }

    // ================= words & numbers =================

    private Token number(int startLine, int startCol) {
        int start = pos;
        while (!isAtEnd() && isDigit(peek())) advance();
        return new Token(TokenKind.NUMBER, source.substring(start, pos), startLine, startCol);
    }

    private Token word(int startLine, int startCol) {
        int start = pos;
        while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) advance();
        String text = source.substring(start, pos);

        if (peek() == ':' && DslKeyword.fromWord(text).isPresent()) {
            advance();
            return new Token(TokenKind.KEYWORD, text + ":", startLine, startCol);
        }
        if (DIFFICULTY_WORDS.containsKey(text.toLowerCase(Locale.ROOT))) {
            return new Token(TokenKind.DIFFICULTY, text, startLine, startCol);
        }
        return new Token(TokenKind.WORD, text, startLine, startCol);
    }

    // ================= helpers =================

    private boolean isPunctuation(char c) {
        if (c < 0x80) return ASCII_PUNCTUATION.indexOf(c) >= 0;
        return switch (Character.getType(c)) {
            case Character.DASH_PUNCTUATION,
                 Character.START_PUNCTUATION,
                 Character.END_PUNCTUATION,
                 Character.INITIAL_QUOTE_PUNCTUATION,
                 Character.FINAL_QUOTE_PUNCTUATION,
                 Character.OTHER_PUNCTUATION,
                 Character.CONNECTOR_PUNCTUATION,
                 Character.MATH_SYMBOL -> true;
            default -> false;
        };
    }

    private boolean restOfLineBlank(int from) {
        for (int i = from; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n') return true;
            if (!isBlank(c)) return false;
        }
        return true;
    }

    private void skipBlanks() {
        while (!isAtEnd() && isBlank(peek())) advance();
    }

    private boolean isBlank(char c) {
        return c != '\n' && (Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF');
    }

    private void consume(int n) {
        for (int i = 0; i < n; i++) advance();
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return peekAt(pos);
    }

    private char peekAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
