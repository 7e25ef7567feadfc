package com.smartexam.compiler.parser;

import com.smartexam.compiler.exception.SyntaxException;
import com.smartexam.compiler.lexer.DslKeyword;
import com.smartexam.compiler.lexer.Token;
import com.smartexam.compiler.lexer.TokenKind;
import com.smartexam.compiler.lexer.TokenStream;
import com.smartexam.compiler.parser.ParserDtos.ParseDiagnostic;
import com.smartexam.compiler.parser.ParserDtos.Severity;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * State of a single parse: a one-token lookahead cursor over a lazy token
 * stream, every token pulled so far, and the diagnostics raised. Created per
 * call to {@link QuestionPaperParser#parse(String)} and dropped afterwards.
 */
final class ParserContext {
    private final Iterator<Token> tokens;
    private final List<Token> scanned = new ArrayList<>();
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
    private Token current;

    ParserContext(TokenStream stream) {
        this.tokens = stream.iterator();
    }

    Token peek() {
        if (current == null) {
            current = tokens.next();
            scanned.add(current);
        }
        return current;
    }

    Token advance() {
        Token t = peek();
        if (t.kind() != TokenKind.EOF) current = null;
        return t;
    }

    boolean check(TokenKind kind) {
        return peek().kind() == kind;
    }

    boolean checkKeyword(DslKeyword keyword) {
        return check(TokenKind.KEYWORD) && DslKeyword.fromToken(peek()) == keyword;
    }

    boolean checkPunctuation(String symbol) {
        return peek().is(TokenKind.PUNCTUATION, symbol);
    }

    Token expectPunctuation(String symbol, String expected) {
        if (!checkPunctuation(symbol)) throw unexpected(expected);
        return advance();
    }

    void skipBlankLines() {
        while (check(TokenKind.NEWLINE)) advance();
    }

    /** Consumes tokens up to, but not including, the next NEWLINE or EOF. */
    List<Token> restOfLine() {
        List<Token> out = new ArrayList<>();
        while (!check(TokenKind.NEWLINE) && !check(TokenKind.EOF)) {
            out.add(advance());
        }
        return out;
    }

    /** Consumes the NEWLINE ending the current line; EOF is accepted as a line end. */
    void endLine(String context) {
        if (check(TokenKind.NEWLINE)) {
            advance();
        } else if (!check(TokenKind.EOF)) {
            throw unexpected("end of line after " + context);
        }
    }

    SyntaxException unexpected(String expected) {
        Token t = peek();
        return new SyntaxException(t.line(), expected, describe(t));
    }

    void warn(String code, String message, int line) {
        diagnostics.add(new ParseDiagnostic(Severity.WARNING, code, message, line));
    }

    void error(String code, String message, int line) {
        diagnostics.add(new ParseDiagnostic(Severity.ERROR, code, message, line));
    }

    List<Token> scanned() {
        return List.copyOf(scanned);
    }

    List<ParseDiagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    static String describe(Token t) {
        return switch (t.kind()) {
            case EOF -> "end of input";
            case NEWLINE -> "end of line";
            default -> "'" + t.lexeme() + "'";
        };
    }

    /**
     * Rebuilds source text from tokens of one line. Tokens that were separated
     * by whitespace get exactly one space between them.
     */
    static String text(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token t : tokens) {
            if (prev != null && (t.line() != prev.line() || t.column() > prev.endColumn())) sb.append(' ');
            sb.append(t.lexeme());
            prev = t;
        }
        return sb.toString().trim();
    }
}
