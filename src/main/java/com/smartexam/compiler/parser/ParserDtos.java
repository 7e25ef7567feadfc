package com.smartexam.compiler.parser;

import com.smartexam.compiler.ast.PaperModels.Paper;
import com.smartexam.compiler.lexer.Token;

import java.util.List;

public class ParserDtos {
    public enum Severity { ERROR, WARNING }

    public record ParseDiagnostic(Severity severity, String code, String message, int line) {}

    /**
     * Outcome of one parse. {@code paper} is null when a fatal lexical or syntax
     * error stopped the parse; {@code tokens} then holds what was scanned so far.
     */
    public record ParseResult(Paper paper, List<Token> tokens, List<ParseDiagnostic> diagnostics) {
        public boolean succeeded() {
            return paper != null;
        }
    }
}
