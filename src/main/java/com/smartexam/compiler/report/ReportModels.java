package com.smartexam.compiler.report;

import com.smartexam.compiler.ast.PaperModels.Paper;
import com.smartexam.compiler.lexer.Token;
import com.smartexam.compiler.parser.ParserDtos.ParseDiagnostic;
import com.smartexam.compiler.validation.ValidationModels.PaperStatistics;
import com.smartexam.compiler.validation.ValidationModels.ValidationIssue;

import java.util.List;

public class ReportModels {
    /**
     * Everything one compilation exposes. Without an AST, {@code paper} and
     * {@code statistics} are null and {@code issues} is empty.
     */
    public record CompilationReport(boolean astProduced,
                                    Paper paper,
                                    List<Token> tokens,
                                    List<ParseDiagnostic> diagnostics,
                                    List<ValidationIssue> issues,
                                    PaperStatistics statistics,
                                    List<String> suggestions,
                                    int qualityScore) {}
}
