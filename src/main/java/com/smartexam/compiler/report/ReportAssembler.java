package com.smartexam.compiler.report;

import com.smartexam.compiler.parser.ParserDtos.ParseDiagnostic;
import com.smartexam.compiler.parser.ParserDtos.ParseResult;
import com.smartexam.compiler.parser.ParserDtos.Severity;
import com.smartexam.compiler.report.ReportModels.CompilationReport;
import com.smartexam.compiler.validation.ValidationModels.AnalysisResult;
import com.smartexam.compiler.validation.ValidationModels.IssueCode;
import com.smartexam.compiler.validation.ValidationModels.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges parser diagnostics and analyzer issues into one report. Adds
 * suggestions and a quality score derived from the issues; no rules of its own.
 */
@Component
public class ReportAssembler {
    static final int FULL_SCORE = 100;
    static final int CORRECTNESS_PENALTY = 20;
    static final int TIME_PENALTY = 10;
    static final int DIFFICULTY_PENALTY = 15;
    static final int DUPLICATE_PENALTY = 5;

    public CompilationReport assemble(ParseResult parse, AnalysisResult analysis) {
        if (!parse.succeeded() || analysis == null) return assembleFailure(parse);
        return new CompilationReport(
                true,
                parse.paper(),
                parse.tokens(),
                parse.diagnostics(),
                analysis.issues(),
                analysis.statistics(),
                suggestions(analysis.issues()),
                qualityScore(analysis.issues())
        );
    }

    public CompilationReport assembleFailure(ParseResult parse) {
        List<String> suggestions = parse.diagnostics().stream()
                .filter(d -> d.severity() == Severity.ERROR)
                .map(this::fixSuggestion)
                .toList();
        return new CompilationReport(false, null, parse.tokens(), parse.diagnostics(), List.of(), null, suggestions, 0);
    }

    public List<String> suggestions(List<ValidationIssue> issues) {
        Set<IssueCode> seen = new LinkedHashSet<>();
        issues.forEach(i -> seen.add(i.code()));
        List<String> out = new ArrayList<>();
        seen.forEach(code -> out.add(code.suggestion()));
        return List.copyOf(out);
    }

    public int qualityScore(List<ValidationIssue> issues) {
        int score = FULL_SCORE;
        if (issues.stream().anyMatch(this::isCorrectnessError)) score -= CORRECTNESS_PENALTY;
        if (issues.stream().anyMatch(i -> i.code() == IssueCode.TIME_BUDGET_EXCEEDED)) score -= TIME_PENALTY;
        if (issues.stream().anyMatch(i -> i.code() == IssueCode.DIFFICULTY_IMBALANCE)) score -= DIFFICULTY_PENALTY;
        long duplicatePairs = issues.stream()
                .filter(i -> i.code() == IssueCode.DUPLICATE_QUESTION || i.code() == IssueCode.NEAR_DUPLICATE_QUESTION)
                .count();
        score -= (int) duplicatePairs * DUPLICATE_PENALTY;
        return Math.max(0, score);
    }

    private boolean isCorrectnessError(ValidationIssue issue) {
        return issue.severity() == Severity.ERROR
                && (issue.code() == IssueCode.MARKS_MISMATCH || issue.code().name().startsWith("MCQ_"));
    }

    private String fixSuggestion(ParseDiagnostic d) {
        String kind = "LEXICAL_ERROR".equals(d.code()) ? "unsupported character" : "syntax error";
        return "Fix the " + kind + " at line " + d.line() + " and compile again.";
    }
}
