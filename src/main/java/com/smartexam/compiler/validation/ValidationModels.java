package com.smartexam.compiler.validation;

import com.smartexam.compiler.ast.PaperModels.Difficulty;
import com.smartexam.compiler.parser.ParserDtos.Severity;

import java.util.List;
import java.util.Map;

public class ValidationModels {

    /** Rule identifiers, declared in rule-priority order. */
    public enum IssueCode {
        MARKS_MISMATCH(Severity.ERROR, "Adjust question marks so that they add up to the declared total."),
        DUPLICATE_QUESTION_NUMBER(Severity.ERROR, "Renumber questions so that every number is used once."),
        MCQ_MISSING_OPTIONS(Severity.ERROR, "Give every MCQ question an Options: list."),
        MCQ_DUPLICATE_OPTION_LETTER(Severity.ERROR, "Use each option letter only once within an MCQ question."),
        MCQ_NO_CORRECT_OPTION(Severity.ERROR, "Name the correct option letter in the Correct: line of each MCQ."),
        MCQ_MULTIPLE_CORRECT_OPTIONS(Severity.ERROR, "Keep exactly one correct option per MCQ question."),
        MCQ_UNKNOWN_CORRECT_OPTION(Severity.ERROR, "Point Correct: at a letter that exists among the options."),
        SYLLABUS_TOPIC_UNCOVERED(Severity.WARNING, "Add questions for the syllabus topics that no question covers."),
        TOPIC_OUT_OF_SYLLABUS(Severity.WARNING, "Check topics that are not listed in the syllabus."),
        DIFFICULTY_UNSPECIFIED(Severity.WARNING, "Tag every question with Difficulty: Easy, Medium or Hard."),
        DIFFICULTY_IMBALANCE(Severity.WARNING, "Rebalance easy, medium and hard questions towards the target mix."),
        DUPLICATE_QUESTION(Severity.WARNING, "Remove repeated questions."),
        NEAR_DUPLICATE_QUESTION(Severity.WARNING, "Reword or replace questions that are nearly identical."),
        DUPLICATE_SCAN_TRUNCATED(Severity.WARNING, "Raise the comparison limit to check every question pair for duplicates."),
        TIME_BUDGET_EXCEEDED(Severity.WARNING, "Reduce the paper length or extend the duration.");

        private final Severity severity;
        private final String suggestion;

        IssueCode(Severity severity, String suggestion) {
            this.severity = severity;
            this.suggestion = suggestion;
        }

        public Severity severity() {
            return severity;
        }

        public String suggestion() {
            return suggestion;
        }
    }

    /**
     * One rule violation. {@code questionNumber} is null for paper-level issues.
     */
    public record ValidationIssue(Severity severity, IssueCode code, String message, Integer questionNumber) {
        public static ValidationIssue paper(IssueCode code, String message) {
            return new ValidationIssue(code.severity(), code, message, null);
        }

        public static ValidationIssue question(IssueCode code, String message, int questionNumber) {
            return new ValidationIssue(code.severity(), code, message, questionNumber);
        }
    }

    public record DifficultyShare(int count, double percentage) {}

    public record QuestionMetrics(int number,
                                  Difficulty effectiveDifficulty,
                                  boolean difficultyInferred,
                                  int wordCount,
                                  long estimatedMinutes) {}

    public record SyllabusCoverage(Map<String, List<Integer>> references,
                                   List<String> covered,
                                   List<String> uncovered,
                                   double coveragePercentage) {}

    public record PaperStatistics(int questionCount,
                                  long totalMarksComputed,
                                  int declaredTotalMarks,
                                  int declaredDurationMinutes,
                                  Map<String, DifficultyShare> difficultyHistogram,
                                  long estimatedTotalMinutes,
                                  List<QuestionMetrics> questionMetrics,
                                  SyllabusCoverage syllabusCoverage,
                                  int mcqCount,
                                  int mcqValidCount) {
        /** Estimated minutes per top-level question, aligned with {@code paper.questions()}. */
        public List<Long> estimatedMinutes() {
            return questionMetrics.stream().map(QuestionMetrics::estimatedMinutes).toList();
        }
    }

    public record AnalysisResult(List<ValidationIssue> issues, PaperStatistics statistics) {
        public boolean hasErrors() {
            return issues.stream().anyMatch(i -> i.severity() == Severity.ERROR);
        }

        public List<ValidationIssue> issuesOf(IssueCode code) {
            return issues.stream().filter(i -> i.code() == code).toList();
        }
    }
}
