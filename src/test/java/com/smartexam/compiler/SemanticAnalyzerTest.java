package com.smartexam.compiler;

import com.smartexam.compiler.ast.PaperModels.Difficulty;
import com.smartexam.compiler.ast.PaperModels.Option;
import com.smartexam.compiler.ast.PaperModels.Paper;
import com.smartexam.compiler.parser.ParserDtos.ParseResult;
import com.smartexam.compiler.parser.ParserDtos.Severity;
import com.smartexam.compiler.parser.QuestionPaperParser;
import com.smartexam.compiler.validation.AnalyzerProperties;
import com.smartexam.compiler.validation.McqAnswerResolver;
import com.smartexam.compiler.validation.SemanticAnalyzer;
import com.smartexam.compiler.validation.ValidationModels.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.smartexam.compiler.validation.ValidationModels.IssueCode.*;
import static org.junit.jupiter.api.Assertions.*;

class SemanticAnalyzerTest {
    private final QuestionPaperParser parser = new QuestionPaperParser();
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerProperties.defaults());

    private Paper parse(String source) {
        ParseResult result = parser.parse(source);
        assertTrue(result.succeeded(), () -> result.diagnostics().toString());
        return result.paper();
    }

    private static String mcq(String correct) {
        return """
                Exam: Compilers
                TotalMarks: 5
                Duration: 30 min
                Q1 [MCQ] (5 marks) Difficulty: Easy
                Which component groups characters into tokens?
                Options:
                a. Lexer
                b. Parser
                c. Linker
                d. Loader
                Correct: %s
                ---
                """.formatted(correct);
    }

    @Test
    void reportsMarksMismatchWithBothValues() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: Compilers
                TotalMarks: 50
                Duration: 3 hours
                Q1 [Long] (20 marks) Difficulty: Medium
                Explain the phases of a compiler.
                Correct: see notes
                ---
                Q2 [Long] (20 marks) Difficulty: Hard
                Design a register allocator.
                Correct: see notes
                ---
                """));

        List<ValidationIssue> mismatch = result.issuesOf(MARKS_MISMATCH);
        assertEquals(1, mismatch.size());
        assertEquals("marks mismatch: computed=40, declared=50", mismatch.get(0).message());
        assertEquals(Severity.ERROR, mismatch.get(0).severity());
        assertNull(mismatch.get(0).questionNumber());
        assertEquals(40, result.statistics().totalMarksComputed());
        assertTrue(result.hasErrors());
    }

    @Test
    void matchingMarksProduceNoMismatch() {
        AnalysisResult result = analyzer.analyze(parse(mcq("a")));

        assertTrue(result.issuesOf(MARKS_MISMATCH).isEmpty());
    }

    @Test
    void singleValidCorrectLetterCountsAsValidMcq() {
        AnalysisResult result = analyzer.analyze(parse(mcq("b")));

        assertTrue(result.issues().stream().noneMatch(i -> i.code().name().startsWith("MCQ_")), result.issues()::toString);
        assertEquals(1, result.statistics().mcqCount());
        assertEquals(1, result.statistics().mcqValidCount());
    }

    @Test
    void correctLetterOutsideOptionsIsError() {
        AnalysisResult result = analyzer.analyze(parse(mcq("e")));

        List<ValidationIssue> unknown = result.issuesOf(MCQ_UNKNOWN_CORRECT_OPTION);
        assertEquals(1, unknown.size());
        assertEquals(1, unknown.get(0).questionNumber());
        assertEquals(0, result.statistics().mcqValidCount());
    }

    @Test
    void acceptsAnswerFormsThatNameOneOption() {
        for (String answer : List.of("(b)", "b.", "B", "b) Parser", "Parser")) {
            AnalysisResult result = analyzer.analyze(parse(mcq(answer)));
            assertEquals(1, result.statistics().mcqValidCount(), answer);
        }
    }

    @Test
    void answerLetterWinsOverOptionTextThatLooksLikeALetter() {
        List<Option> options = List.of(new Option('a', "b"), new Option('b', "None of these"));

        assertEquals(List.of('b'), McqAnswerResolver.letters("b", options));
        assertEquals(List.of('b'), McqAnswerResolver.letters("(B)", options));
        assertEquals(List.of('a'), McqAnswerResolver.letters("c", List.of(new Option('a', "c"), new Option('b', "d"))));
    }

    @Test
    void severalCorrectLettersAreError() {
        assertEquals(1, analyzer.analyze(parse(mcq("a, c"))).issuesOf(MCQ_MULTIPLE_CORRECT_OPTIONS).size());
        assertEquals(1, analyzer.analyze(parse(mcq("a and c"))).issuesOf(MCQ_MULTIPLE_CORRECT_OPTIONS).size());
    }

    @Test
    void answerWithoutLetterIsError() {
        AnalysisResult result = analyzer.analyze(parse(mcq("none of these")));

        assertEquals(1, result.issuesOf(MCQ_NO_CORRECT_OPTION).size());
    }

    @Test
    void repeatedOptionLetterIsError() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 2
                Duration: 10
                Q1 [MCQ] (2 marks) Difficulty: Easy
                Pick one.
                Options:
                a. One
                a. Uno
                b. Two
                Correct: b
                ---
                """));

        assertEquals(1, result.issuesOf(MCQ_DUPLICATE_OPTION_LETTER).size());
        assertEquals(0, result.statistics().mcqValidCount());
    }

    @Test
    void uncoveredSyllabusTopicIsWarned() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: Compilers
                TotalMarks: 5
                Duration: 30
                Syllabus: Lexical Analysis, Parsing
                Q1 [Short] (5 marks) Topic: lexical analysis Difficulty: Easy
                Define a lexeme.
                Correct: x
                ---
                """));

        List<ValidationIssue> uncovered = result.issuesOf(SYLLABUS_TOPIC_UNCOVERED);
        assertEquals(1, uncovered.size());
        assertTrue(uncovered.get(0).message().contains("Parsing"));
        assertEquals(Severity.WARNING, uncovered.get(0).severity());

        SyllabusCoverage coverage = result.statistics().syllabusCoverage();
        assertEquals(List.of("Lexical Analysis"), coverage.covered());
        assertEquals(List.of("Parsing"), coverage.uncovered());
        assertEquals(List.of(1), coverage.references().get("Lexical Analysis"));
        assertEquals(50.0, coverage.coveragePercentage(), 1e-9);
    }

    @Test
    void subquestionTopicsCountTowardsCoverage() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 5
                Duration: 30
                Syllabus: Parsing, Optimization
                Q1 [Long] (5 marks) Topic: Parsing Difficulty: Medium
                Answer both parts.
                Q1.1 [Short] (2 marks) Topic: Optimization
                Explain constant folding.
                Q1.2 [Short] (3 marks) Topic: Linking
                Explain relocation.
                Correct: x
                ---
                """));

        assertTrue(result.issuesOf(SYLLABUS_TOPIC_UNCOVERED).isEmpty());
        assertEquals(1, result.issuesOf(TOPIC_OUT_OF_SYLLABUS).size());
        assertEquals(100.0, result.statistics().syllabusCoverage().coveragePercentage(), 1e-9);
    }

    @Test
    void unspecifiedDifficultyIsInferredFromWording() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 10
                Duration: 60
                Q1 [Short] (5 marks)
                Define a token.
                Correct: x
                ---
                Q2 [Long] (5 marks)
                Design a lexer for identifiers.
                Correct: x
                ---
                """));

        assertEquals(2, result.issuesOf(DIFFICULTY_UNSPECIFIED).size());
        List<QuestionMetrics> metrics = result.statistics().questionMetrics();
        assertEquals(Difficulty.EASY, metrics.get(0).effectiveDifficulty());
        assertTrue(metrics.get(0).difficultyInferred());
        assertEquals(Difficulty.HARD, metrics.get(1).effectiveDifficulty());
    }

    @Test
    void inferenceCanBeSwitchedOff() {
        AnalyzerProperties defaults = AnalyzerProperties.defaults();
        var targets = defaults.difficulty();
        SemanticAnalyzer strict = new SemanticAnalyzer(new AnalyzerProperties(
                new AnalyzerProperties.DifficultyTargets(targets.easy(), targets.medium(), targets.hard(), targets.tolerance(), false),
                defaults.duplicates(), defaults.time()));

        AnalysisResult result = strict.analyze(parse("Q1 [Short] (5 marks)\nDefine a token.\nCorrect: x\n---\n"));

        assertEquals(Difficulty.UNKNOWN, result.statistics().questionMetrics().get(0).effectiveDifficulty());
        assertEquals(1, result.statistics().difficultyHistogram().get("Unknown").count());
    }

    @Test
    void warnsPerLevelOutsideTargetRange() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 10
                Duration: 60
                Q1 [Short] (5 marks) Difficulty: Easy
                Define a token.
                Correct: x
                ---
                Q2 [Short] (5 marks) Difficulty: Easy
                State the role of a parser.
                Correct: x
                ---
                """));

        assertEquals(3, result.issuesOf(DIFFICULTY_IMBALANCE).size());
        DifficultyShare easy = result.statistics().difficultyHistogram().get("Easy");
        assertEquals(2, easy.count());
        assertEquals(100.0, easy.percentage(), 1e-9);
    }

    @Test
    void balancedPaperHasNoImbalance() {
        StringBuilder src = new StringBuilder("Exam: T\nTotalMarks: 10\nDuration: 90\n");
        String[] levels = {"Easy", "Easy", "Easy", "Medium", "Medium", "Medium", "Medium", "Medium", "Hard", "Hard"};
        for (int i = 0; i < levels.length; i++) {
            src.append("Q").append(i + 1).append(" [Short] (1 marks) Difficulty: ").append(levels[i]).append('\n')
                    .append("Topic number ").append(i + 1).append(" unique wording ").append("x".repeat(i + 1)).append('\n')
                    .append("Correct: x\n---\n");
        }

        AnalysisResult result = analyzer.analyze(parse(src.toString()));

        assertTrue(result.issuesOf(DIFFICULTY_IMBALANCE).isEmpty(), result.issues()::toString);
    }

    @Test
    void exactDuplicatesIgnoreCaseAndSpacing() {
        AnalysisResult result = analyzer.analyze(parse("""
                Q1 [Short] (5 marks) Difficulty: Medium
                Explain the phases of a compiler.
                Correct: x
                ---
                Q2 [Short] (5 marks) Difficulty: Medium
                explain  the phases of a COMPILER.
                Correct: x
                ---
                """));

        List<ValidationIssue> duplicates = result.issuesOf(DUPLICATE_QUESTION);
        assertEquals(1, duplicates.size());
        assertEquals(1, duplicates.get(0).questionNumber());
        assertTrue(result.issuesOf(NEAR_DUPLICATE_QUESTION).isEmpty());
    }

    @Test
    void everyPairOfIdenticalQuestionsIsReported() {
        AnalysisResult result = analyzer.analyze(parse("""
                Q1 [Short] (5 marks) Difficulty: Medium
                Define a token.
                Correct: x
                ---
                Q2 [Short] (5 marks) Difficulty: Medium
                Define a token.
                Correct: x
                ---
                Q3 [Short] (5 marks) Difficulty: Medium
                define a TOKEN.
                Correct: x
                ---
                """));

        assertEquals(List.of("Q1 and Q2 have identical text", "Q1 and Q3 have identical text", "Q2 and Q3 have identical text"),
                result.issuesOf(DUPLICATE_QUESTION).stream().map(ValidationIssue::message).toList());
    }

    @Test
    void nearDuplicatePairIsReportedOnceAgainstEarlierQuestion() {
        AnalysisResult result = analyzer.analyze(parse("""
                Q1 [Short] (5 marks) Difficulty: Medium
                Explain the various phases of a compiler.
                Correct: x
                ---
                Q2 [Short] (5 marks) Difficulty: Medium
                Explain the phases of a compiler.
                Correct: x
                ---
                Q3 [Short] (5 marks) Difficulty: Medium
                Describe bottom-up parsing.
                Correct: x
                ---
                """));

        List<ValidationIssue> near = result.issuesOf(NEAR_DUPLICATE_QUESTION);
        assertEquals(1, near.size());
        assertEquals(1, near.get(0).questionNumber());
        assertTrue(near.get(0).message().startsWith("Q1 and Q2"), near.get(0).message());
    }

    @Test
    void duplicateScanStopsAtComparisonLimit() {
        AnalyzerProperties defaults = AnalyzerProperties.defaults();
        SemanticAnalyzer limited = new SemanticAnalyzer(new AnalyzerProperties(defaults.difficulty(),
                new AnalyzerProperties.DuplicateDetection(0.8, 1), defaults.time()));

        AnalysisResult result = limited.analyze(parse("""
                Q1 [Short] (1 marks) Difficulty: Easy
                Define a token.
                Correct: x
                ---
                Q2 [Short] (1 marks) Difficulty: Easy
                State Kleene's theorem.
                Correct: x
                ---
                Q3 [Short] (1 marks) Difficulty: Easy
                Name two parser generators.
                Correct: x
                ---
                """));

        List<ValidationIssue> truncated = result.issuesOf(DUPLICATE_SCAN_TRUNCATED);
        assertEquals(1, truncated.size());
        assertTrue(truncated.get(0).message().contains("2 pairs were not compared"), truncated.get(0).message());
    }

    @Test
    void estimatesTimeFromMarksAndWords() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 5
                Duration: 10
                Q1 [Short] (5 marks) Difficulty: Easy
                Define a token.
                Correct: x
                ---
                """));

        QuestionMetrics metrics = result.statistics().questionMetrics().get(0);
        assertEquals(3, metrics.wordCount());
        assertEquals(11, metrics.estimatedMinutes());
        assertEquals(11, result.statistics().estimatedTotalMinutes());
        assertTrue(result.issuesOf(TIME_BUDGET_EXCEEDED).isEmpty());
    }

    @Test
    void warnsWhenEstimateExceedsDurationPlusTolerance() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 20
                Duration: 10 min
                Q1 [Long] (20 marks) Difficulty: Hard
                Design a compiler.
                Correct: x
                ---
                """));

        assertEquals(1, result.issuesOf(TIME_BUDGET_EXCEEDED).size());
        assertEquals(81, result.statistics().estimatedTotalMinutes());
    }

    @Test
    void totalsBeyondIntRangeAreNotWrapped() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 10
                Duration: 60
                Q1 [Short] (2147483647 marks) Difficulty: Easy
                Define a token.
                Correct: x
                ---
                Q2 [Short] (2147483647 marks) Difficulty: Easy
                Define a lexeme.
                Correct: x
                ---
                """));

        assertEquals(4294967294L, result.statistics().totalMarksComputed());
        assertEquals("marks mismatch: computed=4294967294, declared=10", result.issuesOf(MARKS_MISMATCH).get(0).message());
        assertTrue(result.statistics().estimatedTotalMinutes() > 8_000_000_000L);
        assertEquals(1, result.issuesOf(TIME_BUDGET_EXCEEDED).size());
    }

    @Test
    void marksThatWouldWrapToTheDeclaredTotalStillMismatch() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 2
                Q1 [Short] (2147483647 marks) Difficulty: Easy
                Define a token.
                Correct: x
                ---
                Q2 [Short] (2147483647 marks) Difficulty: Easy
                Define a lexeme.
                Correct: x
                ---
                Q3 [Short] (4 marks) Difficulty: Easy
                Define a pattern.
                Correct: x
                ---
                """));

        assertEquals(1, result.issuesOf(MARKS_MISMATCH).size());
        assertEquals(4294967298L, result.statistics().totalMarksComputed());
    }

    @Test
    void zeroDurationSkipsTimeCheck() {
        AnalysisResult result = analyzer.analyze(parse("Q1 [Long] (20 marks) Difficulty: Hard\nDesign a compiler.\nCorrect: x\n---\n"));

        assertTrue(result.issuesOf(TIME_BUDGET_EXCEEDED).isEmpty());
    }

    @Test
    void repeatedQuestionNumberIsError() {
        AnalysisResult result = analyzer.analyze(parse("""
                Q1 [Short] (1 marks) Difficulty: Easy
                Define a token.
                Correct: x
                ---
                Q1 [Short] (1 marks) Difficulty: Easy
                Define a lexeme.
                Correct: x
                ---
                """));

        assertEquals(1, result.issuesOf(DUPLICATE_QUESTION_NUMBER).size());
    }

    @Test
    void estimatesFollowQuestionPositionWhenNumbersRepeat() {
        AnalysisResult result = analyzer.analyze(parse("""
                Q1 [Short] (1 mark) Difficulty: Easy
                Define a token.
                Correct: x
                ---
                Q1 [Long] (10 marks) Difficulty: Hard
                Design a compiler.
                Correct: x
                ---
                """));

        assertEquals(List.of(3L, 41L), result.statistics().estimatedMinutes());
    }

    @Test
    void ordersPaperIssuesFirstThenQuestionsThenPriority() {
        AnalysisResult result = analyzer.analyze(parse("""
                Exam: T
                TotalMarks: 99
                Duration: 60
                Syllabus: Parsing
                Q1 [MCQ] (5 marks)
                Define a token.
                Options:
                a. One
                Correct: z
                ---
                Q2 [Short] (5 marks) Topic: Linking
                Define a lexeme.
                Correct: x
                ---
                """));

        List<ValidationIssue> issues = result.issues();
        assertEquals(MARKS_MISMATCH, issues.get(0).code());
        int lastPlace = -1;
        int lastPriority = -1;
        for (ValidationIssue issue : issues) {
            int place = issue.questionNumber() == null ? 0 : issue.questionNumber();
            if (place != lastPlace) lastPriority = -1;
            assertTrue(place >= lastPlace, issues::toString);
            assertTrue(issue.code().ordinal() >= lastPriority, issues::toString);
            lastPlace = place;
            lastPriority = issue.code().ordinal();
        }
        assertEquals(List.of(MCQ_UNKNOWN_CORRECT_OPTION, DIFFICULTY_UNSPECIFIED),
                issues.stream().filter(i -> Integer.valueOf(1).equals(i.questionNumber())).map(ValidationIssue::code).toList());
    }
}
