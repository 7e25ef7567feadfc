package com.smartexam.compiler.validation;

import com.smartexam.compiler.ast.PaperModels.Difficulty;
import com.smartexam.compiler.ast.PaperModels.Paper;
import com.smartexam.compiler.ast.PaperModels.Question;
import com.smartexam.compiler.ast.PaperModels.QuestionKind;
import com.smartexam.compiler.validation.ValidationModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.smartexam.compiler.validation.ValidationModels.IssueCode.*;

/**
 * Academic rules over a parsed paper. Every rule runs on every call; rule
 * violations come back as issues and never as exceptions. The paper is only read.
 */
@Component
public class SemanticAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final AnalyzerProperties properties;
    private final TimeEstimator timeEstimator;

    public SemanticAnalyzer(AnalyzerProperties properties) {
        this.properties = properties;
        this.timeEstimator = new TimeEstimator(properties.time());
    }

    public AnalysisResult analyze(Paper paper) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<Question> questions = paper.questions();

        long totalMarks = questions.stream().mapToLong(Question::marks).sum();
        if (totalMarks != paper.declaredTotalMarks()) {
            issues.add(ValidationIssue.paper(MARKS_MISMATCH,
                    "marks mismatch: computed=" + totalMarks + ", declared=" + paper.declaredTotalMarks()));
        }

        checkQuestionNumbers(questions, issues);
        int mcqValid = checkMcqs(questions, issues);
        SyllabusCoverage coverage = checkCoverage(paper, issues);
        List<QuestionMetrics> metrics = measure(questions, issues);
        Map<String, DifficultyShare> histogram = checkDifficultyBalance(metrics, issues);
        checkDuplicates(questions, issues);

        long estimatedTotal = metrics.stream().mapToLong(QuestionMetrics::estimatedMinutes).sum();
        long allowed = (long) paper.declaredDurationMinutes() + properties.time().toleranceMinutes();
        if (paper.declaredDurationMinutes() > 0 && estimatedTotal > allowed) {
            issues.add(ValidationIssue.paper(TIME_BUDGET_EXCEEDED,
                    "estimated time " + estimatedTotal + " min exceeds the declared " + paper.declaredDurationMinutes()
                            + " min by more than " + properties.time().toleranceMinutes() + " min"));
        }

        PaperStatistics statistics = new PaperStatistics(
                questions.size(),
                totalMarks,
                paper.declaredTotalMarks(),
                paper.declaredDurationMinutes(),
                histogram,
                estimatedTotal,
                metrics,
                coverage,
                (int) questions.stream().filter(q -> q.kind() == QuestionKind.MCQ).count(),
                mcqValid
        );

        List<ValidationIssue> ordered = order(issues, questions);
        log.debug("event=analysis_complete questions={} issues={}", questions.size(), ordered.size());
        return new AnalysisResult(ordered, statistics);
    }

    private void checkQuestionNumbers(List<Question> questions, List<ValidationIssue> issues) {
        Map<Integer, Long> counts = questions.stream()
                .collect(Collectors.groupingBy(Question::number, LinkedHashMap::new, Collectors.counting()));
        counts.forEach((number, count) -> {
            if (count > 1) {
                issues.add(ValidationIssue.question(DUPLICATE_QUESTION_NUMBER,
                        "question number Q" + number + " is used " + count + " times", number));
            }
        });
    }

    /** Returns the number of MCQ questions without any MCQ error. */
    private int checkMcqs(List<Question> questions, List<ValidationIssue> issues) {
        int valid = 0;
        for (Question q : questions) {
            if (q.kind() != QuestionKind.MCQ) continue;
            int before = issues.size();
            checkMcq(q, issues);
            if (issues.size() == before) valid++;
        }
        return valid;
    }

    private void checkMcq(Question q, List<ValidationIssue> issues) {
        int n = q.number();
        if (q.options().isEmpty()) {
            issues.add(ValidationIssue.question(MCQ_MISSING_OPTIONS, "Q" + n + " is MCQ but has no options", n));
            return;
        }

        Map<Character, Long> letterCounts = q.options().stream()
                .collect(Collectors.groupingBy(o -> Character.toLowerCase(o.letter()), LinkedHashMap::new, Collectors.counting()));
        letterCounts.forEach((letter, count) -> {
            if (count > 1) {
                issues.add(ValidationIssue.question(MCQ_DUPLICATE_OPTION_LETTER,
                        "Q" + n + " lists option " + letter + " " + count + " times", n));
            }
        });

        List<Character> answer = McqAnswerResolver.letters(q.correctAnswer(), q.options());
        if (answer.isEmpty()) {
            issues.add(ValidationIssue.question(MCQ_NO_CORRECT_OPTION,
                    "Q" + n + " names no correct option letter in '" + Objects.toString(q.correctAnswer(), "") + "'", n));
        } else if (answer.size() > 1) {
            issues.add(ValidationIssue.question(MCQ_MULTIPLE_CORRECT_OPTIONS,
                    "Q" + n + " names " + answer.size() + " correct options " + answer + "; exactly one is allowed", n));
        } else if (!letterCounts.containsKey(answer.get(0))) {
            issues.add(ValidationIssue.question(MCQ_UNKNOWN_CORRECT_OPTION,
                    "Q" + n + " correct option '" + answer.get(0) + "' is not among options " + letterCounts.keySet(), n));
        }
    }

    private SyllabusCoverage checkCoverage(Paper paper, List<ValidationIssue> issues) {
        Map<String, String> syllabus = new LinkedHashMap<>();
        paper.syllabusTopics().forEach(t -> syllabus.putIfAbsent(key(t), t));

        Map<String, List<Integer>> references = new LinkedHashMap<>();
        syllabus.values().forEach(t -> references.put(t, new ArrayList<>()));

        for (Question q : paper.questions()) {
            Set<String> reported = new HashSet<>();
            for (Question scoped : withSubquestions(q)) {
                if (scoped.topic() == null || scoped.topic().isBlank()) continue;
                String topic = syllabus.get(key(scoped.topic()));
                if (topic != null) {
                    List<Integer> refs = references.get(topic);
                    if (!refs.contains(q.number())) refs.add(q.number());
                } else if (!syllabus.isEmpty() && reported.add(key(scoped.topic()))) {
                    issues.add(ValidationIssue.question(TOPIC_OUT_OF_SYLLABUS,
                            "Q" + q.number() + " topic '" + scoped.topic() + "' is not in the syllabus", q.number()));
                }
            }
        }

        List<String> covered = new ArrayList<>();
        List<String> uncovered = new ArrayList<>();
        references.forEach((topic, refs) -> (refs.isEmpty() ? uncovered : covered).add(topic));
        uncovered.forEach(topic -> issues.add(ValidationIssue.paper(SYLLABUS_TOPIC_UNCOVERED,
                "syllabus topic '" + topic + "' is not covered by any question")));

        double percentage = references.isEmpty() ? 100.0 : 100.0 * covered.size() / references.size();
        Map<String, List<Integer>> frozen = new LinkedHashMap<>();
        references.forEach((topic, refs) -> frozen.put(topic, List.copyOf(refs)));
        return new SyllabusCoverage(Collections.unmodifiableMap(frozen), List.copyOf(covered), List.copyOf(uncovered), percentage);
    }

    private List<QuestionMetrics> measure(List<Question> questions, List<ValidationIssue> issues) {
        List<QuestionMetrics> metrics = new ArrayList<>();
        for (Question q : questions) {
            Difficulty effective = q.difficulty();
            boolean inferred = false;
            if (effective == Difficulty.UNKNOWN) {
                if (properties.difficulty().inferUnspecified()) {
                    effective = DifficultyClassifier.infer(TimeEstimator.fullText(q));
                    inferred = true;
                    issues.add(ValidationIssue.question(DIFFICULTY_UNSPECIFIED,
                            "Q" + q.number() + " has no difficulty; treated as " + effective.label() + " from its wording", q.number()));
                } else {
                    issues.add(ValidationIssue.question(DIFFICULTY_UNSPECIFIED,
                            "Q" + q.number() + " has no difficulty", q.number()));
                }
            }
            int words = TimeEstimator.wordCount(q);
            metrics.add(new QuestionMetrics(q.number(), effective, inferred, words,
                    timeEstimator.estimateMinutes(q, effective, words)));
        }
        return List.copyOf(metrics);
    }

    private Map<String, DifficultyShare> checkDifficultyBalance(List<QuestionMetrics> metrics, List<ValidationIssue> issues) {
        Map<Difficulty, Long> counts = metrics.stream()
                .collect(Collectors.groupingBy(QuestionMetrics::effectiveDifficulty, () -> new EnumMap<>(Difficulty.class), Collectors.counting()));
        int total = metrics.size();

        Map<String, DifficultyShare> histogram = new LinkedHashMap<>();
        for (Difficulty level : Difficulty.values()) {
            int count = counts.getOrDefault(level, 0L).intValue();
            histogram.put(level.label(), new DifficultyShare(count, total == 0 ? 0.0 : 100.0 * count / total));
        }
        if (total == 0) return Collections.unmodifiableMap(histogram);

        var targets = properties.difficulty();
        for (Difficulty level : List.of(Difficulty.EASY, Difficulty.MEDIUM, Difficulty.HARD)) {
            double share = (double) counts.getOrDefault(level, 0L) / total;
            double target = targets.targetFor(level);
            if (Math.abs(share - target) > targets.tolerance() + 1e-9) {
                issues.add(ValidationIssue.paper(DIFFICULTY_IMBALANCE, String.format(Locale.ROOT,
                        "%s questions make up %.1f%% of the paper; target is %.1f%% +/- %.1f%%",
                        level.label(), share * 100, target * 100, targets.tolerance() * 100)));
            }
        }
        return Collections.unmodifiableMap(histogram);
    }

    private void checkDuplicates(List<Question> questions, List<ValidationIssue> issues) {
        List<String> texts = questions.stream().map(q -> TextSimilarity.normalize(q.text())).toList();

        // every pair within a group of identical texts, each pair once
        Map<String, List<Integer>> seenByText = new HashMap<>();
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text.isEmpty()) continue;
            List<Integer> seen = seenByText.computeIfAbsent(text, t -> new ArrayList<>());
            for (int earlierIndex : seen) {
                int earlier = questions.get(earlierIndex).number();
                issues.add(ValidationIssue.question(DUPLICATE_QUESTION,
                        "Q" + earlier + " and Q" + questions.get(i).number() + " have identical text", earlier));
            }
            seen.add(i);
        }

        int budget = properties.duplicates().maxComparisons();
        double threshold = properties.duplicates().similarityThreshold();
        long comparisons = 0;
        long skipped = 0;
        for (int i = 0; i < texts.size(); i++) {
            for (int j = i + 1; j < texts.size(); j++) {
                if (texts.get(i).isEmpty() || texts.get(j).isEmpty() || texts.get(i).equals(texts.get(j))) continue;
                if (comparisons >= budget) {
                    skipped++;
                    continue;
                }
                comparisons++;
                double similarity = TextSimilarity.jaccard(texts.get(i), texts.get(j));
                if (similarity >= threshold) {
                    int earlier = questions.get(i).number();
                    issues.add(ValidationIssue.question(NEAR_DUPLICATE_QUESTION, String.format(Locale.ROOT,
                            "Q%d and Q%d are %.0f%% similar", earlier, questions.get(j).number(), similarity * 100), earlier));
                }
            }
        }
        if (skipped > 0) {
            log.info("event=duplicate_scan_truncated comparisons={} skipped={}", comparisons, skipped);
            issues.add(ValidationIssue.paper(DUPLICATE_SCAN_TRUNCATED,
                    "duplicate scan stopped after " + comparisons + " comparisons; " + skipped + " pairs were not compared"));
        }
    }

    /** Paper-level first, then document order of the question, then rule priority; stable otherwise. */
    private List<ValidationIssue> order(List<ValidationIssue> issues, List<Question> questions) {
        Map<Integer, Integer> position = new HashMap<>();
        for (int i = 0; i < questions.size(); i++) position.putIfAbsent(questions.get(i).number(), i);

        Function<ValidationIssue, Integer> place = i -> i.questionNumber() == null ? -1 : position.getOrDefault(i.questionNumber(), Integer.MAX_VALUE);
        List<ValidationIssue> sorted = new ArrayList<>(issues);
        sorted.sort(Comparator.comparing(place).thenComparingInt(i -> i.code().ordinal()));
        return List.copyOf(sorted);
    }

    private static List<Question> withSubquestions(Question q) {
        List<Question> out = new ArrayList<>();
        out.add(q);
        q.subquestions().forEach(sub -> out.addAll(withSubquestions(sub)));
        return out;
    }

    private static String key(String topic) {
        return TextSimilarity.normalize(topic);
    }
}
