package com.smartexam.compiler.validation;

import com.smartexam.compiler.ast.PaperModels.Difficulty;
import com.smartexam.compiler.ast.PaperModels.Question;

final class TimeEstimator {
    private final AnalyzerProperties.TimeBudget budget;

    TimeEstimator(AnalyzerProperties.TimeBudget budget) {
        this.budget = budget;
    }

    /** {@code ceil(marks * minutesPerMark + words * minutesPerWord)}. */
    long estimateMinutes(Question question, Difficulty effective, int wordCount) {
        double minutes = (double) question.marks() * budget.minutesPerMark(effective) + wordCount * budget.minutesPerWord();
        return (long) Math.ceil(minutes);
    }

    /** Words of the question and of all its sub-questions. */
    static int wordCount(Question question) {
        int count = TextSimilarity.words(question.text()).size();
        for (Question sub : question.subquestions()) count += wordCount(sub);
        return count;
    }

    static String fullText(Question question) {
        StringBuilder sb = new StringBuilder(question.text() == null ? "" : question.text());
        question.subquestions().forEach(sub -> sb.append('\n').append(fullText(sub)));
        return sb.toString();
    }
}
