package com.smartexam.compiler.ast;

import com.smartexam.compiler.ast.PaperModels.Difficulty;
import com.smartexam.compiler.ast.PaperModels.Paper;
import com.smartexam.compiler.ast.PaperModels.Question;
import com.smartexam.compiler.ast.PaperModels.QuestionKind;
import com.smartexam.compiler.lexer.DslKeyword;
import org.springframework.stereotype.Component;

/**
 * Renders a paper back to DSL text in canonical form: canonical keyword
 * spellings, durations in minutes, one blank line between blocks.
 */
@Component
public class PaperDslWriter {

    public String write(Paper paper) {
        StringBuilder sb = new StringBuilder();
        if (paper.title() != null) field(sb, DslKeyword.EXAM, paper.title());
        field(sb, DslKeyword.TOTAL_MARKS, String.valueOf(paper.declaredTotalMarks()));
        field(sb, DslKeyword.DURATION, paper.declaredDurationMinutes() + " min");
        if (!paper.syllabusTopics().isEmpty()) field(sb, DslKeyword.SYLLABUS, String.join(", ", paper.syllabusTopics()));

        for (Question q : paper.questions()) {
            sb.append('\n');
            questionHeader(sb, "Q" + q.number(), q);
            text(sb, q.text());
            for (Question sub : q.subquestions()) {
                questionHeader(sb, "Q" + q.number() + "." + sub.number(), sub);
                text(sb, sub.text());
            }
            if (q.kind() == QuestionKind.MCQ) {
                sb.append(DslKeyword.OPTIONS.canonical()).append(":\n");
                q.options().forEach(o -> sb.append(o.letter()).append(". ").append(o.text()).append('\n'));
            }
            field(sb, DslKeyword.CORRECT, q.correctAnswer() == null ? "" : q.correctAnswer());
            sb.append("---\n");
        }
        return sb.toString();
    }

    private void questionHeader(StringBuilder sb, String marker, Question q) {
        sb.append(marker).append(" [").append(q.kind().tag()).append("] (").append(q.marks()).append(" marks)");
        if (q.topic() != null) sb.append(' ').append(DslKeyword.TOPIC.canonical()).append(": ").append(q.topic());
        if (q.difficulty() != Difficulty.UNKNOWN) {
            sb.append(' ').append(DslKeyword.DIFFICULTY.canonical()).append(": ").append(q.difficulty().label());
        }
        sb.append('\n');
    }

    private void text(StringBuilder sb, String text) {
        if (text == null || text.isEmpty()) return;
        sb.append(text).append('\n');
    }

    private void field(StringBuilder sb, DslKeyword keyword, String value) {
        sb.append(keyword.canonical()).append(": ").append(value).append('\n');
    }
}
