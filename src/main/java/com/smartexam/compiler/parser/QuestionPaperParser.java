package com.smartexam.compiler.parser;

import com.smartexam.compiler.ast.PaperModels.Difficulty;
import com.smartexam.compiler.ast.PaperModels.Option;
import com.smartexam.compiler.ast.PaperModels.Paper;
import com.smartexam.compiler.ast.PaperModels.Question;
import com.smartexam.compiler.ast.PaperModels.QuestionKind;
import com.smartexam.compiler.exception.CompilationException;
import com.smartexam.compiler.exception.SyntaxException;
import com.smartexam.compiler.lexer.DslKeyword;
import com.smartexam.compiler.lexer.Token;
import com.smartexam.compiler.lexer.TokenKind;
import com.smartexam.compiler.lexer.TokenStream;
import com.smartexam.compiler.parser.ParserDtos.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Top-down parser for the question paper DSL:
 * <pre>
 * paper       := header question+
 * header      := header_item*
 * question    := qmarker kind_tag "(" number "marks" ")" attrs? NEWLINE
 *                body_lines* subquestion* ("Options:" option_line+)?
 *                "Correct:" answer NEWLINE "---" NEWLINE
 * </pre>
 * Each rule is selected by its leading token, so no backtracking is needed.
 */
@Component
public class QuestionPaperParser {
    private static final Logger log = LoggerFactory.getLogger(QuestionPaperParser.class);

    private static final Map<String, Integer> UNIT_MINUTES = Map.ofEntries(
            Map.entry("h", 60), Map.entry("hr", 60), Map.entry("hrs", 60),
            Map.entry("hour", 60), Map.entry("hours", 60),
            Map.entry("m", 1), Map.entry("min", 1), Map.entry("mins", 1),
            Map.entry("minute", 1), Map.entry("minutes", 1)
    );
    private static final Set<String> MARK_WORDS = Set.of("mark", "marks");

    public ParseResult parse(String source) {
        ParserContext ctx = new ParserContext(new TokenStream(source));
        try {
            Paper paper = parsePaper(ctx);
            log.debug("event=parse_complete questions={} diagnostics={}", paper.questions().size(), ctx.diagnostics().size());
            return new ParseResult(paper, ctx.scanned(), ctx.diagnostics());
        } catch (CompilationException e) {
            ctx.error(e.code(), e.getMessage(), e.line());
            log.info("event=parse_failed code={} line={} reason=\"{}\"", e.code(), e.line(), e.getMessage());
            return new ParseResult(null, ctx.scanned(), ctx.diagnostics());
        }
    }

    private Paper parsePaper(ParserContext ctx) {
        Header header = parseHeader(ctx);

        List<Question> questions = new ArrayList<>();
        ctx.skipBlankLines();
        while (!ctx.check(TokenKind.EOF)) {
            questions.add(parseQuestion(ctx));
            ctx.skipBlankLines();
        }
        if (questions.isEmpty()) throw ctx.unexpected("at least one question block starting with 'Q<number>'");

        return new Paper(header.title, header.totalMarks, header.durationMinutes, header.syllabus, questions);
    }

    // ================= header =================

    private Header parseHeader(ParserContext ctx) {
        Header header = new Header();
        while (true) {
            ctx.skipBlankLines();
            Token first = ctx.peek();
            if (first.kind() == TokenKind.EOF || first.kind() == TokenKind.QUESTION_MARKER) break;

            if (first.kind() == TokenKind.KEYWORD && DslKeyword.fromToken(first).isHeaderField()) {
                DslKeyword field = DslKeyword.fromToken(ctx.advance());
                List<Token> value = ctx.restOfLine();
                ctx.endLine(first.lexeme());
                if (!header.seen.add(field)) {
                    ctx.warn("DUPLICATE_HEADER_FIELD",
                            "Header field " + field.canonical() + " given more than once; the later value is used", first.line());
                }
                applyHeaderField(ctx, header, field, value, first.line());
            } else {
                String text = ParserContext.text(ctx.restOfLine());
                ctx.endLine("header line");
                ctx.warn("UNKNOWN_HEADER_LINE", "Ignoring unrecognised header line: " + text, first.line());
            }
        }

        for (DslKeyword required : List.of(DslKeyword.EXAM, DslKeyword.TOTAL_MARKS, DslKeyword.DURATION)) {
            if (!header.seen.contains(required)) {
                ctx.warn("MISSING_HEADER_FIELD", "Header field " + required.canonical() + " is missing", 1);
            }
        }
        return header;
    }

    private void applyHeaderField(ParserContext ctx, Header header, DslKeyword field, List<Token> value, int line) {
        switch (field) {
            case EXAM -> header.title = ParserContext.text(value);
            case TOTAL_MARKS -> header.totalMarks = firstNumber(ctx, value, field.canonical(), line);
            case DURATION -> header.durationMinutes = durationMinutes(ctx, value, line);
            case SYLLABUS -> header.syllabus = topics(value);
            default -> throw new IllegalStateException("Not a header field: " + field);
        }
    }

    private int firstNumber(ParserContext ctx, List<Token> value, String field, int line) {
        for (Token t : value) {
            if (t.kind() == TokenKind.NUMBER) return toInt(ctx, t, field);
        }
        ctx.warn("INVALID_NUMBER", field + " has no recognisable number; 0 is used", line);
        return 0;
    }

    /**
     * Sums {@code <number>[.<number>] [unit]} pairs. Hours are converted to
     * minutes; a number without a unit counts as minutes.
     */
    private int durationMinutes(ParserContext ctx, List<Token> value, int line) {
        double minutes = 0;
        boolean found = false;
        for (int i = 0; i < value.size(); i++) {
            Token t = value.get(i);
            if (t.kind() != TokenKind.NUMBER) continue;

            String digits = t.lexeme();
            if (i + 2 < value.size() && isDecimalTail(t, value.get(i + 1), value.get(i + 2))) {
                digits = digits + "." + value.get(i + 2).lexeme();
                i += 2;
            }
            double amount = Double.parseDouble(digits);

            int factor = 1;
            if (i + 1 < value.size() && value.get(i + 1).kind() == TokenKind.WORD) {
                Token unit = value.get(++i);
                Integer known = UNIT_MINUTES.get(unit.lexeme().toLowerCase(Locale.ROOT));
                if (known != null) {
                    factor = known;
                } else {
                    ctx.warn("UNRECOGNIZED_UNIT", "Duration unit '" + unit.lexeme() + "' not recognised; minutes assumed", line);
                }
            }
            minutes += amount * factor;
            found = true;
        }

        if (!found) {
            ctx.warn("INVALID_NUMBER", "Duration has no recognisable number; 0 is used", line);
            return 0;
        }
        return (int) Math.round(minutes);
    }

    private boolean isDecimalTail(Token whole, Token dot, Token fraction) {
        return dot.is(TokenKind.PUNCTUATION, ".") && fraction.kind() == TokenKind.NUMBER
                && dot.column() == whole.endColumn() && fraction.column() == dot.endColumn();
    }

    private List<String> topics(List<Token> value) {
        Map<String, String> seen = new LinkedHashMap<>();
        List<Token> current = new ArrayList<>();
        for (Token t : value) {
            if (t.is(TokenKind.PUNCTUATION, ",") || t.is(TokenKind.PUNCTUATION, ";")) {
                addTopic(seen, current);
                current = new ArrayList<>();
            } else {
                current.add(t);
            }
        }
        addTopic(seen, current);
        return List.copyOf(seen.values());
    }

    private void addTopic(Map<String, String> seen, List<Token> tokens) {
        String topic = ParserContext.text(tokens);
        if (!topic.isEmpty()) seen.putIfAbsent(topic.toLowerCase(Locale.ROOT), topic);
    }

    // ================= questions =================

    private Question parseQuestion(ParserContext ctx) {
        if (!ctx.check(TokenKind.QUESTION_MARKER)) throw ctx.unexpected("question marker 'Q<number>' at the start of a line");
        Token marker = ctx.advance();
        MarkerNumber number = markerNumber(marker);
        if (number.isSub()) {
            throw new SyntaxException(marker.line(), "top-level question marker 'Q<number>'",
                    "sub-question marker '" + marker.lexeme() + "' outside its question block");
        }
        QuestionHeader header = parseQuestionHeader(ctx, marker);

        List<String> body = new ArrayList<>();
        List<Question> subquestions = new ArrayList<>();
        List<Option> options = new ArrayList<>();
        boolean optionsSeen = false;
        String correct = null;

        while (true) {
            Token t = ctx.peek();
            if (t.kind() == TokenKind.EOF) throw unterminated(marker, t);
            if (t.kind() == TokenKind.NEWLINE) {
                ctx.advance();
                continue;
            }
            if (t.kind() == TokenKind.SEPARATOR) {
                if (correct == null) throw new SyntaxException(t.line(), "'Correct:' line in question " + marker.lexeme(), "'---'");
                ctx.advance();
                ctx.endLine("'---'");
                break;
            }
            if (correct != null) throw ctx.unexpected("'---' closing question " + marker.lexeme());

            if (ctx.checkKeyword(DslKeyword.CORRECT)) {
                ctx.advance();
                correct = ParserContext.text(ctx.restOfLine());
                ctx.endLine("'Correct:'");
            } else if (optionsSeen) {
                throw ctx.unexpected("option line 'a. <text>' or 'Correct:' in question " + marker.lexeme());
            } else if (ctx.checkKeyword(DslKeyword.OPTIONS)) {
                ctx.advance();
                ctx.endLine("'Options:'");
                optionsSeen = true;
                parseOptions(ctx, options);
            } else if (t.kind() == TokenKind.QUESTION_MARKER) {
                subquestions.add(parseSubquestion(ctx, number.parent(), marker));
            } else {
                body.add(ParserContext.text(ctx.restOfLine()));
                ctx.endLine("question text");
            }
        }

        if (header.kind() == QuestionKind.MCQ && options.isEmpty()) {
            throw new SyntaxException(marker.line(), "at least one option for MCQ question " + marker.lexeme(),
                    optionsSeen ? "an empty 'Options:' list" : "no 'Options:' section");
        }
        if (header.kind() != QuestionKind.MCQ && !options.isEmpty()) {
            ctx.warn("OPTIONS_IGNORED", "Question " + marker.lexeme() + " is not MCQ; its options are ignored", marker.line());
            options.clear();
        }

        return new Question(number.parent(), header.kind(), String.join("\n", body), header.marks(),
                header.topic(), header.difficulty(), options, correct, subquestions);
    }

    private Question parseSubquestion(ParserContext ctx, int parentNumber, Token parentMarker) {
        Token marker = ctx.advance();
        MarkerNumber number = markerNumber(marker);
        if (!number.isSub()) {
            throw new SyntaxException(marker.line(), "'---' closing question " + parentMarker.lexeme(),
                    "next question marker '" + marker.lexeme() + "'");
        }
        if (number.parent() != parentNumber) {
            throw new SyntaxException(marker.line(), "a sub-question of " + parentMarker.lexeme(), "'" + marker.lexeme() + "'");
        }

        QuestionHeader header = parseQuestionHeader(ctx, marker);
        if (header.kind() == QuestionKind.MCQ) {
            throw new SyntaxException(marker.line(), "[Short], [Long] or [Other] for sub-question " + marker.lexeme(), "[MCQ]");
        }

        List<String> body = new ArrayList<>();
        while (true) {
            Token t = ctx.peek();
            if (t.kind() == TokenKind.NEWLINE) {
                ctx.advance();
                continue;
            }
            if (t.kind() == TokenKind.EOF || t.kind() == TokenKind.SEPARATOR || t.kind() == TokenKind.QUESTION_MARKER
                    || ctx.checkKeyword(DslKeyword.OPTIONS) || ctx.checkKeyword(DslKeyword.CORRECT)) {
                break;
            }
            body.add(ParserContext.text(ctx.restOfLine()));
            ctx.endLine("sub-question text");
        }

        return new Question(number.sub(), header.kind(), String.join("\n", body), header.marks(),
                header.topic(), header.difficulty(), List.of(), null, List.of());
    }

    private QuestionHeader parseQuestionHeader(ParserContext ctx, Token marker) {
        String label = marker.lexeme();
        if (!ctx.check(TokenKind.KIND_TAG)) throw ctx.unexpected("kind tag [MCQ], [Short], [Long] or [Other] after " + label);
        Token tag = ctx.advance();
        QuestionKind kind = QuestionKind.fromTag(tag.lexeme())
                .orElseThrow(() -> new SyntaxException(tag.line(), "kind tag", "'" + tag.lexeme() + "'"));

        ctx.expectPunctuation("(", "'(' opening the marks of " + label);
        int marks = 0;
        if (ctx.check(TokenKind.NUMBER)) {
            marks = toInt(ctx, ctx.advance(), label + " marks");
        } else {
            ctx.warn("MISSING_MARKS", "Question " + label + " has no marks value; 0 is used", marker.line());
        }
        Token unit = ctx.peek();
        if (unit.kind() != TokenKind.WORD || !MARK_WORDS.contains(unit.lexeme().toLowerCase(Locale.ROOT))) {
            throw ctx.unexpected("'marks' in the header of " + label);
        }
        ctx.advance();
        ctx.expectPunctuation(")", "')' closing the marks of " + label);

        String topic = null;
        Difficulty difficulty = Difficulty.UNKNOWN;
        boolean topicSeen = false;
        boolean difficultySeen = false;
        while (ctx.check(TokenKind.KEYWORD)) {
            Token attr = ctx.peek();
            DslKeyword keyword = DslKeyword.fromToken(attr);
            if (keyword == DslKeyword.TOPIC) {
                ctx.advance();
                if (topicSeen) ctx.warn("DUPLICATE_ATTRIBUTE", "Topic given twice for " + label + "; the later value is used", attr.line());
                topicSeen = true;
                List<Token> words = new ArrayList<>();
                while (!ctx.check(TokenKind.NEWLINE) && !ctx.check(TokenKind.EOF)
                        && !ctx.checkKeyword(DslKeyword.TOPIC) && !ctx.checkKeyword(DslKeyword.DIFFICULTY)) {
                    words.add(ctx.advance());
                }
                if (words.isEmpty()) throw ctx.unexpected("topic name after 'Topic:' in " + label);
                topic = ParserContext.text(words);
            } else if (keyword == DslKeyword.DIFFICULTY) {
                ctx.advance();
                if (difficultySeen) ctx.warn("DUPLICATE_ATTRIBUTE", "Difficulty given twice for " + label + "; the later value is used", attr.line());
                difficultySeen = true;
                Token level = ctx.peek();
                if (level.kind() == TokenKind.DIFFICULTY) {
                    ctx.advance();
                    difficulty = Difficulty.fromLabel(level.lexeme()).orElse(Difficulty.UNKNOWN);
                } else if (level.kind() == TokenKind.WORD) {
                    ctx.advance();
                    ctx.warn("INVALID_DIFFICULTY", "Unknown difficulty '" + level.lexeme() + "' for " + label + "; recorded as Unknown", level.line());
                    difficulty = Difficulty.UNKNOWN;
                } else {
                    throw ctx.unexpected("Easy, Medium or Hard after 'Difficulty:' in " + label);
                }
            } else {
                break;
            }
        }

        if (ctx.check(TokenKind.EOF)) throw unterminated(marker, ctx.peek());
        if (!ctx.check(TokenKind.NEWLINE)) throw ctx.unexpected("end of the header line of " + label);
        ctx.advance();
        return new QuestionHeader(kind, marks, topic, difficulty);
    }

    private void parseOptions(ParserContext ctx, List<Option> options) {
        while (true) {
            ctx.skipBlankLines();
            if (!ctx.check(TokenKind.OPTION_MARKER)) return;
            Token marker = ctx.advance();
            String text = ParserContext.text(ctx.restOfLine());
            ctx.endLine("option " + marker.lexeme());
            options.add(new Option(marker.lexeme().charAt(0), text));
        }
    }

    // ================= helpers =================

    private MarkerNumber markerNumber(Token marker) {
        String[] parts = marker.lexeme().substring(1).split("\\.");
        try {
            int parent = Integer.parseInt(parts[0]);
            int sub = parts.length > 1 ? Integer.parseInt(parts[1]) : -1;
            if (parent < 1 || (parts.length > 1 && sub < 1)) {
                throw new SyntaxException(marker.line(), "a positive question number", "'" + marker.lexeme() + "'");
            }
            return new MarkerNumber(parent, sub);
        } catch (NumberFormatException e) {
            throw new SyntaxException(marker.line(), "a question number that fits in an int", "'" + marker.lexeme() + "'");
        }
    }

    private int toInt(ParserContext ctx, Token number, String what) {
        try {
            return Integer.parseInt(number.lexeme());
        } catch (NumberFormatException e) {
            ctx.warn("INVALID_NUMBER", what + " value " + number.lexeme() + " is out of range; 0 is used", number.line());
            return 0;
        }
    }

    private SyntaxException unterminated(Token marker, Token at) {
        return new SyntaxException(at.line(), "'---' closing question " + marker.lexeme(),
                "end of input (unterminated question block)");
    }

    private record MarkerNumber(int parent, int sub) {
        boolean isSub() {
            return sub >= 0;
        }
    }

    private record QuestionHeader(QuestionKind kind, int marks, String topic, Difficulty difficulty) {}

    private static final class Header {
        private final Set<DslKeyword> seen = EnumSet.noneOf(DslKeyword.class);
        private String title;
        private int totalMarks;
        private int durationMinutes;
        private List<String> syllabus = List.of();
    }
}
