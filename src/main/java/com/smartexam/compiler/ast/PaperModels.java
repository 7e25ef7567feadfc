package com.smartexam.compiler.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class PaperModels {
    public record Paper(String title,
                        int declaredTotalMarks,
                        int declaredDurationMinutes,
                        List<String> syllabusTopics,
                        List<Question> questions) {
        public Paper {
            syllabusTopics = List.copyOf(syllabusTopics);
            questions = List.copyOf(questions);
        }
    }

    /**
     * One question block. Sub-questions are owned by their parent; their marks
     * are informational and the parent's {@code marks} is the binding total.
     */
    public record Question(int number,
                           QuestionKind kind,
                           String text,
                           int marks,
                           String topic,
                           Difficulty difficulty,
                           List<Option> options,
                           String correctAnswer,
                           List<Question> subquestions) {
        public Question {
            options = List.copyOf(options);
            subquestions = List.copyOf(subquestions);
        }
    }

    public record Option(char letter, String text) {}

    public enum QuestionKind {
        MCQ("MCQ", "MCQ"),
        SHORT_ANSWER("Short", "ShortAnswer"),
        LONG_ANSWER("Long", "LongAnswer"),
        OTHER("Other", "Other");

        private final String tag;
        private final String jsonName;

        QuestionKind(String tag, String jsonName) {
            this.tag = tag;
            this.jsonName = jsonName;
        }

        public String tag() {
            return tag;
        }

        public String jsonName() {
            return jsonName;
        }

        /** Accepts {@code [MCQ]} style lexemes or bare tags, case-insensitively. */
        public static Optional<QuestionKind> fromTag(String tag) {
            String bare = tag.startsWith("[") && tag.endsWith("]") ? tag.substring(1, tag.length() - 1) : tag;
            return Arrays.stream(values()).filter(k -> k.tag.equalsIgnoreCase(bare)).findFirst();
        }

        public static Optional<QuestionKind> fromJsonName(String name) {
            return Arrays.stream(values()).filter(k -> k.jsonName.equals(name)).findFirst();
        }
    }

    public enum Difficulty {
        EASY("Easy"),
        MEDIUM("Medium"),
        HARD("Hard"),
        UNKNOWN("Unknown");

        private final String label;

        Difficulty(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static Optional<Difficulty> fromLabel(String label) {
            return Arrays.stream(values()).filter(d -> d.label.equalsIgnoreCase(label)).findFirst();
        }
    }
}
