package com.smartexam.compiler.lexer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Field names recognised by the lexer when immediately followed by a colon.
 * Matching is case-insensitive; every alias maps to one keyword.
 */
public enum DslKeyword {
    EXAM(true, "Exam", "Title", "Subject"),
    TOTAL_MARKS(true, "TotalMarks", "Total_Marks", "MaxMarks"),
    DURATION(true, "Duration", "Time"),
    SYLLABUS(true, "Syllabus"),
    TOPIC(false, "Topic"),
    DIFFICULTY(false, "Difficulty"),
    OPTIONS(false, "Options"),
    CORRECT(false, "Correct", "Answer");

    private static final Map<String, DslKeyword> BY_ALIAS = Arrays.stream(values())
            .flatMap(k -> k.aliases.stream().map(a -> Map.entry(a.toLowerCase(Locale.ROOT), k)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private final boolean headerField;
    private final List<String> aliases;

    DslKeyword(boolean headerField, String... aliases) {
        this.headerField = headerField;
        this.aliases = List.of(aliases);
    }

    public boolean isHeaderField() {
        return headerField;
    }

    /** Canonical spelling, used when writing DSL text back out. */
    public String canonical() {
        return aliases.get(0);
    }

    public static Optional<DslKeyword> fromWord(String word) {
        return Optional.ofNullable(BY_ALIAS.get(word.toLowerCase(Locale.ROOT)));
    }

    /** Resolves a KEYWORD token lexeme such as {@code "TotalMarks:"}. */
    public static DslKeyword fromToken(Token token) {
        String lexeme = token.lexeme();
        String word = lexeme.endsWith(":") ? lexeme.substring(0, lexeme.length() - 1) : lexeme;
        return fromWord(word).orElseThrow(() -> new IllegalArgumentException("Not a keyword token: " + token));
    }
}
