package com.smartexam.compiler.validation;

import com.smartexam.compiler.ast.PaperModels.Option;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the option letters named by a {@code Correct:} answer. Accepted forms:
 * {@code b}, {@code (b)}, {@code b.}, {@code b)}, lists such as {@code a, c} or
 * {@code a and c}, {@code b) some text}, and the full text of one option.
 */
public final class McqAnswerResolver {
    private static final Pattern LETTER = Pattern.compile("\\(?([A-Za-z])[.)]?");
    private static final Pattern LABELLED_TEXT = Pattern.compile("\\(?([A-Za-z])[.)]\\s+\\S.*");
    private static final Pattern SEPARATORS = Pattern.compile("[,/\\s]+");

    private McqAnswerResolver() {}

    public static List<Character> letters(String answer, List<Option> options) {
        if (answer == null || answer.isBlank()) return List.of();
        String normalized = TextSimilarity.normalize(answer);

        Matcher single = LETTER.matcher(normalized);
        if (single.matches()) {
            char letter = single.group(1).charAt(0);
            if (options.stream().anyMatch(o -> Character.toLowerCase(o.letter()) == letter)) return List.of(letter);
        }

        for (Option o : options) {
            if (!TextSimilarity.normalize(o.text()).isEmpty() && TextSimilarity.normalize(o.text()).equals(normalized)) {
                return List.of(Character.toLowerCase(o.letter()));
            }
        }

        Set<Character> letters = new LinkedHashSet<>();
        boolean allLetters = true;
        for (String part : SEPARATORS.split(normalized)) {
            if (part.isEmpty() || part.equals("and")) continue;
            Matcher m = LETTER.matcher(part);
            if (m.matches()) {
                letters.add(m.group(1).charAt(0));
            } else {
                allLetters = false;
                break;
            }
        }
        if (allLetters) return List.copyOf(letters);

        Matcher labelled = LABELLED_TEXT.matcher(normalized);
        if (labelled.matches()) return List.of(labelled.group(1).charAt(0));
        return List.of();
    }
}
