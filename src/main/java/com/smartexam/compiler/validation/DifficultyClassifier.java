package com.smartexam.compiler.validation;

import com.smartexam.compiler.ast.PaperModels.Difficulty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Guesses a difficulty from the action verbs of a question. Levels are tried
 * hardest first; text with none of the verbs is Medium.
 */
final class DifficultyClassifier {
    private static final Map<Difficulty, Set<String>> VERBS = new LinkedHashMap<>();

    static {
        VERBS.put(Difficulty.HARD, Set.of("design", "construct", "develop", "implement", "optimize",
                "synthesize", "analyze", "evaluate", "create", "formulate"));
        VERBS.put(Difficulty.MEDIUM, Set.of("explain", "prove", "derive", "compare", "discuss",
                "describe", "illustrate", "differentiate", "outline"));
        VERBS.put(Difficulty.EASY, Set.of("define", "state", "list", "identify", "name",
                "mention", "label", "write"));
    }

    private DifficultyClassifier() {}

    static Difficulty infer(String text) {
        List<String> words = TextSimilarity.words(text);
        for (var e : VERBS.entrySet()) {
            if (words.stream().anyMatch(e.getValue()::contains)) return e.getKey();
        }
        return Difficulty.MEDIUM;
    }
}
