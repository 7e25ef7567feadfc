package com.smartexam.compiler.validation;

import com.smartexam.compiler.ast.PaperModels.Difficulty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables of the semantic rules, bound from {@code smartexam.analyzer.*}.
 */
@Validated
@ConfigurationProperties(prefix = "smartexam.analyzer")
public record AnalyzerProperties(@Valid @NotNull DifficultyTargets difficulty,
                                 @Valid @NotNull DuplicateDetection duplicates,
                                 @Valid @NotNull TimeBudget time) {

    public record DifficultyTargets(@DecimalMin("0.0") @DecimalMax("1.0") double easy,
                                    @DecimalMin("0.0") @DecimalMax("1.0") double medium,
                                    @DecimalMin("0.0") @DecimalMax("1.0") double hard,
                                    @DecimalMin("0.0") @DecimalMax("1.0") double tolerance,
                                    boolean inferUnspecified) {
        /** Target share of the paper for a level; UNKNOWN has none. */
        public double targetFor(Difficulty level) {
            return switch (level) {
                case EASY -> easy;
                case MEDIUM -> medium;
                case HARD -> hard;
                case UNKNOWN -> 0.0;
            };
        }
    }

    public record DuplicateDetection(@DecimalMin("0.0") @DecimalMax("1.0") double similarityThreshold,
                                     @Min(0) int maxComparisons) {}

    public record TimeBudget(@DecimalMin("0.0") double easyMinutesPerMark,
                             @DecimalMin("0.0") double mediumMinutesPerMark,
                             @DecimalMin("0.0") double hardMinutesPerMark,
                             @DecimalMin("0.0") double unknownMinutesPerMark,
                             @DecimalMin("0.0") double minutesPerWord,
                             @Min(0) int toleranceMinutes) {
        public double minutesPerMark(Difficulty level) {
            return switch (level) {
                case EASY -> easyMinutesPerMark;
                case MEDIUM -> mediumMinutesPerMark;
                case HARD -> hardMinutesPerMark;
                case UNKNOWN -> unknownMinutesPerMark;
            };
        }
    }

    public static AnalyzerProperties defaults() {
        return new AnalyzerProperties(
                new DifficultyTargets(0.3, 0.5, 0.2, 0.1, true),
                new DuplicateDetection(0.8, 10_000),
                new TimeBudget(2.0, 3.0, 4.0, 3.0, 0.05, 15)
        );
    }
}
