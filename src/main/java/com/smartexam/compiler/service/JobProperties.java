package com.smartexam.compiler.service;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** File names inside a job directory, bound from {@code smartexam.job.*}. */
@Validated
@ConfigurationProperties(prefix = "smartexam.job")
public record JobProperties(@NotBlank String inputFile,
                            @NotBlank String tokensFile,
                            @NotBlank String astFile,
                            @NotBlank String graphFile,
                            @NotBlank String dotFile,
                            @NotBlank String reportFile) {

    public static JobProperties defaults() {
        return new JobProperties("input.qp", "tokens.json", "ast.json", "ast_graph.json", "ast.dot", "semantic_report.json");
    }
}
