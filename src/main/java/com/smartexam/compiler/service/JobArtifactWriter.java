package com.smartexam.compiler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smartexam.compiler.ast.AstJsonCodec;
import com.smartexam.compiler.graph.AstGraphModels.AstGraph;
import com.smartexam.compiler.graph.AstGraphService;
import com.smartexam.compiler.lexer.Token;
import com.smartexam.compiler.report.ReportModels.CompilationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the artifacts of one compilation into a job directory. AST artifacts
 * exist only for compilations that produced an AST; stale ones are removed.
 */
@Component
public class JobArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(JobArtifactWriter.class);

    private final ObjectMapper objectMapper;
    private final AstJsonCodec astCodec;
    private final AstGraphService graphService;
    private final JobProperties files;

    public JobArtifactWriter(ObjectMapper objectMapper, AstJsonCodec astCodec, AstGraphService graphService, JobProperties files) {
        this.objectMapper = objectMapper;
        this.astCodec = astCodec;
        this.graphService = graphService;
        this.files = files;
    }

    public void write(Path jobDir, CompilationReport report) {
        writeJson(jobDir.resolve(files.tokensFile()), tokens(report.tokens()));
        writeJson(jobDir.resolve(files.reportFile()), semanticReport(report));

        List<Path> astArtifacts = List.of(jobDir.resolve(files.astFile()), jobDir.resolve(files.graphFile()), jobDir.resolve(files.dotFile()));
        if (!report.astProduced()) {
            astArtifacts.forEach(this::deleteStale);
            return;
        }

        AstGraph graph = graphService.build(report.paper());

        JsonNode graphJson = objectMapper.valueToTree(graph);
        writeJson(astArtifacts.get(0), astCodec.toTree(report.paper(), report.statistics().estimatedMinutes()));
        writeJson(astArtifacts.get(1), graphJson);
        writeText(astArtifacts.get(2), graphService.toDot(graph));
        log.debug("event=artifacts_written dir={} questions={}", jobDir, report.statistics().questionMetrics().size());
    }

    ArrayNode tokens(List<Token> tokens) {
        ArrayNode out = objectMapper.createArrayNode();
        tokens.forEach(t -> out.addObject()
                .put("kind", t.kind().name())
                .put("lexeme", t.lexeme())
                .put("line", t.line())
                .put("column", t.column()));
        return out;
    }

    ObjectNode semanticReport(CompilationReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("astProduced", report.astProduced());
        root.put("qualityScore", report.qualityScore());
        root.set("diagnostics", objectMapper.valueToTree(report.diagnostics()));
        root.set("issues", objectMapper.valueToTree(report.issues()));
        root.set("statistics", objectMapper.valueToTree(report.statistics()));
        root.set("suggestions", objectMapper.valueToTree(report.suggestions()));
        root.put("tokenCount", report.tokens().size());
        return root;
    }

    private void writeJson(Path path, JsonNode node) {
        try {
            writeText(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node) + "\n");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Artifact " + path.getFileName() + " could not be serialized", e);
        }
    }

    private void writeText(Path path, String content) {
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    private void deleteStale(Path path) {
        try {
            if (Files.deleteIfExists(path)) log.info("event=stale_artifact_removed path={}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove stale " + path, e);
        }
    }
}
