package com.smartexam.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smartexam.compiler.ast.AstJsonCodec;
import com.smartexam.compiler.ast.PaperModels.*;
import com.smartexam.compiler.exception.AstFormatException;
import com.smartexam.compiler.parser.QuestionPaperParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstJsonCodecTest {
    private final AstJsonCodec codec = new AstJsonCodec(new ObjectMapper());
    private final Paper sample = new QuestionPaperParser().parse(SamplePapers.COMPILER_DESIGN).paper();

    @Test
    void readsBackWhatItWrites() {
        assertEquals(sample, codec.fromJson(codec.toJson(sample)));
    }

    @Test
    void usesFixedFieldNamesAndLabels() {
        ObjectNode tree = codec.toTree(sample);

        assertEquals("Compiler Design", tree.get("title").asText());
        assertEquals(10, tree.get("declaredTotalMarks").asInt());
        assertEquals(60, tree.get("declaredDurationMinutes").asInt());
        assertEquals("Parsing", tree.get("syllabusTopics").get(1).asText());

        JsonNode q1 = tree.get("questions").get(0);
        assertEquals("MCQ", q1.get("kind").asText());
        assertEquals("Easy", q1.get("difficulty").asText());
        assertEquals("a", q1.get("options").get(0).get("letter").asText());
        assertEquals("Lexer", q1.get("options").get(0).get("text").asText());
        assertFalse(q1.has("estimatedTimeMinutes"));

        JsonNode q2 = tree.get("questions").get(1);
        assertEquals("LongAnswer", q2.get("kind").asText());
        assertEquals("ShortAnswer", q2.get("subquestions").get(0).get("kind").asText());
        assertTrue(q2.get("subquestions").get(0).get("topic").isNull());
    }

    @Test
    void writesEstimatesButIgnoresThemOnRead() {
        ObjectNode tree = codec.toTree(sample, List.of(9L, 25L));

        assertEquals(9, tree.get("questions").get(0).get("estimatedTimeMinutes").asInt());
        assertEquals(25, tree.get("questions").get(1).get("estimatedTimeMinutes").asInt());
        assertEquals(sample, codec.fromTree(tree));
    }

    @Test
    void readsMinimalDocument() {
        Paper paper = codec.fromJson("""
                {"declaredTotalMarks": 5, "declaredDurationMinutes": 30,
                 "questions": [{"number": 1, "kind": "Other", "text": "Why?", "marks": 5}]}
                """);

        assertNull(paper.title());
        assertEquals(List.of(), paper.syllabusTopics());
        Question q = paper.questions().get(0);
        assertEquals(QuestionKind.OTHER, q.kind());
        assertEquals(Difficulty.UNKNOWN, q.difficulty());
        assertNull(q.correctAnswer());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{",
            "[]",
            "{\"declaredTotalMarks\": 5}",
            "{\"declaredTotalMarks\": \"5\", \"declaredDurationMinutes\": 0}",
            "{\"declaredTotalMarks\": 5, \"declaredDurationMinutes\": 0, \"questions\": [{\"number\": 1, \"kind\": \"Essay\", \"text\": \"x\", \"marks\": 1}]}",
            "{\"declaredTotalMarks\": 5, \"declaredDurationMinutes\": 0, \"questions\": [{\"number\": 1, \"kind\": \"MCQ\", \"text\": \"x\", \"marks\": 1, \"options\": [{\"letter\": \"ab\", \"text\": \"y\"}]}]}",
            "{\"declaredTotalMarks\": 5, \"declaredDurationMinutes\": 0, \"questions\": [{\"number\": 1, \"kind\": \"Short\", \"text\": \"x\", \"marks\": 1, \"difficulty\": \"Trivial\"}]}"
    })
    void rejectsMalformedDocuments(String json) {
        assertThrows(AstFormatException.class, () -> codec.fromJson(json));
    }
}
