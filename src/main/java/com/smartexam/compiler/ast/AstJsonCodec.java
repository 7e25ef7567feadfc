package com.smartexam.compiler.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smartexam.compiler.ast.PaperModels.*;
import com.smartexam.compiler.exception.AstFormatException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * AST interchange form. Field names are fixed here and do not follow the
 * record accessors. {@code estimatedTimeMinutes} is written when estimates are
 * supplied and ignored when reading.
 */
@Component
public class AstJsonCodec {
    private final ObjectMapper objectMapper;

    public AstJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toTree(Paper paper) {
        return toTree(paper, List.of());
    }

    /** {@code estimatedMinutes} is positional: entry i belongs to the i-th top-level question. */
    public ObjectNode toTree(Paper paper, List<Long> estimatedMinutes) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("title", paper.title());
        root.put("declaredTotalMarks", paper.declaredTotalMarks());
        root.put("declaredDurationMinutes", paper.declaredDurationMinutes());
        ArrayNode topics = root.putArray("syllabusTopics");
        paper.syllabusTopics().forEach(topics::add);
        ArrayNode questions = root.putArray("questions");
        List<Question> top = paper.questions();
        for (int i = 0; i < top.size(); i++) {
            questions.add(question(top.get(i), i < estimatedMinutes.size() ? estimatedMinutes.get(i) : null));
        }
        return root;
    }

    public String toJson(Paper paper, List<Long> estimatedMinutes) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(paper, estimatedMinutes));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("AST tree could not be written", e);
        }
    }

    public String toJson(Paper paper) {
        return toJson(paper, List.of());
    }

    public Paper fromJson(String json) {
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new AstFormatException("AST document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Paper fromTree(JsonNode root) {
        if (root == null || !root.isObject()) throw new AstFormatException("AST document must be a JSON object");
        return new Paper(
                optionalText(root, "title"),
                requiredInt(root, "declaredTotalMarks"),
                requiredInt(root, "declaredDurationMinutes"),
                array(root, "syllabusTopics").stream().map(JsonNode::asText).toList(),
                array(root, "questions").stream().map(this::readQuestion).toList()
        );
    }

    private ObjectNode question(Question q, Long estimated) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("number", q.number());
        node.put("kind", q.kind().jsonName());
        node.put("text", q.text());
        node.put("marks", q.marks());
        node.put("topic", q.topic());
        node.put("difficulty", q.difficulty().label());
        ArrayNode options = node.putArray("options");
        q.options().forEach(o -> options.addObject().put("letter", String.valueOf(o.letter())).put("text", o.text()));
        node.put("correctAnswer", q.correctAnswer());
        if (estimated != null) node.put("estimatedTimeMinutes", estimated);
        ArrayNode subs = node.putArray("subquestions");
        q.subquestions().forEach(sub -> subs.add(question(sub, null)));
        return node;
    }

    private Question readQuestion(JsonNode node) {
        if (!node.isObject()) throw new AstFormatException("question entry must be an object: " + node);
        String kindName = requiredText(node, "kind");
        QuestionKind kind = QuestionKind.fromJsonName(kindName)
                .orElseThrow(() -> new AstFormatException("unknown question kind '" + kindName + "'"));
        String difficultyLabel = optionalText(node, "difficulty");
        Difficulty difficulty = difficultyLabel == null ? Difficulty.UNKNOWN : Difficulty.fromLabel(difficultyLabel)
                .orElseThrow(() -> new AstFormatException("unknown difficulty '" + difficultyLabel + "'"));

        List<Option> options = new ArrayList<>();
        for (JsonNode o : array(node, "options")) {
            String letter = requiredText(o, "letter");
            if (letter.length() != 1) throw new AstFormatException("option letter must be one character: '" + letter + "'");
            options.add(new Option(letter.charAt(0), requiredText(o, "text")));
        }

        return new Question(
                requiredInt(node, "number"),
                kind,
                requiredText(node, "text"),
                requiredInt(node, "marks"),
                optionalText(node, "topic"),
                difficulty,
                options,
                optionalText(node, "correctAnswer"),
                array(node, "subquestions").stream().map(this::readQuestion).toList()
        );
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new AstFormatException("field '" + field + "' must be an integer");
        }
        return value.intValue();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) throw new AstFormatException("field '" + field + "' must be a string");
        return value.textValue();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (!value.isTextual()) throw new AstFormatException("field '" + field + "' must be a string or null");
        return value.textValue();
    }

    private static List<JsonNode> array(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return List.of();
        if (!value.isArray()) throw new AstFormatException("field '" + field + "' must be an array");
        List<JsonNode> out = new ArrayList<>();
        value.forEach(out::add);
        return out;
    }
}
