package com.smartexam.compiler.graph;

import com.smartexam.compiler.ast.PaperModels.Paper;
import com.smartexam.compiler.ast.PaperModels.Question;
import com.smartexam.compiler.graph.AstGraphModels.*;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Tree view of a paper for diagram renderers: one node per paper, question and
 * sub-question, edges from owner to owned.
 */
@Service
public class AstGraphService {
    static final int LABEL_TEXT_LIMIT = 40;

    public AstGraph build(Paper paper) {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        String title = paper.title() == null || paper.title().isBlank() ? "Paper" : paper.title();
        nodes.add(new GraphNode("paper", NodeType.PAPER, title + "\n" + paper.declaredTotalMarks() + " marks, "
                + paper.declaredDurationMinutes() + " min"));
        ids.add("paper");

        for (Question q : paper.questions()) {
            String qid = uniqueId(ids, "q" + q.number());
            nodes.add(new GraphNode(qid, NodeType.QUESTION, label("Q" + q.number(), q)));
            edges.add(new GraphEdge("paper", qid, EdgeType.HAS_QUESTION));

            for (Question sub : q.subquestions()) {
                String sid = uniqueId(ids, "q" + q.number() + "." + sub.number());
                nodes.add(new GraphNode(sid, NodeType.SUBQUESTION, label("Q" + q.number() + "." + sub.number(), sub)));
                edges.add(new GraphEdge(qid, sid, EdgeType.HAS_SUBQUESTION));
            }
        }
        return new AstGraph(List.copyOf(nodes), List.copyOf(edges));
    }

    /** Graphviz rendering of {@link #build(Paper)}. */
    public String toDot(AstGraph graph) {
        StringBuilder sb = new StringBuilder("digraph AST {\n");
        sb.append("  node [shape=box];\n");
        graph.nodes().forEach(n -> sb.append("  \"").append(escape(n.id())).append("\" [label=\"")
                .append(escape(n.label())).append("\"];\n"));
        graph.edges().forEach(e -> sb.append("  \"").append(escape(e.from())).append("\" -> \"")
                .append(escape(e.to())).append("\";\n"));
        return sb.append("}\n").toString();
    }

    private String label(String marker, Question q) {
        StringBuilder sb = new StringBuilder(marker)
                .append(" [").append(q.kind().tag()).append("] (").append(q.marks()).append(" marks)");
        if (q.topic() != null) sb.append("\n").append(q.topic());
        String text = q.text() == null ? "" : q.text().replace('\n', ' ');
        if (text.length() > LABEL_TEXT_LIMIT) text = text.substring(0, LABEL_TEXT_LIMIT) + "...";
        if (!text.isEmpty()) sb.append("\n").append(text);
        return sb.toString();
    }

    // duplicate question numbers still get distinct nodes
    private String uniqueId(Set<String> ids, String base) {
        String id = base;
        for (int i = 2; !ids.add(id); i++) id = base + "_" + i;
        return id;
    }

    private String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
