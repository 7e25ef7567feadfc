package com.smartexam.compiler.graph;

import java.util.List;

public class AstGraphModels {
    public record AstGraph(List<GraphNode> nodes, List<GraphEdge> edges) {}

    public record GraphNode(String id, NodeType type, String label) {}

    public record GraphEdge(String from, String to, EdgeType type) {}

    public enum NodeType { PAPER, QUESTION, SUBQUESTION }

    public enum EdgeType { HAS_QUESTION, HAS_SUBQUESTION }
}
