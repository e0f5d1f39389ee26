package io.github.vishalmysore.loggraph.graph;

import io.github.vishalmysore.loggraph.ast.Ast;
import lombok.Builder;
import lombok.Data;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The declarations a {@link LabeledGraph} is initialized with: the types of
 * node and edge labels by tag, the tags whose labels must be unique, and the
 * type of the label of the graph as a whole.
 */
@Data
@Builder
public class GraphType {
    @Builder.Default
    private Map<String, Ast> nodeTypes = new TreeMap<>();
    @Builder.Default
    private Set<String> uniqueNodeTags = new TreeSet<>();
    @Builder.Default
    private Map<String, Ast> edgeTypes = new TreeMap<>();
    @Builder.Default
    private Set<String> uniqueEdgeTags = new TreeSet<>();
    private Ast graphType;

    /** The declarations of an initialized graph. */
    public static GraphType of(LabeledGraph graph) {
        return GraphType.builder()
                .nodeTypes(graph.getNodeTypes())
                .uniqueNodeTags(graph.getUniqueNodeTags())
                .edgeTypes(graph.getEdgeTypes())
                .uniqueEdgeTags(graph.getUniqueEdgeTags())
                .graphType(graph.getGraphType())
                .build();
    }
}
