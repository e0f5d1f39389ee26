package io.github.vishalmysore.loggraph.transform;

import io.github.vishalmysore.loggraph.graph.GraphType;
import lombok.Builder;
import lombok.Value;

/**
 * How a quotient graph is typed and labelled.
 */
@Value
@Builder
public class QuotientConfig {
    GraphType outputGraphType;
    NodeLabelFn nodeLabelFn;
    EdgeLabelFn edgeLabelFn;
    // When false, edges inside a block are dropped instead of becoming self-edges.
    @Builder.Default
    boolean allowSelfEdges = true;
}
