package io.github.vishalmysore.loggraph.transform;

import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;

import java.util.List;
import java.util.SortedSet;

/**
 * Strategy for labelling the edges between two blocks of a quotient graph.
 * Returning several labels adds parallel edges; returning none adds no edge.
 */
public interface EdgeLabelFn {

    List<TaggedAst> labels(LabeledGraph graph, SortedSet<Integer> edges);
}
