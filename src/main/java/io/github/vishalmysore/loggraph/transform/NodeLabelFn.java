package io.github.vishalmysore.loggraph.transform;

import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;

import java.util.SortedSet;

/**
 * Strategy for labelling the node that replaces a block of nodes in a
 * quotient graph.
 */
public interface NodeLabelFn {

    /**
     * @param graph the graph being quotiented
     * @param nodes the members of one block
     * @return the label of the block's node in the quotient
     */
    TaggedAst label(LabeledGraph graph, SortedSet<Integer> nodes);
}
