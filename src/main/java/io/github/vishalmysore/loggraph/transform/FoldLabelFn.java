package io.github.vishalmysore.loggraph.transform;

import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;

import java.util.List;

/**
 * Strategy for labelling the edges that bypass a folded node. Called once for
 * every predecessor and successor of the folded node that survive the fold.
 */
public interface FoldLabelFn {

    List<TaggedAst> labels(LabeledGraph graph, int node, int predecessor, int successor);
}
