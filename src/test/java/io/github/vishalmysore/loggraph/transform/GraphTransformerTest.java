package io.github.vishalmysore.loggraph.transform;

import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.graph.GraphType;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.graph.WeightedGraphs;
import io.github.vishalmysore.loggraph.typing.Values;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphTransformerTest {

    // Block nodes are weighted by block size, edges between blocks by how many edges they replace.
    private static final NodeLabelFn BLOCK_SIZE =
            (graph, nodes) -> WeightedGraphs.nodeWeight(nodes.size());
    private static final EdgeLabelFn EDGE_COUNT =
            (graph, edges) -> List.of(WeightedGraphs.edgeWeight(edges.size()));
    private static final EdgeLabelFn KEEP_EDGES = (graph, edges) -> {
        List<TaggedAst> labels = new ArrayList<>();
        for (int edge : edges) {
            labels.add(graph.getEdgeLabel(edge));
        }
        return labels;
    };

    private static QuotientConfig counting() {
        return QuotientConfig.builder()
                .outputGraphType(WeightedGraphs.type())
                .nodeLabelFn(BLOCK_SIZE)
                .edgeLabelFn(EDGE_COUNT)
                .build();
    }

    private static Map<Integer, Integer> identity(LabeledGraph graph) {
        Map<Integer, Integer> partition = new HashMap<>();
        for (int node : graph.nodeIds()) {
            partition.put(node, node);
        }
        return partition;
    }

    private static Map<Integer, Integer> singleBlock(LabeledGraph graph) {
        Map<Integer, Integer> partition = new HashMap<>();
        for (int node : graph.nodeIds()) {
            partition.put(node, 0);
        }
        return partition;
    }

    private static final FoldLabelFn CONSTANT = (graph, node, pred, succ) -> List.of(WeightedGraphs.edgeWeight(0));
    private static final FoldLabelFn NONE = (graph, node, pred, succ) -> List.of();
    private static final FoldLabelFn DOUBLE = (graph, node, pred, succ) ->
            List.of(WeightedGraphs.edgeWeight(pred), WeightedGraphs.edgeWeight(succ));

    // Deletion

    @Test
    void deleteNodesDropsIncidentEdges() {
        Morphism morphism = GraphTransformer.deleteNodes(WeightedGraphs.path(4), Set.of(1));
        LabeledGraph output = morphism.getOutput();
        assertThat(output.numNodes()).isEqualTo(3);
        assertThat(output.numEdges()).isEqualTo(1);
        assertThat(morphism.getNodeMap()).containsOnlyKeys(0, 2, 3);
        assertThat(morphism.getEdgeMap()).containsOnlyKeys(2);
    }

    @Test
    void deleteEdgesNotNodesKeepsAllNodes() {
        Morphism morphism = GraphTransformer.deleteEdgesNotNodes(WeightedGraphs.path(4), Set.of(1));
        assertThat(morphism.getOutput().numNodes()).isEqualTo(4);
        assertThat(morphism.getOutput().numEdges()).isEqualTo(2);
        assertThat(morphism.getEdgeMap()).containsOnlyKeys(0, 2);
    }

    @Test
    void deleteEdgesAndNodesDropsIsolatedNodes() {
        Morphism morphism = GraphTransformer.deleteEdgesAndNodes(WeightedGraphs.path(4), Set.of(0, 1));
        LabeledGraph output = morphism.getOutput();
        assertThat(output.numNodes()).isEqualTo(2);
        assertThat(output.numEdges()).isEqualTo(1);
        assertThat(morphism.getNodeMap()).containsOnlyKeys(2, 3);
        assertThat(WeightedGraphs.weight(output.getEdgeLabel(0))).isEqualTo(2L);
    }

    @Test
    void transformationsLeaveInputUnchanged() {
        LabeledGraph input = WeightedGraphs.cycle(4);
        GraphTransformer.deleteNodes(input, Set.of(0, 1));
        GraphTransformer.quotientGraph(input, singleBlock(input), counting());
        GraphTransformer.foldNodes(input, CONSTANT, Set.of(2));
        assertThat(input.numNodes()).isEqualTo(4);
        assertThat(input.numEdges()).isEqualTo(4);
    }

    // Quotients

    @Test
    void identityQuotientPreservesShapeAndWeights() {
        // A single member keeps its own label.
        QuotientConfig copying = QuotientConfig.builder()
                .outputGraphType(WeightedGraphs.type())
                .nodeLabelFn((graph, nodes) -> graph.getNodeLabel(nodes.first()))
                .edgeLabelFn(KEEP_EDGES)
                .build();
        for (int n = 2; n <= 10; ++n) {
            for (LabeledGraph graph : List.of(WeightedGraphs.path(n), WeightedGraphs.cycle(n))) {
                LabeledGraph quotient = GraphTransformer.quotientGraph(graph, identity(graph), copying);
                assertThat(quotient.numNodes()).isEqualTo(graph.numNodes());
                assertThat(quotient.numEdges()).isEqualTo(graph.numEdges());
                for (int edge : quotient.edgeIds()) {
                    // Node weights are the ids of the input nodes.
                    int source = (int) WeightedGraphs.weight(quotient.getNodeLabel(quotient.source(edge)));
                    int target = (int) WeightedGraphs.weight(quotient.getNodeLabel(quotient.target(edge)));
                    List<TaggedAst> inputLabels = new ArrayList<>();
                    for (int inputEdge : graph.getOutEdges(source)) {
                        if (graph.target(inputEdge) == target) {
                            inputLabels.add(graph.getEdgeLabel(inputEdge));
                        }
                    }
                    assertThat(inputLabels).containsExactly(quotient.getEdgeLabel(edge));
                }
            }
        }
    }

    @Test
    void singleBlockQuotientCountsEdges() {
        for (int n = 2; n <= 10; ++n) {
            LabeledGraph path = WeightedGraphs.path(n);
            LabeledGraph merged = GraphTransformer.quotientGraph(path, singleBlock(path), counting());
            assertThat(merged.numNodes()).isEqualTo(1);
            assertThat(merged.numEdges()).isEqualTo(1);
            assertThat(WeightedGraphs.weight(merged.getEdgeLabel(0))).isEqualTo(n - 1);
            assertThat(WeightedGraphs.weight(merged.getNodeLabel(0))).isEqualTo(n);

            LabeledGraph cycle = WeightedGraphs.cycle(n);
            LabeledGraph collapsed = GraphTransformer.quotientGraph(cycle, singleBlock(cycle), counting());
            assertThat(collapsed.numNodes()).isEqualTo(1);
            assertThat(collapsed.numEdges()).isEqualTo(1);
            assertThat(WeightedGraphs.weight(collapsed.getEdgeLabel(0))).isEqualTo(n);
        }
    }

    @Test
    void edgeLabelFunctionMayKeepParallelEdges() {
        QuotientConfig config = QuotientConfig.builder()
                .outputGraphType(WeightedGraphs.type())
                .nodeLabelFn(BLOCK_SIZE)
                .edgeLabelFn(KEEP_EDGES)
                .build();
        for (int n = 2; n <= 3; ++n) {
            LabeledGraph cycle = WeightedGraphs.cycle(n);
            LabeledGraph quotient = GraphTransformer.quotientGraph(cycle, singleBlock(cycle), config);
            assertThat(quotient.numNodes()).isEqualTo(1);
            assertThat(quotient.numEdges()).isEqualTo(n);
            assertThat(quotient.getSuccessors(0)).containsExactly(0);
        }
    }

    @Test
    void quotientOfTwoHalvesOfACycle() {
        LabeledGraph cycle = WeightedGraphs.cycle(6);
        Map<Integer, Integer> halves = new HashMap<>();
        for (int node : cycle.nodeIds()) {
            halves.put(node, node < 3 ? 10 : 20);
        }
        LabeledGraph quotient = GraphTransformer.quotientGraph(cycle, halves, counting());
        assertThat(quotient.numNodes()).isEqualTo(2);
        assertThat(quotient.numEdges()).isEqualTo(4);
        for (int edge : quotient.edgeIds()) {
            long expected = quotient.source(edge) == quotient.target(edge) ? 2 : 1;
            assertThat(WeightedGraphs.weight(quotient.getEdgeLabel(edge))).isEqualTo(expected);
        }
    }

    @Test
    void quotientCanDropSelfEdges() {
        LabeledGraph cycle = WeightedGraphs.cycle(4);
        QuotientConfig config = QuotientConfig.builder()
                .outputGraphType(WeightedGraphs.type())
                .nodeLabelFn(BLOCK_SIZE)
                .edgeLabelFn(EDGE_COUNT)
                .allowSelfEdges(false)
                .build();
        LabeledGraph quotient = GraphTransformer.quotientGraph(cycle, singleBlock(cycle), config);
        assertThat(quotient.numNodes()).isEqualTo(1);
        assertThat(quotient.numEdges()).isZero();
    }

    @Test
    void quotientRequiresEveryNodeInThePartition() {
        LabeledGraph path = WeightedGraphs.path(3);
        Map<Integer, Integer> partial = new HashMap<>(Map.of(0, 0, 1, 0));
        assertThatThrownBy(() -> GraphTransformer.quotientGraph(path, partial, counting()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("The following node is missing from the partition: 2");
    }

    @Test
    void quotientWithMalformedTypeReturnsNull() {
        GraphType broken = GraphType.builder()
                .nodeTypes(new HashMap<>(Map.of("Bad", Values.makeInt(1))))
                .build();
        QuotientConfig config = QuotientConfig.builder()
                .outputGraphType(broken)
                .nodeLabelFn(BLOCK_SIZE)
                .edgeLabelFn(EDGE_COUNT)
                .build();
        LabeledGraph path = WeightedGraphs.path(2);
        assertThat(GraphTransformer.quotientGraph(path, identity(path), config)).isNull();
    }

    // Contraction

    @Test
    void contractingNoEdgesPreservesShape() {
        LabeledGraph cycle = WeightedGraphs.cycle(4);
        LabeledGraph contracted = GraphTransformer.contractEdges(cycle, Set.of(), counting());
        assertThat(contracted.numNodes()).isEqualTo(4);
        assertThat(contracted.numEdges()).isEqualTo(4);
    }

    @Test
    void contractingASelfLoopRemovesIt() {
        LabeledGraph contracted = GraphTransformer.contractEdges(WeightedGraphs.selfLoop(), Set.of(0), counting());
        assertThat(contracted.numNodes()).isEqualTo(1);
        assertThat(contracted.numEdges()).isZero();
    }

    @Test
    void contractingMergesEndpoints() {
        LabeledGraph path = GraphTransformer.contractEdges(WeightedGraphs.path(2), Set.of(0), counting());
        assertThat(path.numNodes()).isEqualTo(1);
        assertThat(path.numEdges()).isZero();

        LabeledGraph cycle = GraphTransformer.contractEdges(WeightedGraphs.cycle(2), Set.of(0), counting());
        assertThat(cycle.numNodes()).isEqualTo(1);
        assertThat(cycle.numEdges()).isEqualTo(1);
        assertThat(cycle.source(0)).isEqualTo(cycle.target(0));
    }

    @Test
    void contractingAChainMergesItIntoOneNode() {
        LabeledGraph contracted = GraphTransformer.contractEdges(WeightedGraphs.path(6), Set.of(0, 1), counting());
        assertThat(contracted.numNodes()).isEqualTo(4);
        assertThat(contracted.numEdges()).isEqualTo(3);
        assertThat(WeightedGraphs.weight(contracted.getNodeLabel(0))).isEqualTo(3L);
    }

    @Test
    void contractionFollowsEdgesInEitherDirection() {
        // 0 -> 1 <- 2: contracting both edges merges all three nodes.
        LabeledGraph graph = WeightedGraphs.empty();
        for (int i = 0; i < 3; ++i) {
            graph.findOrAddNode(WeightedGraphs.nodeWeight(i));
        }
        graph.findOrAddEdge(0, 1, WeightedGraphs.edgeWeight(0));
        graph.findOrAddEdge(2, 1, WeightedGraphs.edgeWeight(1));
        LabeledGraph contracted = GraphTransformer.contractEdges(graph, Set.of(0, 1), counting());
        assertThat(contracted.numNodes()).isEqualTo(1);
        assertThat(contracted.numEdges()).isZero();
    }

    // Folding

    @Test
    void foldingNoNodesCopiesTheGraph() {
        LabeledGraph folded = GraphTransformer.foldNodes(WeightedGraphs.cycle(5), CONSTANT, Set.of());
        assertThat(folded.numNodes()).isEqualTo(5);
        assertThat(folded.numEdges()).isEqualTo(5);
    }

    @Test
    void foldingASelfLoopLeavesNothing() {
        LabeledGraph folded = GraphTransformer.foldNodes(WeightedGraphs.selfLoop(), CONSTANT, Set.of(0));
        assertThat(folded.numNodes()).isZero();
        assertThat(folded.numEdges()).isZero();
    }

    @Test
    void foldingAnEndpointDropsItsEdge() {
        LabeledGraph folded = GraphTransformer.foldNodes(WeightedGraphs.path(2), CONSTANT, Set.of(0));
        assertThat(folded.numNodes()).isEqualTo(1);
        assertThat(folded.numEdges()).isZero();
    }

    @Test
    void foldingInACycleClosesTheLoop() {
        LabeledGraph folded = GraphTransformer.foldNodes(WeightedGraphs.cycle(2), CONSTANT, Set.of(0));
        assertThat(folded.numNodes()).isEqualTo(1);
        assertThat(folded.numEdges()).isEqualTo(1);
        assertThat(folded.source(0)).isEqualTo(folded.target(0));
    }

    @Test
    void foldingAPrefixOfAPath() {
        LabeledGraph folded = GraphTransformer.foldNodes(WeightedGraphs.path(6), CONSTANT, Set.of(0, 1));
        assertThat(folded.numNodes()).isEqualTo(4);
        assertThat(folded.numEdges()).isEqualTo(3);
    }

    @Test
    void foldLabelFunctionDecidesBypassEdges() {
        LabeledGraph path = WeightedGraphs.path(3);

        LabeledGraph constant = GraphTransformer.foldNodes(path, CONSTANT, Set.of(1));
        assertThat(constant.numNodes()).isEqualTo(2);
        assertThat(constant.numEdges()).isEqualTo(1);
        assertThat(WeightedGraphs.weight(constant.getNodeLabel(constant.source(0)))).isEqualTo(0L);
        assertThat(WeightedGraphs.weight(constant.getNodeLabel(constant.target(0)))).isEqualTo(2L);

        assertThat(GraphTransformer.foldNodes(path, NONE, Set.of(1)).numEdges()).isZero();

        LabeledGraph doubled = GraphTransformer.foldNodes(path, DOUBLE, Set.of(1));
        assertThat(doubled.numEdges()).isEqualTo(2);
        assertThat(WeightedGraphs.weight(doubled.getEdgeLabel(0))).isEqualTo(0L);
        assertThat(WeightedGraphs.weight(doubled.getEdgeLabel(1))).isEqualTo(2L);
    }

    @Test
    void foldingAChainInTheMiddleBypassesIt() {
        // 0 -> 1 -> 2 -> 3 with 1 and 2 folded leaves 0 -> 3.
        LabeledGraph folded = GraphTransformer.foldNodes(WeightedGraphs.path(4), CONSTANT, Set.of(1, 2));
        assertThat(folded.numNodes()).isEqualTo(2);
        assertThat(folded.numEdges()).isEqualTo(1);
        assertThat(WeightedGraphs.weight(folded.getNodeLabel(folded.source(0)))).isEqualTo(0L);
        assertThat(WeightedGraphs.weight(folded.getNodeLabel(folded.target(0)))).isEqualTo(3L);
    }
}
