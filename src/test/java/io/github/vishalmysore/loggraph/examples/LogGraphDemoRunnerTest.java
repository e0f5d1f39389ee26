package io.github.vishalmysore.loggraph.examples;

import io.github.vishalmysore.loggraph.analysis.PartitionRefiner;
import io.github.vishalmysore.loggraph.analyzers.AccountAccessGraph;
import io.github.vishalmysore.loggraph.config.AnalyzerSettings;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.transform.GraphTransformer;
import io.github.vishalmysore.loggraph.typing.Values;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LogGraphDemoRunnerTest {

    @Test
    void sampleGraphSkipsMalformedRecord() {
        AccountAccessGraph graph = LogGraphDemoRunner.buildSampleAccessGraph();
        // alice, bob, dave and three accounts; frank's record has no valid count.
        assertThat(graph.numNodes()).isEqualTo(6);
        assertThat(graph.numEdges()).isEqualTo(6);
    }

    @Test
    void analystsWithTheSameAccessesShareABlock() {
        LabeledGraph graph = LogGraphDemoRunner.buildSampleAccessGraph().getGraph();
        Map<Integer, Integer> refined = PartitionRefiner.refinePartition(graph,
                LogGraphDemoRunner.initialPartition(graph));
        int alice = graph.getNodes(AccountAccessGraph.actorLabel("alice", "Analyst", "carol")).first();
        int bob = graph.getNodes(AccountAccessGraph.actorLabel("bob", "Analyst", "carol")).first();
        int dave = graph.getNodes(AccountAccessGraph.actorLabel("dave", "Admin", "erin")).first();
        assertThat(refined.get(alice)).isEqualTo(refined.get(bob));
        assertThat(refined.get(dave)).isNotEqualTo(refined.get(alice));
        // Accounts keep their own blocks, so alice and bob form the only shared block.
        assertThat(new HashSet<>(refined.values())).hasSize(graph.numNodes() - 1);
    }

    @Test
    void summaryEdgesCarryTotalAccesses() {
        LabeledGraph graph = LogGraphDemoRunner.buildSampleAccessGraph().getGraph();
        AnalyzerSettings settings = AnalyzerSettings.builder().build();
        Map<Integer, Integer> byTag = new HashMap<>();
        for (int node : graph.nodeIds()) {
            byTag.put(node, graph.getNodeLabel(node).getTag().equals(AccountAccessGraph.ACTOR_TAG) ? 0 : 1);
        }
        LabeledGraph summary = GraphTransformer.quotientGraph(graph, byTag, LogGraphDemoRunner.summaryConfig(settings));
        assertThat(summary.numNodes()).isEqualTo(2);
        assertThat(summary.numEdges()).isEqualTo(1);
        assertThat(Values.getInt(summary.getEdgeLabel(0).getAst())).isEqualTo(3 + 3 + 1 + 1 + 12 + 7);
    }
}
