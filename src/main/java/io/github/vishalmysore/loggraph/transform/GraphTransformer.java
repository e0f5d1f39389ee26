package io.github.vishalmysore.loggraph.transform;

import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;

import java.util.*;
import java.util.logging.Logger;

/**
 * Structural transformations of labelled graphs. Every transformation reads
 * its input without modifying it and builds a new, independent graph.
 *
 * Transformations that produce a graph directly return {@code null} when the
 * output graph cannot be initialized with the requested types. Invalid node or
 * edge ids are contract violations.
 */
public final class GraphTransformer {
    private static final Logger log = Logger.getLogger(GraphTransformer.class.getName());

    // Orders (source, target) pairs of block nodes.
    private static final Comparator<List<Integer>> LEXICOGRAPHIC = (a, b) -> {
        int cmp = Integer.compare(a.get(0), b.get(0));
        return cmp != 0 ? cmp : Integer.compare(a.get(1), b.get(1));
    };

    private GraphTransformer() {
    }

    /**
     * Copies every node not in {@code nodes} and every edge whose endpoints
     * both survive.
     */
    public static Morphism deleteNodes(LabeledGraph graph, Set<Integer> nodes) {
        Morphism morphism = new Morphism(graph);
        morphism.copyInputType();
        if (!morphism.hasOutputGraph()) {
            return morphism;
        }
        for (int source : graph.nodeIds()) {
            if (nodes.contains(source)) {
                continue;
            }
            morphism.findOrCopyNode(source);
            for (int edge : graph.getOutEdges(source)) {
                if (!nodes.contains(graph.target(edge))) {
                    morphism.findOrCopyEdge(edge);
                }
            }
        }
        return morphism;
    }

    /** Copies every node and every edge except those in {@code edges}. */
    public static Morphism deleteEdgesNotNodes(LabeledGraph graph, Set<Integer> edges) {
        Morphism morphism = new Morphism(graph);
        morphism.copyInputType();
        if (!morphism.hasOutputGraph()) {
            return morphism;
        }
        for (int source : graph.nodeIds()) {
            morphism.findOrCopyNode(source);
            for (int edge : graph.getOutEdges(source)) {
                morphism.findOrCopyNode(graph.target(edge));
                if (!edges.contains(edge)) {
                    morphism.findOrCopyEdge(edge);
                }
            }
        }
        return morphism;
    }

    /**
     * Copies every edge not in {@code edges} together with its endpoints.
     * Nodes that are not an endpoint of a surviving edge are dropped.
     */
    public static Morphism deleteEdgesAndNodes(LabeledGraph graph, Set<Integer> edges) {
        Morphism morphism = new Morphism(graph);
        morphism.copyInputType();
        if (!morphism.hasOutputGraph()) {
            return morphism;
        }
        for (int edge : graph.edgeIds()) {
            if (!edges.contains(edge)) {
                morphism.findOrCopyEdge(edge);
            }
        }
        return morphism;
    }

    /**
     * Collapses each block of {@code partition} into a single node.
     *
     * The partition maps every node of the input to a block id. Each block
     * becomes one node labelled by the config's node label function. For each
     * ordered pair of blocks joined by at least one edge, the edge label
     * function receives all those edges and returns the labels of the edges
     * to add between the two block nodes.
     *
     * @return the quotient, or {@code null} if the output type is malformed
     */
    public static LabeledGraph quotientGraph(LabeledGraph input, Map<Integer, Integer> partition,
                                             QuotientConfig config) {
        LabeledGraph output = new LabeledGraph();
        Status status = output.initialize(config.getOutputGraphType());
        if (!status.isOk()) {
            log.warning("Cannot initialize the quotient graph: " + status.getMessage());
            return null;
        }

        SortedMap<Integer, SortedSet<Integer>> blockMembers = new TreeMap<>();
        for (int node : input.nodeIds()) {
            Integer blockId = partition.get(node);
            Checks.check(blockId != null, "The following node is missing from the partition: " + node);
            blockMembers.computeIfAbsent(blockId, k -> new TreeSet<>()).add(node);
        }

        Map<Integer, Integer> blockNodes = new HashMap<>();
        for (Map.Entry<Integer, SortedSet<Integer>> block : blockMembers.entrySet()) {
            TaggedAst label = config.getNodeLabelFn().label(input, block.getValue());
            blockNodes.put(block.getKey(), output.findOrAddNode(label));
        }

        // Edges grouped by the (source, target) pair of block nodes they join.
        SortedMap<List<Integer>, SortedSet<Integer>> blockEdges = new TreeMap<>(LEXICOGRAPHIC);
        for (int edge : input.edgeIds()) {
            int sourceBlock = blockNodes.get(partition.get(input.source(edge)));
            int targetBlock = blockNodes.get(partition.get(input.target(edge)));
            if (!config.isAllowSelfEdges() && sourceBlock == targetBlock) {
                continue;
            }
            blockEdges.computeIfAbsent(List.of(sourceBlock, targetBlock), k -> new TreeSet<>()).add(edge);
        }
        for (Map.Entry<List<Integer>, SortedSet<Integer>> group : blockEdges.entrySet()) {
            int source = group.getKey().get(0);
            int target = group.getKey().get(1);
            for (TaggedAst label : config.getEdgeLabelFn().labels(input, group.getValue())) {
                output.findOrAddEdge(source, target, label);
            }
        }
        log.info("Quotient of " + input.numNodes() + " nodes has " + output.numNodes()
                + " nodes and " + output.numEdges() + " edges");
        return output;
    }

    /**
     * Merges the endpoints of every edge in {@code edges}. Nodes connected by
     * a path of such edges, in either direction, end up in the same block;
     * the contracted edges are removed and the rest of the graph is quotiented
     * by these blocks.
     */
    public static LabeledGraph contractEdges(LabeledGraph graph, Set<Integer> edges, QuotientConfig config) {
        Map<Integer, Integer> components = connectedComponents(graph, undirectedAdjacency(graph, edges));
        Morphism morphism = deleteEdgesNotNodes(graph, edges);
        if (!morphism.hasOutputGraph()) {
            return null;
        }
        Map<Integer, Integer> partition = new TreeMap<>();
        morphism.getNodeMap().forEach((inputNode, outputNode) ->
                partition.put(outputNode, components.get(inputNode)));
        return quotientGraph(morphism.getOutput(), partition, config);
    }

    /**
     * Removes the nodes in {@code nodes} and connects each surviving
     * predecessor of a removed node to each of its surviving successors with
     * the edges labelled by {@code foldLabelFn}. Chains of removed nodes are
     * bypassed as a whole. Self-loops on removed nodes are ignored.
     *
     * @return the folded graph, or {@code null} if the input's types cannot be copied
     */
    public static LabeledGraph foldNodes(LabeledGraph graph, FoldLabelFn foldLabelFn, Set<Integer> nodes) {
        Morphism morphism = new Morphism(graph);
        morphism.copyInputType();
        if (!morphism.hasOutputGraph()) {
            return null;
        }
        Map<Integer, Neighbors> adjacency = new HashMap<>();
        for (int node : nodes) {
            Neighbors neighbors = new Neighbors(graph.getPredecessors(node), graph.getSuccessors(node));
            neighbors.predecessors.remove(node);
            neighbors.successors.remove(node);
            adjacency.put(node, neighbors);
        }

        LabeledGraph output = morphism.getOutput();
        for (int source : graph.nodeIds()) {
            if (nodes.contains(source)) {
                replaceWithBipartite(graph, foldLabelFn, source, adjacency, morphism);
                continue;
            }
            int newSource = morphism.findOrCopyNode(source);
            for (int edge : graph.getOutEdges(source)) {
                int target = graph.target(edge);
                if (nodes.contains(target)) {
                    continue;
                }
                output.findOrAddEdge(newSource, morphism.findOrCopyNode(target), graph.getEdgeLabel(edge));
            }
        }
        return morphism.takeOutput();
    }

    private static class Neighbors {
        final SortedSet<Integer> predecessors;
        final SortedSet<Integer> successors;

        Neighbors(SortedSet<Integer> predecessors, SortedSet<Integer> successors) {
            this.predecessors = predecessors;
            this.successors = successors;
        }
    }

    /**
     * Connects the predecessors of a folded node to its successors. A folded
     * neighbor inherits the other side instead, so that it connects them when
     * it is folded itself.
     */
    private static void replaceWithBipartite(LabeledGraph graph, FoldLabelFn foldLabelFn, int node,
                                             Map<Integer, Neighbors> adjacency, Morphism morphism) {
        Neighbors neighbors = adjacency.get(node);
        for (int predecessor : new ArrayList<>(neighbors.predecessors)) {
            Neighbors foldedPredecessor = adjacency.get(predecessor);
            for (int successor : new ArrayList<>(neighbors.successors)) {
                Neighbors foldedSuccessor = adjacency.get(successor);
                if (foldedPredecessor != null) {
                    foldedPredecessor.successors.add(successor);
                }
                if (foldedSuccessor != null) {
                    foldedSuccessor.predecessors.add(predecessor);
                }
                if (foldedPredecessor != null || foldedSuccessor != null) {
                    continue;
                }
                List<TaggedAst> labels = foldLabelFn.labels(graph, node, predecessor, successor);
                int newPredecessor = morphism.findOrCopyNode(predecessor);
                int newSuccessor = morphism.findOrCopyNode(successor);
                for (TaggedAst label : labels) {
                    morphism.getOutput().findOrAddEdge(newPredecessor, newSuccessor, label);
                }
            }
        }
    }

    private static Map<Integer, SortedSet<Integer>> undirectedAdjacency(LabeledGraph graph, Set<Integer> edges) {
        Map<Integer, SortedSet<Integer>> adjacency = new HashMap<>();
        for (int edge : edges) {
            int source = graph.source(edge);
            int target = graph.target(edge);
            adjacency.computeIfAbsent(source, k -> new TreeSet<>()).add(target);
            adjacency.computeIfAbsent(target, k -> new TreeSet<>()).add(source);
        }
        return adjacency;
    }

    /** Numbers the components of the relation breadth first, in node id order. */
    private static Map<Integer, Integer> connectedComponents(LabeledGraph graph,
                                                             Map<Integer, SortedSet<Integer>> adjacency) {
        Map<Integer, Integer> partition = new TreeMap<>();
        int blockId = 0;
        for (int start : graph.nodeIds()) {
            if (partition.containsKey(start)) {
                continue;
            }
            Deque<Integer> frontier = new ArrayDeque<>();
            frontier.add(start);
            while (!frontier.isEmpty()) {
                int node = frontier.poll();
                if (partition.containsKey(node)) {
                    continue;
                }
                partition.put(node, blockId);
                frontier.addAll(adjacency.getOrDefault(node, Collections.emptySortedSet()));
            }
            ++blockId;
        }
        return partition;
    }
}
