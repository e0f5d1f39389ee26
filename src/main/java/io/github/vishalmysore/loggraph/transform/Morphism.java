package io.github.vishalmysore.loggraph.transform;

import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.graph.GraphType;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;

import java.util.*;
import java.util.logging.Logger;

/**
 * Records how the nodes and edges of an input graph correspond to those of an
 * output graph built from it.
 *
 * The morphism reads the input graph but does not own it. It owns the output
 * graph until {@link #takeOutput()} hands it to the caller. The node and edge
 * maps are partial: they only cover input objects that have been copied or
 * relabelled so far.
 */
public class Morphism {
    private static final Logger log = Logger.getLogger(Morphism.class.getName());

    private final LabeledGraph input;
    private LabeledGraph output;
    private Map<Integer, Integer> nodeMap = new TreeMap<>();
    private Map<Integer, SortedSet<Integer>> nodePreimage = new TreeMap<>();
    private Map<Integer, Integer> edgeMap = new TreeMap<>();

    /** Creates a morphism with no output graph. */
    public Morphism(LabeledGraph input) {
        this.input = input;
    }

    public boolean hasOutputGraph() {
        return output != null;
    }

    public LabeledGraph getInput() {
        return input;
    }

    public LabeledGraph getOutput() {
        Checks.check(output != null, "The morphism has no output graph.");
        return output;
    }

    /** Transfers the output graph to the caller and forgets the correspondence. */
    public LabeledGraph takeOutput() {
        LabeledGraph taken = output;
        output = null;
        nodeMap.clear();
        nodePreimage.clear();
        edgeMap.clear();
        return taken;
    }

    /**
     * Replaces the output with an empty graph typed like the input. The output
     * is left unset if the input's types cannot be installed.
     */
    public void copyInputType() {
        output = new LabeledGraph();
        Status status = output.initialize(GraphType.of(input));
        if (!status.isOk()) {
            log.warning("Cannot copy the type of the input graph: " + status.getMessage());
            output = null;
        }
    }

    /** The image of an input node, copying it with its own label if necessary. */
    public int findOrCopyNode(int inputNode) {
        return findOrMapNode(inputNode, input.getNodeLabel(inputNode));
    }

    /** The image of an input node, adding it with {@code label} if it has none yet. */
    public int findOrMapNode(int inputNode, TaggedAst label) {
        Integer mapped = nodeMap.get(inputNode);
        if (mapped != null) {
            return mapped;
        }
        int outputNode = getOutput().findOrAddNode(label);
        nodeMap.put(inputNode, outputNode);
        nodePreimage.computeIfAbsent(outputNode, k -> new TreeSet<>()).add(inputNode);
        return outputNode;
    }

    /** Copies an input edge, and its endpoints if necessary, with its own label. */
    public int findOrCopyEdge(int inputEdge) {
        return findOrMapEdge(inputEdge, input.getEdgeLabel(inputEdge));
    }

    public int findOrMapEdge(int inputEdge, TaggedAst label) {
        int source = findOrCopyNode(input.source(inputEdge));
        int target = findOrCopyNode(input.target(inputEdge));
        int outputEdge = getOutput().findOrAddEdge(source, target, label);
        edgeMap.put(inputEdge, outputEdge);
        return outputEdge;
    }

    public Map<Integer, Integer> getNodeMap() {
        return Collections.unmodifiableMap(nodeMap);
    }

    public Map<Integer, Integer> getEdgeMap() {
        return Collections.unmodifiableMap(edgeMap);
    }

    /** The input nodes mapped to {@code outputNode}. */
    public SortedSet<Integer> getNodePreimage(int outputNode) {
        SortedSet<Integer> preimage = nodePreimage.get(outputNode);
        return preimage == null ? new TreeSet<>() : Collections.unmodifiableSortedSet(preimage);
    }

    /**
     * Follows this morphism with {@code next}, whose input must be this
     * morphism's output. Afterwards this morphism maps its input to the output
     * of {@code next}, which is taken over from {@code next}.
     */
    public Status composeWith(Morphism next) {
        if (output == null || output != next.input) {
            log.warning("Trying to compose incompatible morphisms.");
            return Status.error("Trying to compose incompatible morphisms.");
        }
        nodeMap = compose(nodeMap, next.nodeMap);
        edgeMap = compose(edgeMap, next.edgeMap);
        nodePreimage = new TreeMap<>();
        nodeMap.forEach((from, to) -> nodePreimage.computeIfAbsent(to, k -> new TreeSet<>()).add(from));
        output = next.takeOutput();
        return Status.ok();
    }

    private static Map<Integer, Integer> compose(Map<Integer, Integer> first, Map<Integer, Integer> second) {
        Map<Integer, Integer> composed = new TreeMap<>();
        first.forEach((from, via) -> {
            Integer to = second.get(via);
            if (to != null) {
                composed.put(from, to);
            }
        });
        return composed;
    }
}
