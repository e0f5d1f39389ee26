package io.github.vishalmysore.loggraph.analyzers;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.export.AttributeFn;
import io.github.vishalmysore.loggraph.export.DotPrinter;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.typing.Types;
import io.github.vishalmysore.loggraph.typing.Values;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A graph of dependencies between data streams. Each stream is a unique node
 * identified by its id and name; a consumer has at most one edge to each
 * producer it depends on.
 */
public class StreamDependencyGraph implements GraphInterface {
    public static final String STREAM_TAG = "Stream";
    public static final String STREAM_ID_TAG = "Stream Id";
    public static final String STREAM_NAME_TAG = "Stream Name";
    public static final String DEPENDENT_TAG = "Dependent";

    private static final String INITIALIZATION_ERR = "The graph is not initialized.";

    private final LabeledGraph graph = new LabeledGraph();
    private boolean initialized;

    @Override
    public Status initialize() {
        Ast streamType = Types.makeTuple(STREAM_TAG, false, List.of(
                Types.makeString(STREAM_ID_TAG, false),
                Types.makeString(STREAM_NAME_TAG, true)));
        Status status = graph.initialize(Map.of(STREAM_TAG, streamType), Set.of(STREAM_TAG),
                Map.of(DEPENDENT_TAG, Types.makeNull(DEPENDENT_TAG)), Set.of(DEPENDENT_TAG),
                Types.makeNull(STREAM_TAG));
        if (status.isOk()) {
            initialized = true;
        }
        return status;
    }

    @Override
    public int numNodes() {
        checkInitialized();
        return graph.numNodes();
    }

    @Override
    public int numEdges() {
        checkInitialized();
        return graph.numEdges();
    }

    /** Records that the consumer stream depends on the producer stream. */
    public void addDependency(String consumerId, String consumerName, String producerId, String producerName) {
        checkInitialized();
        Ast type = graph.getNodeType(STREAM_TAG).orElseThrow();
        int consumer = graph.findOrAddNode(streamLabel(type, consumerId, consumerName));
        int producer = graph.findOrAddNode(streamLabel(type, producerId, producerName));
        graph.findOrAddEdge(consumer, producer, new TaggedAst(DEPENDENT_TAG, Values.makeNull()));
    }

    /** Streams are drawn with their names only. */
    @Override
    public String toDot() {
        checkInitialized();
        AttributeFn nodeAttribute = (tag, ast) -> DotPrinter.nodeAttribute(tag, ast.getComposite().arg(1));
        DotPrinter printer = new DotPrinter(nodeAttribute, DotPrinter::edgeAttribute, "stream_dependencies");
        return printer.dotGraph(graph);
    }

    public LabeledGraph getGraph() {
        checkInitialized();
        return graph;
    }

    private static TaggedAst streamLabel(Ast type, String id, String name) {
        Ast tuple = Values.makeNullTuple(2);
        Values.setField(type, 0, Values.makeString(id), tuple);
        Values.setField(type, 1, Values.makeString(name), tuple);
        return new TaggedAst(STREAM_TAG, tuple);
    }

    private void checkInitialized() {
        Checks.check(initialized, INITIALIZATION_ERR);
    }
}
