package io.github.vishalmysore.loggraph.analyzers;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.export.DotPrinter;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.typing.Types;
import io.github.vishalmysore.loggraph.typing.Values;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;

import java.util.*;
import java.util.logging.Logger;

/**
 * A graph of which actors accessed which user accounts.
 *
 * Actors and users are unique nodes. An access record adds an edge from the
 * actor to the user labelled with the number of accesses; records repeating
 * the same actor, user and count add nothing new.
 */
public class AccountAccessGraph implements GraphInterface {
    private static final Logger log = Logger.getLogger(AccountAccessGraph.class.getName());

    // Input field names
    public static final String ACTOR_FIELD = "fromx";
    public static final String ACTOR_MANAGER_FIELD = "attr_actor_manager";
    public static final String ACTOR_TITLE_FIELD = "attr_actor_title";
    public static final String NUM_ACCESSES_FIELD = "attr_count";
    public static final String USER_FIELD = "tox";

    // Label tags
    public static final String ACTOR_TAG = "Actor";
    public static final String USER_TAG = "User";
    public static final String ACCESS_TAG = "Access";
    private static final String ACCESS_GRAPH_TAG = "Access Graph";
    private static final String COUNT = "Count";
    private static final String MANAGER = "Manager";
    private static final String TITLE = "Title";

    private static final String INITIALIZATION_ERR = "The graph is not initialized.";

    private final LabeledGraph graph = new LabeledGraph();
    private boolean initialized;

    @Override
    public Status initialize() {
        Map<String, Ast> nodeTypes = new TreeMap<>();
        nodeTypes.put(ACTOR_TAG, actorType());
        nodeTypes.put(USER_TAG, Types.makeString(USER_TAG, false));
        Map<String, Ast> edgeTypes = new TreeMap<>();
        edgeTypes.put(ACCESS_TAG, Types.makeInt(COUNT, false));

        Status status = graph.initialize(nodeTypes, Set.of(ACTOR_TAG, USER_TAG), edgeTypes,
                Set.of(ACCESS_TAG), Types.makeNull(ACCESS_GRAPH_TAG));
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

    public int numLabeledNodes(TaggedAst label) {
        checkInitialized();
        return graph.numLabeledNodes(label);
    }

    @Override
    public int numEdges() {
        checkInitialized();
        return graph.numEdges();
    }

    public int numLabeledEdges(TaggedAst label) {
        checkInitialized();
        return graph.numLabeledEdges(label);
    }

    /**
     * Adds the actor, user and access of one record.
     *
     * @param fieldIndex position of each named field in {@code fields}
     * @param fields     the values of one record
     * @return an error if the access count is not an integer
     */
    public Status processAccessData(Map<String, Integer> fieldIndex, List<String> fields) {
        checkInitialized();
        Checks.check(!fieldIndex.isEmpty(), "The map 'fieldIndex' is empty");
        Checks.check(!fields.isEmpty(), "The list 'fields' is empty");
        TaggedAst actor = makeActorLabel(fieldIndex, fields);
        TaggedAst user = new TaggedAst(USER_TAG, Values.makeString(getField(USER_FIELD, fieldIndex, fields)));
        String countStr = getField(NUM_ACCESSES_FIELD, fieldIndex, fields);
        long count;
        try {
            count = Long.parseLong(countStr.trim());
        } catch (NumberFormatException e) {
            log.warning("Skipping access record with count " + countStr);
            return Status.error("The field " + NUM_ACCESSES_FIELD + " is not an integer: " + countStr);
        }
        int actorId = graph.findOrAddNode(actor);
        int userId = graph.findOrAddNode(user);
        graph.findOrAddEdge(actorId, userId, new TaggedAst(ACCESS_TAG, Values.makeInt(count)));
        return Status.ok();
    }

    @Override
    public String toDot() {
        checkInitialized();
        return new DotPrinter().dotGraph(graph);
    }

    /** The underlying graph, for analysis and export. */
    public LabeledGraph getGraph() {
        checkInitialized();
        return graph;
    }

    public static TaggedAst actorLabel(String actor, String title, String manager) {
        Ast type = actorType();
        Ast tuple = Values.makeNullTuple(3);
        Values.setField(type, 0, Values.makeString(actor), tuple);
        Values.setField(type, 1, Values.makeString(title), tuple);
        Values.setField(type, 2, Values.makeString(manager), tuple);
        return new TaggedAst(ACTOR_TAG, tuple);
    }

    private static Ast actorType() {
        return Types.makeTuple(ACTOR_TAG, false, List.of(
                Types.makeString(ACTOR_TAG, false),
                Types.makeString(TITLE, true),
                Types.makeString(MANAGER, true)));
    }

    private TaggedAst makeActorLabel(Map<String, Integer> fieldIndex, List<String> fields) {
        return actorLabel(getField(ACTOR_FIELD, fieldIndex, fields),
                getField(ACTOR_TITLE_FIELD, fieldIndex, fields),
                getField(ACTOR_MANAGER_FIELD, fieldIndex, fields));
    }

    private static String getField(String fieldName, Map<String, Integer> fieldIndex, List<String> fields) {
        Integer index = fieldIndex.get(fieldName);
        Checks.check(index != null, "No field named " + fieldName + " in input.");
        Checks.check(index >= 0, "Index of " + fieldName + " is negative.");
        Checks.check(index < fields.size(), "Index of " + fieldName + " exceeds bounds.");
        return fields.get(index);
    }

    private void checkInitialized() {
        Checks.check(initialized, INITIALIZATION_ERR);
    }
}
