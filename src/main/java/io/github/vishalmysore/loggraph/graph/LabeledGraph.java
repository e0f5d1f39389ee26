package io.github.vishalmysore.loggraph.graph;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstPrinter;
import io.github.vishalmysore.loggraph.ast.AstSerializer;
import io.github.vishalmysore.loggraph.ast.PrintConfig;
import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.typing.TypeChecker;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.*;
import java.util.logging.Logger;

/**
 * A directed multigraph whose nodes and edges carry typed labels.
 *
 * Every label is a {@link TaggedAst}; its tag selects a declared type and the
 * label must conform to that type. Nodes and edges are identified by dense
 * integer ids allocated in insertion order. For every declared tag the graph
 * keeps an index from the serialized label to the ids carrying it:
 * <ul>
 *   <li>Labels with a unique tag identify at most one node, or at most one
 *   edge per (source, target) pair. Adding such a label again returns the
 *   existing id.</li>
 *   <li>Labels with any other tag are added every time and indexed as a set
 *   of ids.</li>
 * </ul>
 * Deduplication compares serializations, so labels that are isomorphic but
 * not identical, such as sets in different orders, are distinct unless they
 * are canonicalized first.
 *
 * A graph must be initialized exactly once before use. Using an uninitialized
 * graph or an invalid id fails with an {@link IllegalStateException}.
 */
public class LabeledGraph {
    private static final Logger log = Logger.getLogger(LabeledGraph.class.getName());

    private static final String INITIALIZATION_ERR = "The graph is not initialized.";
    private static final String INVALID_NODE_ERR = "Invalid node id: ";
    private static final String INVALID_EDGE_ERR = "Invalid edge id: ";
    private static final String INVALID_INDEX_TAG_ERR = "There is no index for labels tagged ";

    private boolean initialized;
    private final Map<String, Ast> nodeTypes = new TreeMap<>();
    private final Map<String, Ast> edgeTypes = new TreeMap<>();
    private Ast graphType = new Ast();
    private Ast graphLabel = new Ast();

    // Storage
    private final List<TaggedAst> nodes = new ArrayList<>();
    private final List<List<Integer>> outEdges = new ArrayList<>();
    private final List<List<Integer>> inEdges = new ArrayList<>();
    private final List<EdgeRecord> edges = new ArrayList<>();

    // Indexes, keyed by tag
    private final Map<String, Map<String, Integer>> uniqueNodeIndexes = new TreeMap<>();
    private final Map<String, Map<String, SortedSet<Integer>>> nodeIndexes = new TreeMap<>();
    private final Map<String, Map<EdgeKey, Integer>> uniqueEdgeIndexes = new TreeMap<>();
    private final Map<String, Map<String, SortedSet<Integer>>> edgeIndexes = new TreeMap<>();

    @AllArgsConstructor
    private static class EdgeRecord {
        final int source;
        final int target;
        TaggedAst label;
    }

    @Value
    private static class EdgeKey {
        int source;
        int target;
        String label;
    }

    public Status initialize(GraphType type) {
        return initialize(type.getNodeTypes(), type.getUniqueNodeTags(), type.getEdgeTypes(),
                type.getUniqueEdgeTags(), type.getGraphType());
    }

    /**
     * Installs the type declarations of the graph. Fails without changing the
     * graph if a declared type is malformed or a unique tag has no type.
     */
    public Status initialize(Map<String, Ast> nodeTypes, Set<String> uniqueNodeTags,
                             Map<String, Ast> edgeTypes, Set<String> uniqueEdgeTags, Ast graphType) {
        Checks.check(!initialized, "The graph is already initialized.");
        Status status = TypeChecker.areTypes(nodeTypes);
        if (!status.isOk()) {
            return failure("Type error in node_types:" + status.getMessage());
        }
        status = TypeChecker.areTypes(edgeTypes);
        if (!status.isOk()) {
            return failure("Type error in edge_types:" + status.getMessage());
        }
        Ast graphTypeAst = graphType == null ? new Ast() : graphType;
        status = TypeChecker.isType(graphTypeAst);
        if (!status.isOk()) {
            return failure("Type error in graph_type:" + status.getMessage());
        }
        for (String tag : uniqueNodeTags) {
            if (!nodeTypes.containsKey(tag)) {
                return failure("The unique node tag " + tag + " has no declared type.");
            }
        }
        for (String tag : uniqueEdgeTags) {
            if (!edgeTypes.containsKey(tag)) {
                return failure("The unique edge tag " + tag + " has no declared type.");
            }
        }

        nodeTypes.forEach((tag, type) -> this.nodeTypes.put(tag, type.copy()));
        edgeTypes.forEach((tag, type) -> this.edgeTypes.put(tag, type.copy()));
        this.graphType = graphTypeAst.copy();
        for (String tag : this.nodeTypes.keySet()) {
            if (uniqueNodeTags.contains(tag)) {
                uniqueNodeIndexes.put(tag, new HashMap<>());
            } else {
                nodeIndexes.put(tag, new HashMap<>());
            }
        }
        for (String tag : this.edgeTypes.keySet()) {
            if (uniqueEdgeTags.contains(tag)) {
                uniqueEdgeIndexes.put(tag, new HashMap<>());
            } else {
                edgeIndexes.put(tag, new HashMap<>());
            }
        }
        initialized = true;
        log.info("LabeledGraph initialized with " + this.nodeTypes.size() + " node types and "
                + this.edgeTypes.size() + " edge types");
        return Status.ok();
    }

    public boolean isInitialized() {
        return initialized;
    }

    // Declarations

    public Map<String, Ast> getNodeTypes() {
        checkInitialized();
        return copyTypes(nodeTypes);
    }

    public Set<String> getUniqueNodeTags() {
        checkInitialized();
        return new TreeSet<>(uniqueNodeIndexes.keySet());
    }

    public Optional<Ast> getNodeType(String tag) {
        checkInitialized();
        return Optional.ofNullable(nodeTypes.get(tag)).map(Ast::copy);
    }

    public Map<String, Ast> getEdgeTypes() {
        checkInitialized();
        return copyTypes(edgeTypes);
    }

    public Set<String> getUniqueEdgeTags() {
        checkInitialized();
        return new TreeSet<>(uniqueEdgeIndexes.keySet());
    }

    public Optional<Ast> getEdgeType(String tag) {
        checkInitialized();
        return Optional.ofNullable(edgeTypes.get(tag)).map(Ast::copy);
    }

    public Ast getGraphType() {
        checkInitialized();
        return graphType.copy();
    }

    public Ast getGraphLabel() {
        checkInitialized();
        return graphLabel.copy();
    }

    public void setGraphLabel(Ast label) {
        checkInitialized();
        Checks.checkOk(TypeChecker.isTyped(graphType, label));
        graphLabel = label.copy();
    }

    public boolean isUniqueNodeTag(String tag) {
        checkInitialized();
        return uniqueNodeIndexes.containsKey(tag);
    }

    public boolean isUniqueEdgeTag(String tag) {
        checkInitialized();
        return uniqueEdgeIndexes.containsKey(tag);
    }

    // Insertion and update

    /**
     * Returns the node with this label if the tag is unique and such a node
     * exists, and otherwise adds a new node. The label must conform to the
     * type declared for its tag.
     */
    public int findOrAddNode(TaggedAst label) {
        checkInitialized();
        Checks.checkOk(TypeChecker.isTyped(nodeTypes, label));
        Map<String, Integer> uniqueIndex = uniqueNodeIndexes.get(label.getTag());
        if (uniqueIndex == null) {
            int nodeId = insertNode(label);
            indexObject(label, nodeId, nodeIndexes);
            return nodeId;
        }
        return uniqueIndex.computeIfAbsent(serialize(label), key -> insertNode(label));
    }

    /**
     * Returns the edge from {@code source} to {@code target} with this label if
     * the tag is unique and such an edge exists, and otherwise adds a new edge.
     */
    public int findOrAddEdge(int source, int target, TaggedAst label) {
        checkInitialized();
        checkNode(source);
        checkNode(target);
        Checks.checkOk(TypeChecker.isTyped(edgeTypes, label));
        Map<EdgeKey, Integer> uniqueIndex = uniqueEdgeIndexes.get(label.getTag());
        if (uniqueIndex == null) {
            int edgeId = insertEdge(source, target, label);
            indexObject(label, edgeId, edgeIndexes);
            return edgeId;
        }
        EdgeKey key = new EdgeKey(source, target, serialize(label));
        return uniqueIndex.computeIfAbsent(key, k -> insertEdge(source, target, label));
    }

    /**
     * Replaces the label of a node and moves it between indexes. Fails without
     * changing the graph if the label is ill typed, the id is invalid, or a
     * different node already has the label under a unique tag.
     */
    public Status updateNodeLabel(int nodeId, TaggedAst label) {
        checkInitialized();
        Status status = TypeChecker.isTyped(nodeTypes, label);
        if (!status.isOk()) {
            return failure(status.getMessage());
        }
        if (!hasNode(nodeId)) {
            return failure(INVALID_NODE_ERR + nodeId);
        }
        Map<String, Integer> uniqueIndex = uniqueNodeIndexes.get(label.getTag());
        String key = serialize(label);
        if (uniqueIndex != null && uniqueIndex.containsKey(key) && uniqueIndex.get(key) != nodeId) {
            return failure("A node with label " + AstPrinter.toString(label, PrintConfig.valueOnly())
                    + " already exists.");
        }
        TaggedAst oldLabel = nodes.get(nodeId);
        Map<String, Integer> oldUniqueIndex = uniqueNodeIndexes.get(oldLabel.getTag());
        if (oldUniqueIndex != null) {
            oldUniqueIndex.remove(serialize(oldLabel));
        } else {
            deindexObject(oldLabel, nodeId, nodeIndexes);
        }
        nodes.set(nodeId, label.copy());
        if (uniqueIndex != null) {
            uniqueIndex.put(key, nodeId);
        } else {
            indexObject(label, nodeId, nodeIndexes);
        }
        return Status.ok();
    }

    /**
     * Replaces the label of an edge. Fails without changing the graph if the
     * label is ill typed, the id is invalid, or a different edge between the
     * same endpoints already has the label under a unique tag.
     */
    public Status updateEdgeLabel(int edgeId, TaggedAst label) {
        checkInitialized();
        Status status = TypeChecker.isTyped(edgeTypes, label);
        if (!status.isOk()) {
            return failure(status.getMessage());
        }
        if (!hasEdge(edgeId)) {
            return failure(INVALID_EDGE_ERR + edgeId);
        }
        EdgeRecord edge = edges.get(edgeId);
        Map<EdgeKey, Integer> uniqueIndex = uniqueEdgeIndexes.get(label.getTag());
        EdgeKey key = new EdgeKey(edge.source, edge.target, serialize(label));
        if (uniqueIndex != null && uniqueIndex.containsKey(key) && uniqueIndex.get(key) != edgeId) {
            return failure("Unique edge label exists.");
        }
        Map<EdgeKey, Integer> oldUniqueIndex = uniqueEdgeIndexes.get(edge.label.getTag());
        if (oldUniqueIndex != null) {
            oldUniqueIndex.remove(new EdgeKey(edge.source, edge.target, serialize(edge.label)));
        } else {
            deindexObject(edge.label, edgeId, edgeIndexes);
        }
        edge.label = label.copy();
        if (uniqueIndex != null) {
            uniqueIndex.put(key, edgeId);
        } else {
            indexObject(label, edgeId, edgeIndexes);
        }
        return Status.ok();
    }

    // Nodes and edges

    public boolean hasNode(int nodeId) {
        checkInitialized();
        return nodeId >= 0 && nodeId < nodes.size();
    }

    public boolean hasEdge(int edgeId) {
        checkInitialized();
        return edgeId >= 0 && edgeId < edges.size();
    }

    public TaggedAst getNodeLabel(int nodeId) {
        checkNode(nodeId);
        return nodes.get(nodeId).copy();
    }

    public TaggedAst getEdgeLabel(int edgeId) {
        checkEdge(edgeId);
        return edges.get(edgeId).label.copy();
    }

    public int source(int edgeId) {
        checkEdge(edgeId);
        return edges.get(edgeId).source;
    }

    public int target(int edgeId) {
        checkEdge(edgeId);
        return edges.get(edgeId).target;
    }

    /** All node ids in increasing order. */
    public List<Integer> nodeIds() {
        checkInitialized();
        return range(nodes.size());
    }

    /** All edge ids in increasing order. */
    public List<Integer> edgeIds() {
        checkInitialized();
        return range(edges.size());
    }

    public List<Integer> getInEdges(int nodeId) {
        checkNode(nodeId);
        return Collections.unmodifiableList(inEdges.get(nodeId));
    }

    public List<Integer> getOutEdges(int nodeId) {
        checkNode(nodeId);
        return Collections.unmodifiableList(outEdges.get(nodeId));
    }

    public SortedSet<Integer> getPredecessors(int nodeId) {
        checkNode(nodeId);
        SortedSet<Integer> predecessors = new TreeSet<>();
        for (int edgeId : inEdges.get(nodeId)) {
            predecessors.add(edges.get(edgeId).source);
        }
        return predecessors;
    }

    public SortedSet<Integer> getSuccessors(int nodeId) {
        checkNode(nodeId);
        SortedSet<Integer> successors = new TreeSet<>();
        for (int edgeId : outEdges.get(nodeId)) {
            successors.add(edges.get(edgeId).target);
        }
        return successors;
    }

    // Label queries

    /** The nodes carrying exactly this label. */
    public SortedSet<Integer> getNodes(TaggedAst label) {
        checkInitialized();
        Map<String, Integer> uniqueIndex = uniqueNodeIndexes.get(label.getTag());
        if (uniqueIndex == null) {
            return labeledObjects(label, nodeIndexes);
        }
        SortedSet<Integer> found = new TreeSet<>();
        Integer nodeId = uniqueIndex.get(serialize(label));
        if (nodeId != null) {
            found.add(nodeId);
        }
        return found;
    }

    /** The edges carrying exactly this label, between any endpoints. */
    public SortedSet<Integer> getEdges(TaggedAst label) {
        checkInitialized();
        Map<EdgeKey, Integer> uniqueIndex = uniqueEdgeIndexes.get(label.getTag());
        if (uniqueIndex == null) {
            return labeledObjects(label, edgeIndexes);
        }
        String name = serialize(label);
        SortedSet<Integer> found = new TreeSet<>();
        for (Map.Entry<EdgeKey, Integer> entry : uniqueIndex.entrySet()) {
            if (entry.getKey().getLabel().equals(name)) {
                found.add(entry.getValue());
            }
        }
        return found;
    }

    public SortedSet<Integer> getLabelPredecessors(TaggedAst label) {
        SortedSet<Integer> predecessors = new TreeSet<>();
        for (int nodeId : getNodes(label)) {
            predecessors.addAll(getPredecessors(nodeId));
        }
        return predecessors;
    }

    public SortedSet<Integer> getLabelSuccessors(TaggedAst label) {
        SortedSet<Integer> successors = new TreeSet<>();
        for (int nodeId : getNodes(label)) {
            successors.addAll(getSuccessors(nodeId));
        }
        return successors;
    }

    // Counts

    public int numNodeTypes() {
        checkInitialized();
        return nodeTypes.size();
    }

    public int numUniqueNodeTypes() {
        checkInitialized();
        return uniqueNodeIndexes.size();
    }

    public int numNodes() {
        checkInitialized();
        return nodes.size();
    }

    public int numLabeledNodes(TaggedAst label) {
        return getNodes(label).size();
    }

    public int numEdgeTypes() {
        checkInitialized();
        return edgeTypes.size();
    }

    public int numUniqueEdgeTypes() {
        checkInitialized();
        return uniqueEdgeIndexes.size();
    }

    public int numEdges() {
        checkInitialized();
        return edges.size();
    }

    public int numLabeledEdges(TaggedAst label) {
        return getEdges(label).size();
    }

    // Internals

    private int insertNode(TaggedAst label) {
        nodes.add(label.copy());
        outEdges.add(new ArrayList<>());
        inEdges.add(new ArrayList<>());
        return nodes.size() - 1;
    }

    private int insertEdge(int source, int target, TaggedAst label) {
        int edgeId = edges.size();
        edges.add(new EdgeRecord(source, target, label.copy()));
        outEdges.get(source).add(edgeId);
        inEdges.get(target).add(edgeId);
        return edgeId;
    }

    private static String serialize(TaggedAst label) {
        return AstSerializer.serialize(label.getAst());
    }

    private static void indexObject(TaggedAst label, int id, Map<String, Map<String, SortedSet<Integer>>> indexes) {
        Map<String, SortedSet<Integer>> index = indexes.get(label.getTag());
        Checks.check(index != null, INVALID_INDEX_TAG_ERR + label.getTag() + ".");
        index.computeIfAbsent(serialize(label), key -> new TreeSet<>()).add(id);
    }

    private static void deindexObject(TaggedAst label, int id, Map<String, Map<String, SortedSet<Integer>>> indexes) {
        Map<String, SortedSet<Integer>> index = indexes.get(label.getTag());
        Checks.check(index != null, INVALID_INDEX_TAG_ERR + label.getTag() + ".");
        String key = serialize(label);
        SortedSet<Integer> ids = index.get(key);
        if (ids != null) {
            ids.remove(id);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private static SortedSet<Integer> labeledObjects(TaggedAst label,
                                                     Map<String, Map<String, SortedSet<Integer>>> indexes) {
        Map<String, SortedSet<Integer>> index = indexes.get(label.getTag());
        if (index == null) {
            return new TreeSet<>();
        }
        SortedSet<Integer> ids = index.get(serialize(label));
        return ids == null ? new TreeSet<>() : new TreeSet<>(ids);
    }

    private static Map<String, Ast> copyTypes(Map<String, Ast> types) {
        Map<String, Ast> copy = new TreeMap<>();
        types.forEach((tag, type) -> copy.put(tag, type.copy()));
        return copy;
    }

    private static List<Integer> range(int size) {
        List<Integer> ids = new ArrayList<>(size);
        for (int i = 0; i < size; ++i) {
            ids.add(i);
        }
        return ids;
    }

    private Status failure(String message) {
        log.warning(message);
        return Status.error(message);
    }

    private void checkInitialized() {
        Checks.check(initialized, INITIALIZATION_ERR);
    }

    private void checkNode(int nodeId) {
        Checks.check(hasNode(nodeId), INVALID_NODE_ERR + nodeId);
    }

    private void checkEdge(int edgeId) {
        Checks.check(hasEdge(edgeId), INVALID_EDGE_ERR + edgeId);
    }
}
