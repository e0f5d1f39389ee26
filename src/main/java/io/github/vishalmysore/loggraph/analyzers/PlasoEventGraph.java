package io.github.vishalmysore.loggraph.analyzers;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstTags;
import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.export.DotPrinter;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.typing.Types;
import io.github.vishalmysore.loggraph.typing.Values;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;
import io.github.vishalmysore.loggraph.util.TimeUtils;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * A graph of the events in a Plaso timeline and the files, URLs and IP
 * addresses they use.
 *
 * Every processed event is a new node, even if an identical event was seen
 * before. Files, URLs and IP addresses are unique nodes joined to their events
 * by "Uses" edges: a source points at the event, the event points at a target.
 *
 * Temporal "Precedes" edges only join events at consecutive timestamps, so
 * they are added once, after the last event.
 */
public class PlasoEventGraph implements GraphInterface {
    private static final Logger log = Logger.getLogger(PlasoEventGraph.class.getName());

    public static final String EVENT_TAG = "Event";
    public static final String DESCRIPTION_TAG = "Description";
    public static final String SYSTEM_TAG = "System";

    private static final String INITIALIZATION_ERR = "The graph is not initialized.";
    private static final String TEMPORAL_EDGES_ERR =
            "addTemporalEdges() can be called at most once. Events cannot be added after it is called.";

    private final LabeledGraph graph = new LabeledGraph();
    // Event nodes by timestamp, earliest first.
    private final SortedMap<Long, SortedSet<Integer>> timeIndex = new TreeMap<>();
    private boolean initialized;
    private boolean hasTemporalEdges;

    @Override
    public Status initialize() {
        Map<String, Ast> nodeTypes = new TreeMap<>();
        nodeTypes.put(EVENT_TAG, eventType());
        nodeTypes.put(AstTags.FILE, Types.makeFile());
        nodeTypes.put(AstTags.IP_ADDRESS, Types.makeIpAddress());
        nodeTypes.put(AstTags.URL, Types.makeUrl());
        Map<String, Ast> edgeTypes = new TreeMap<>();
        edgeTypes.put(AstTags.PRECEDES, Types.makeNull(AstTags.PRECEDES));
        edgeTypes.put(AstTags.USES, Types.makeNull(AstTags.USES));

        Status status = graph.initialize(nodeTypes, Set.of(AstTags.FILE, AstTags.IP_ADDRESS, AstTags.URL),
                edgeTypes, Set.of(AstTags.PRECEDES, AstTags.USES), Types.makeString(SYSTEM_TAG, false));
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

    public String getStats() {
        return "Number of Nodes : " + numNodes() + "\n" + "Number of Edges : " + numEdges() + "\n";
    }

    /** Names the system the timeline was taken from. */
    public void setSystem(String system) {
        checkInitialized();
        graph.setGraphLabel(Values.makeString(system));
    }

    /** Adds a node for the event and links it to the resources it names. */
    public int processEvent(PlasoEvent event) {
        checkInitialized();
        Checks.check(!hasTemporalEdges, TEMPORAL_EDGES_ERR);
        Ast timestamp = event.getTimestamp() != null
                ? Values.makeTimestampFromUnixMicros(event.getTimestamp())
                : Values.makeTimestampFromRfc3339("");
        Ast description = Values.makeString(event.getDescription() == null ? "" : event.getDescription());
        int eventId = graph.findOrAddNode(eventLabel(timestamp, description));
        if (event.getTimestamp() != null) {
            timeIndex.computeIfAbsent(event.getTimestamp(), k -> new TreeSet<>()).add(eventId);
        }
        addEventData(eventId, event);
        return eventId;
    }

    /**
     * Joins every event to each event at the next later timestamp. Events at
     * the same time are not joined.
     */
    public void addTemporalEdges() {
        checkInitialized();
        Checks.check(!hasTemporalEdges, TEMPORAL_EDGES_ERR);
        hasTemporalEdges = true;
        TaggedAst precedes = new TaggedAst(AstTags.PRECEDES, Values.makeNull());
        int numAdded = 0;
        SortedSet<Integer> current = null;
        for (SortedSet<Integer> next : timeIndex.values()) {
            if (current != null) {
                for (int from : current) {
                    for (int to : next) {
                        graph.findOrAddEdge(from, to, precedes);
                        ++numAdded;
                    }
                }
            }
            current = next;
        }
        log.info("Added " + numAdded + " temporal edges over " + timeIndex.size() + " timestamps");
    }

    /**
     * The graph in DOT format, with a timeline of the event timestamps drawn
     * beside it.
     */
    @Override
    public String toDot() {
        checkInitialized();
        DotPrinter printer = new DotPrinter();
        return "digraph plaso_events {\n" + printer.allNodesInDot(graph) + timeline() + "\n"
                + printer.allEdgesInDot(graph) + "\n}";
    }

    public LabeledGraph getGraph() {
        checkInitialized();
        return graph;
    }

    /**
     * A file value from a slash separated path. The last component is the
     * filename unless the path ends with a slash.
     */
    public static Ast parseFilename(String path) {
        List<String> parts = new ArrayList<>(Arrays.asList(path.split("/", -1)));
        String filename = parts.remove(parts.size() - 1);
        return Values.makeFile(parts, filename.isEmpty() ? null : filename);
    }

    private static Ast eventType() {
        return Types.makeTuple(EVENT_TAG, false, List.of(
                Types.makeTimestamp(AstTags.TIME, true),
                Types.makeString(DESCRIPTION_TAG, true)));
    }

    private TaggedAst eventLabel(Ast timestamp, Ast description) {
        Ast type = graph.getNodeType(EVENT_TAG).orElseThrow();
        Ast tuple = Values.makeNullTuple(2);
        Values.setField(type, 0, timestamp, tuple);
        Values.setField(type, 1, description, tuple);
        return new TaggedAst(EVENT_TAG, tuple);
    }

    private void addEventData(int eventId, PlasoEvent event) {
        if (event.getSourceFile() != null) {
            addResource(eventId, new TaggedAst(AstTags.FILE, parseFilename(event.getSourceFile())), true);
        }
        if (event.getTargetFile() != null) {
            addResource(eventId, new TaggedAst(AstTags.FILE, parseFilename(event.getTargetFile())), false);
        }
        if (event.getSourceUrl() != null) {
            addResource(eventId, new TaggedAst(AstTags.URL, Values.makeUrl(event.getSourceUrl())), true);
        }
        if (event.getTargetUrl() != null) {
            addResource(eventId, new TaggedAst(AstTags.URL, Values.makeUrl(event.getTargetUrl())), false);
        }
        if (event.getSourceIp() != null) {
            addResource(eventId, new TaggedAst(AstTags.IP_ADDRESS, Values.makeIpAddress(event.getSourceIp())), true);
        }
        if (event.getTargetIp() != null) {
            addResource(eventId, new TaggedAst(AstTags.IP_ADDRESS, Values.makeIpAddress(event.getTargetIp())), false);
        }
    }

    private void addResource(int eventId, TaggedAst resource, boolean isSource) {
        Checks.check(graph.isUniqueNodeTag(resource.getTag()), "Resources must have unique labels: " + resource.getTag());
        int resourceId = graph.findOrAddNode(resource);
        TaggedAst uses = new TaggedAst(AstTags.USES, Values.makeNull());
        if (isSource) {
            graph.findOrAddEdge(resourceId, eventId, uses);
        } else {
            graph.findOrAddEdge(eventId, resourceId, uses);
        }
    }

    // A vertical line of timestamps, earliest at the top, with each event at
    // the level of its timestamp.
    private String timeline() {
        if (timeIndex.isEmpty()) {
            return "";
        }
        StringBuilder timeline = new StringBuilder("// Sub-graph showing timeline\n{\n");
        List<String> timestamps = new ArrayList<>();
        StringBuilder aligned = new StringBuilder();
        for (Map.Entry<Long, SortedSet<Integer>> entry : timeIndex.entrySet()) {
            String name = "T" + entry.getKey();
            timeline.append("  ").append(name).append(" [shape=plaintext, label=\"")
                    .append(TimeUtils.unixMicrosToRfc3339(entry.getKey())).append("\"];\n");
            timestamps.add(name);
            aligned.append("  {rank=same; ").append(name).append("; ")
                    .append(entry.getValue().stream().map(String::valueOf).collect(Collectors.joining("; ")))
                    .append("}\n");
        }
        timeline.append("  ").append(String.join(" -> ", timestamps)).append(";\n");
        timeline.append(aligned);
        timeline.append("}  // subgraph for timeline\n");
        return timeline.toString();
    }

    private void checkInitialized() {
        Checks.check(initialized, INITIALIZATION_ERR);
    }
}
