package io.github.vishalmysore.loggraph.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstPrinter;
import io.github.vishalmysore.loggraph.ast.AstSerializer;
import io.github.vishalmysore.loggraph.ast.PrintConfig;
import io.github.vishalmysore.loggraph.ast.PrintOption;
import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;

import java.util.*;
import java.util.logging.Logger;

/**
 * Exports a labelled graph as a JSON document listing its declared types,
 * nodes and edges. Each label is given both as a readable string and as the
 * structured AST.
 */
public class JsonGraphExporter {
    private static final Logger log = Logger.getLogger(JsonGraphExporter.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Export the full graph as a JSON string, or "{}" if it cannot be written.
     */
    public String exportGraph(LabeledGraph graph) {
        try {
            return mapper.writeValueAsString(buildGraphDocument(graph));
        } catch (Exception e) {
            log.severe("Failed to export graph as JSON: " + e.getMessage());
            return "{}";
        }
    }

    Map<String, Object> buildGraphDocument(LabeledGraph graph) {
        Map<String, Object> doc = new LinkedHashMap<>();
        PrintConfig typeConfig = PrintConfig.of(PrintOption.NAME_AND_TYPE);

        Map<String, Object> types = new LinkedHashMap<>();
        types.put("graph", AstPrinter.toString(graph.getGraphType(), typeConfig));
        types.put("nodes", describeTypes(graph.getNodeTypes(), graph.getUniqueNodeTags(), typeConfig));
        types.put("edges", describeTypes(graph.getEdgeTypes(), graph.getUniqueEdgeTags(), typeConfig));
        doc.put("types", types);

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (int node : graph.nodeIds()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", node);
            putLabel(item, graph.getNodeLabel(node));
            nodes.add(item);
        }
        doc.put("nodes", nodes);

        List<Map<String, Object>> edges = new ArrayList<>();
        for (int edge : graph.edgeIds()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", edge);
            item.put("source", graph.source(edge));
            item.put("target", graph.target(edge));
            putLabel(item, graph.getEdgeLabel(edge));
            edges.add(item);
        }
        doc.put("edges", edges);

        doc.put("nodeCount", graph.numNodes());
        doc.put("edgeCount", graph.numEdges());
        return doc;
    }

    private List<Map<String, Object>> describeTypes(Map<String, Ast> types, Set<String> uniqueTags,
                                                    PrintConfig config) {
        List<Map<String, Object>> described = new ArrayList<>();
        for (Map.Entry<String, Ast> entry : types.entrySet()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("tag", entry.getKey());
            item.put("type", AstPrinter.toString(entry.getValue(), config));
            item.put("unique", uniqueTags.contains(entry.getKey()));
            described.add(item);
        }
        return described;
    }

    private void putLabel(Map<String, Object> item, TaggedAst label) {
        item.put("tag", label.getTag());
        item.put("text", AstPrinter.toString(label, PrintConfig.valueOnly()));
        if (label.hasAst()) {
            item.put("ast", AstSerializer.toTree(label.getAst()));
        }
    }
}
