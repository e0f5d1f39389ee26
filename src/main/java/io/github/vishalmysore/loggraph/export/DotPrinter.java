package io.github.vishalmysore.loggraph.export;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstPrinter;
import io.github.vishalmysore.loggraph.ast.AstTags;
import io.github.vishalmysore.loggraph.ast.PrintOption;
import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.typing.TypeChecker;
import io.github.vishalmysore.loggraph.typing.Types;
import io.github.vishalmysore.loggraph.typing.Values;
import io.github.vishalmysore.loggraph.util.Checks;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link LabeledGraph} in the DOT language of Graphviz.
 *
 * Node and edge attributes come from injected {@link AttributeFn} strategies.
 * The defaults give files, IP addresses and URLs their own shapes and print
 * any other label as an HTML-like table of its values.
 */
public class DotPrinter {
    private static final String TABLE_HEADER =
            "<table border=\"0\"  cellborder=\"0\" cellpadding=\"1\" bgcolor=\"#F8F8F8\">";

    private static final String FILENAME_STYLE =
            "shape=folder,style=filled,fillcolor=wheat,fontname=Courier,fontsize=10";
    private static final String REMOTE_ADDRESS_STYLE =
            "shape=component,style=filled,fillcolor=lightsteelblue,fontname=Arial,fontsize=10";
    private static final String ROUNDED_BOX_STYLE = "shape=box,style=\"rounded,filled\",fillcolor=\"#F8F8F8\"";

    private static final String SOLID_GRAY_EDGE = "penwidth=.5,arrowsize=.5,arrowhead=onormal,color=gray";
    private static final String DASHED_GRAY_EDGE =
            "penwidth=.5,arrowsize=.5,arrowhead=onormal,color=gray,style=dashed";
    private static final String PRECEDES_STYLE = "style=invis";

    private static final String DEFAULT_GRAPH_NAME = "loggraph";
    private static final String INDENT = "  ";

    private final AttributeFn nodeAttribute;
    private final AttributeFn edgeAttribute;
    private final String graphName;

    public DotPrinter() {
        this(DotPrinter::nodeAttribute, DotPrinter::edgeAttribute);
    }

    public DotPrinter(AttributeFn nodeAttribute, AttributeFn edgeAttribute) {
        this(nodeAttribute, edgeAttribute, DEFAULT_GRAPH_NAME);
    }

    public DotPrinter(AttributeFn nodeAttribute, AttributeFn edgeAttribute, String graphName) {
        this.nodeAttribute = nodeAttribute;
        this.edgeAttribute = edgeAttribute;
        this.graphName = graphName;
    }

    /** A file drawn as a folder, one path component per line. */
    public static String fileAttribute(Ast ast) {
        Checks.checkOk(TypeChecker.isTyped(Types.makeFile(), ast));
        if (!ast.isComposite() || ast.getComposite().size() != 2) {
            return joinAttributes(FILENAME_STYLE, "", false);
        }
        List<Ast> path = ast.getComposite().arg(0).args();
        StringBuilder filename = new StringBuilder(path.isEmpty() ? "" : Values.getString(path.get(0)));
        for (int i = 1; i < path.size(); ++i) {
            filename.append("/\\l").append(" ".repeat(2 * i)).append("↳")
                    .append(Values.getString(path.get(i)));
        }
        Ast filenameAst = ast.getComposite().arg(1);
        if (filenameAst.isPrimitive() && filenameAst.getPrimitive().hasValue()) {
            filename.append("/\\l").append(" ".repeat(2 * path.size())).append("↳")
                    .append(Values.getString(filenameAst));
        }
        return joinAttributes(FILENAME_STYLE, filename.toString(), false);
    }

    public static String ipAddressAttribute(Ast ast) {
        Checks.checkOk(TypeChecker.isTyped(Types.makeIpAddress(), ast));
        return joinAttributes(REMOTE_ADDRESS_STYLE, Values.getString(ast), false);
    }

    public static String urlAttribute(Ast ast) {
        Checks.checkOk(TypeChecker.isTyped(Types.makeUrl(), ast));
        return joinAttributes(REMOTE_ADDRESS_STYLE, Values.getString(ast), false);
    }

    public static String nodeAttribute(String tag, Ast ast) {
        if (AstTags.FILE.equals(tag)) {
            return fileAttribute(ast);
        }
        if (AstTags.IP_ADDRESS.equals(tag)) {
            return ipAddressAttribute(ast);
        }
        if (AstTags.URL.equals(tag)) {
            return urlAttribute(ast);
        }
        return joinAttributes(ROUNDED_BOX_STYLE, toDotIndent(ast, 0), true);
    }

    public static String edgeAttribute(String tag, Ast ast) {
        if (AstTags.PRECEDES.equals(tag)) {
            return joinAttributes(PRECEDES_STYLE, "", false);
        }
        if (ast.isNull()) {
            return joinAttributes(DASHED_GRAY_EDGE, "", false);
        }
        return joinAttributes(DASHED_GRAY_EDGE, toDotIndent(ast, 0), true);
    }

    /** A node declaration terminated by a semicolon but not a newline. */
    public String dotNode(int nodeId, TaggedAst label) {
        String attr = label.hasAst()
                ? nodeAttribute.attributes(label.getTag(), label.getAst())
                : joinAttributes(ROUNDED_BOX_STYLE, label.getTag(), false);
        return nodeId + " " + attr + ";";
    }

    public String dotEdge(int sourceId, int targetId, TaggedAst label) {
        String attr = label.hasAst()
                ? edgeAttribute.attributes(label.getTag(), label.getAst())
                : joinAttributes(SOLID_GRAY_EDGE, "", false);
        return sourceId + " -> " + targetId + " " + attr + ";";
    }

    public String allNodesInDot(LabeledGraph graph) {
        StringBuilder dot = new StringBuilder();
        for (int node : graph.nodeIds()) {
            dot.append(INDENT).append(dotNode(node, graph.getNodeLabel(node))).append("\n");
        }
        return dot.toString();
    }

    public String allEdgesInDot(LabeledGraph graph) {
        StringBuilder dot = new StringBuilder();
        for (int edge : graph.edgeIds()) {
            dot.append(INDENT)
                    .append(dotEdge(graph.source(edge), graph.target(edge), graph.getEdgeLabel(edge)))
                    .append("\n");
        }
        return dot.toString();
    }

    /** The whole graph, without a trailing newline. */
    public String dotGraph(LabeledGraph graph) {
        return "digraph " + graphName + " {\n" + allNodesInDot(graph) + allEdgesInDot(graph) + "}";
    }

    private static String joinAttributes(String style, String label, boolean htmlLike) {
        String quotedLabel = htmlLike ? "label=<" + label + ">" : "label=\"" + label + "\"";
        return "[" + style + ", " + quotedLabel + "]";
    }

    private static String toDotIndent(Ast ast, int indent) {
        if (ast.isPrimitive()) {
            String label = escape(AstPrinter.toStringRoot(ast, PrintOption.VALUE));
            return " ".repeat(indent) + label;
        }
        List<String> args = new ArrayList<>();
        for (Ast arg : ast.args()) {
            args.add(toDotIndent(arg, indent + 2));
        }
        return TABLE_HEADER + "\n<tr><td>" + String.join("</td></tr>\n<tr><td>", args) + "</td></tr>\n</table>";
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
