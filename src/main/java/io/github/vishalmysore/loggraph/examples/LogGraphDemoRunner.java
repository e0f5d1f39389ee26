package io.github.vishalmysore.loggraph.examples;

import io.github.vishalmysore.loggraph.analysis.PartitionRefiner;
import io.github.vishalmysore.loggraph.analyzers.AccountAccessGraph;
import io.github.vishalmysore.loggraph.analyzers.StreamDependencyGraph;
import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.config.AnalyzerSettings;
import io.github.vishalmysore.loggraph.export.DotPrinter;
import io.github.vishalmysore.loggraph.export.JsonGraphExporter;
import io.github.vishalmysore.loggraph.graph.GraphType;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.transform.GraphTransformer;
import io.github.vishalmysore.loggraph.transform.QuotientConfig;
import io.github.vishalmysore.loggraph.typing.Types;
import io.github.vishalmysore.loggraph.typing.Values;
import io.github.vishalmysore.loggraph.util.Status;

import java.io.InputStream;
import java.util.*;
import java.util.logging.LogManager;
import java.util.stream.Collectors;

/**
 * End-to-end demonstration of the log graph engine:
 * 1. Building an account access graph from access records
 * 2. Partition refinement of actors and users
 * 3. Quotienting the graph by the refined partition
 * 4. DOT or JSON export of the summary
 */
public class LogGraphDemoRunner {

        static final String MEMBERS_TAG = "Members";
        static final String ACCESSES_TAG = "Accesses";

        private static final List<String> FIELD_NAMES = List.of(
                        AccountAccessGraph.ACTOR_FIELD,
                        AccountAccessGraph.ACTOR_TITLE_FIELD,
                        AccountAccessGraph.ACTOR_MANAGER_FIELD,
                        AccountAccessGraph.USER_FIELD,
                        AccountAccessGraph.NUM_ACCESSES_FIELD);

        public static void main(String[] args) {
                System.out.println("╔════════════════════════════════════════════════════════════╗");
                System.out.println("║     LogGraph: Labeled Graphs for Log Analysis Demo        ║");
                System.out.println("╚════════════════════════════════════════════════════════════╝\n");

                // === Phase 0: Configuration ===
                try (InputStream is = LogGraphDemoRunner.class.getClassLoader()
                                .getResourceAsStream("logging.properties")) {
                        if (is != null)
                                LogManager.getLogManager().readConfiguration(is);
                } catch (Exception e) {
                        System.err.println("Warning: Could not load logging.properties");
                }
                AnalyzerSettings settings = AnalyzerSettings.load();
                System.out.println("Settings: " + settings + "\n");

                // === Phase 1: Graph Construction ===
                System.out.println("═══ PHASE 1: ACCOUNT ACCESS GRAPH ═══\n");

                AccountAccessGraph accessGraph = buildSampleAccessGraph();
                System.out.println("Access graph: " + accessGraph.numNodes() + " nodes, "
                                + accessGraph.numEdges() + " edges\n");

                StreamDependencyGraph streams = buildSampleStreamGraph();
                System.out.println("Stream dependencies: " + streams.numNodes() + " streams, "
                                + streams.numEdges() + " dependencies\n");

                // === Phase 2: Partition Refinement ===
                System.out.println("═══ PHASE 2: PARTITION REFINEMENT ═══\n");

                LabeledGraph graph = accessGraph.getGraph();
                Map<Integer, Integer> refined = PartitionRefiner.refinePartition(graph, initialPartition(graph));
                long numBlocks = refined.values().stream().distinct().count();
                System.out.println("Refined " + graph.numNodes() + " nodes into " + numBlocks + " blocks");
                for (int node : graph.nodeIds()) {
                        System.out.println("  block " + refined.get(node) + " <- " + graph.getNodeLabel(node).getAst());
                }

                // === Phase 3: Quotient ===
                System.out.println("\n═══ PHASE 3: QUOTIENT GRAPH ═══\n");

                LabeledGraph summary = GraphTransformer.quotientGraph(graph, refined, summaryConfig(settings));
                System.out.println("Summary graph: " + summary.numNodes() + " nodes, " + summary.numEdges()
                                + " edges\n");

                // === Phase 4: Export ===
                System.out.println("═══ PHASE 4: EXPORT (" + settings.getExportFormat() + ") ═══\n");

                if ("json".equalsIgnoreCase(settings.getExportFormat())) {
                        System.out.println(new JsonGraphExporter().exportGraph(summary));
                } else {
                        DotPrinter printer = new DotPrinter(DotPrinter::nodeAttribute, DotPrinter::edgeAttribute,
                                        settings.getDotGraphName());
                        System.out.println(printer.dotGraph(summary));
                }
                System.out.println(streams.toDot());

                System.out.println("\n╔════════════════════════════════════════════════════════════╗");
                System.out.println("║                    DEMO COMPLETE                          ║");
                System.out.println("╚════════════════════════════════════════════════════════════╝");
        }

        /**
         * Builds an access graph in which two analysts read the same accounts,
         * so refinement keeps them in one block.
         */
        static AccountAccessGraph buildSampleAccessGraph() {
                AccountAccessGraph accessGraph = new AccountAccessGraph();
                Status status = accessGraph.initialize();
                if (!status.isOk()) {
                        throw new IllegalStateException(status.getMessage());
                }
                Map<String, Integer> fieldIndex = new HashMap<>();
                for (int i = 0; i < FIELD_NAMES.size(); i++) {
                        fieldIndex.put(FIELD_NAMES.get(i), i);
                }

                List<List<String>> records = List.of(
                                List.of("alice", "Analyst", "carol", "acct-payroll", "3"),
                                List.of("bob", "Analyst", "carol", "acct-payroll", "3"),
                                List.of("alice", "Analyst", "carol", "acct-billing", "1"),
                                List.of("bob", "Analyst", "carol", "acct-billing", "1"),
                                List.of("dave", "Admin", "erin", "acct-payroll", "12"),
                                List.of("dave", "Admin", "erin", "acct-audit", "7"),
                                List.of("frank", "Intern", "carol", "acct-billing", "not-a-number"));
                for (List<String> record : records) {
                        Status recordStatus = accessGraph.processAccessData(fieldIndex, record);
                        if (!recordStatus.isOk()) {
                                System.out.println("Skipped record " + record + ": " + recordStatus.getMessage());
                        }
                }
                return accessGraph;
        }

        private static StreamDependencyGraph buildSampleStreamGraph() {
                StreamDependencyGraph streams = new StreamDependencyGraph();
                streams.initialize();
                streams.addDependency("s-enrich", "enriched-logins", "s-raw", "raw-logins");
                streams.addDependency("s-alerts", "login-alerts", "s-enrich", "enriched-logins");
                streams.addDependency("s-report", "weekly-report", "s-enrich", "enriched-logins");
                return streams;
        }

        /**
         * Actors start out in one block and every account in its own, so
         * refinement separates actors by the accounts they access.
         */
        static Map<Integer, Integer> initialPartition(LabeledGraph graph) {
                Map<Integer, Integer> partition = new HashMap<>();
                for (int node : graph.nodeIds()) {
                        boolean actor = AccountAccessGraph.ACTOR_TAG.equals(graph.getNodeLabel(node).getTag());
                        partition.put(node, actor ? 0 : node + 1);
                }
                return partition;
        }

        /**
         * Block nodes list their members; edges between blocks carry the total
         * number of accesses.
         */
        static QuotientConfig summaryConfig(AnalyzerSettings settings) {
                Map<String, Ast> nodeTypes = new TreeMap<>();
                nodeTypes.put(MEMBERS_TAG, Types.makeString(MEMBERS_TAG, false));
                Map<String, Ast> edgeTypes = new TreeMap<>();
                edgeTypes.put(ACCESSES_TAG, Types.makeInt(ACCESSES_TAG, false));
                GraphType type = GraphType.builder()
                                .nodeTypes(nodeTypes)
                                .edgeTypes(edgeTypes)
                                .graphType(Types.makeNull("Access Summary"))
                                .build();

                return QuotientConfig.builder()
                                .outputGraphType(type)
                                .allowSelfEdges(settings.isAllowSelfEdges())
                                .nodeLabelFn((graph, nodes) -> new TaggedAst(MEMBERS_TAG, Values.makeString(
                                                nodes.stream()
                                                                .map(n -> graph.getNodeLabel(n).getAst().toString())
                                                                .collect(Collectors.joining(" | ")))))
                                .edgeLabelFn((graph, edges) -> {
                                        long total = 0;
                                        for (int edge : edges) {
                                                total += Values.getInt(graph.getEdgeLabel(edge).getAst());
                                        }
                                        return List.of(new TaggedAst(ACCESSES_TAG, Values.makeInt(total)));
                                })
                                .build();
        }
}
