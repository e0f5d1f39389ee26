package io.github.vishalmysore.loggraph.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vishalmysore.loggraph.graph.LabeledGraph;
import io.github.vishalmysore.loggraph.graph.WeightedGraphs;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonGraphExporterTest {
    private final JsonGraphExporter exporter = new JsonGraphExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void exportsTypesNodesAndEdges() throws Exception {
        JsonNode doc = mapper.readTree(exporter.exportGraph(WeightedGraphs.cycle(3)));

        assertThat(doc.path("nodeCount").asInt()).isEqualTo(3);
        assertThat(doc.path("edgeCount").asInt()).isEqualTo(3);
        assertThat(doc.path("types").path("graph").asText()).isEqualTo("Weighted-Graph null?");

        JsonNode nodeType = doc.path("types").path("nodes").get(0);
        assertThat(nodeType.path("tag").asText()).isEqualTo(WeightedGraphs.NODE_TAG);
        assertThat(nodeType.path("type").asText()).isEqualTo("Node-Weight int");
        assertThat(nodeType.path("unique").asBoolean()).isFalse();

        JsonNode node = doc.path("nodes").get(1);
        assertThat(node.path("id").asInt()).isEqualTo(1);
        assertThat(node.path("text").asText()).isEqualTo(" : Node-Weight :: 1");
        assertThat(node.path("ast").path("primitive").path("value").path("intVal").asLong()).isEqualTo(1L);

        JsonNode closing = doc.path("edges").get(2);
        assertThat(closing.path("source").asInt()).isEqualTo(2);
        assertThat(closing.path("target").asInt()).isEqualTo(0);
        assertThat(closing.path("tag").asText()).isEqualTo(WeightedGraphs.EDGE_TAG);
    }

    @Test
    void indentsOutput() {
        assertThat(exporter.exportGraph(WeightedGraphs.path(1))).contains("\n  \"types\"");
    }

    @Test
    void returnsEmptyObjectWhenGraphCannotBeRead() {
        assertThat(exporter.exportGraph(new LabeledGraph())).isEqualTo("{}");
    }
}
