package io.github.vishalmysore.loggraph.analyzers;

import io.github.vishalmysore.loggraph.util.Status;

/**
 * Common surface of the graphs built by log analyzers.
 */
public interface GraphInterface {

    /**
     * Creates the underlying graph with the analyzer's types. Must be called
     * before any other method.
     */
    Status initialize();

    int numNodes();

    int numEdges();

    /** The graph in Graphviz DOT format. */
    String toDot();
}
