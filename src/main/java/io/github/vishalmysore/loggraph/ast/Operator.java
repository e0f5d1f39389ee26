package io.github.vishalmysore.loggraph.ast;

/**
 * Operators that build composite types and values from their arguments.
 */
public enum Operator {
    INTERVAL("interval"), // a pair of bounds of the same primitive type
    LIST("list"),
    SET("set"),
    TUPLE("tuple");

    private final String label;

    Operator(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isContainer() {
        return this == LIST || this == SET || this == TUPLE;
    }
}
