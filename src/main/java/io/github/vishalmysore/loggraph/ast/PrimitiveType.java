package io.github.vishalmysore.loggraph.ast;

/**
 * Kinds of primitive types and values.
 */
public enum PrimitiveType {
    BOOL("bool"),
    INT("int"),           // 64-bit signed
    STRING("string"),
    TIMESTAMP("timestamp"); // microseconds since the Unix epoch

    private final String label;

    PrimitiveType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
