package io.github.vishalmysore.loggraph.ast;

/**
 * Which parts of an AST to print. Options combine like bit flags.
 */
public enum PrintOption {
    NAME(1),
    TYPE(2),
    VALUE(4),
    NAME_AND_TYPE(3),
    NAME_AND_VALUE(5),
    TYPE_AND_VALUE(6),
    ALL(7);

    private final int mask;

    PrintOption(int mask) {
        this.mask = mask;
    }

    /** True if every flag of this option is also set in {@code other}. */
    public boolean isIncludedIn(PrintOption other) {
        return (mask & other.mask) == mask;
    }
}
