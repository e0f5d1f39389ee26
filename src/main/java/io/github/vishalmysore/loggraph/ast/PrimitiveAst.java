package io.github.vishalmysore.loggraph.ast;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The primitive shape of an {@link Ast}: a kind plus an optional value.
 * A {@code null} value means the AST describes a type or an unknown value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrimitiveAst {
    private PrimitiveType type;
    private PrimitiveValue value;

    public boolean hasValue() {
        return value != null;
    }
}
