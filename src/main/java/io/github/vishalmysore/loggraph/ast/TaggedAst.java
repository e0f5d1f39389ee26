package io.github.vishalmysore.loggraph.ast;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A label: an AST together with the tag naming its declared type. The AST may
 * be absent, which is only acceptable for nullable tag types.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaggedAst {
    private String tag;
    private Ast ast;

    public boolean hasAst() {
        return ast != null;
    }

    public TaggedAst copy() {
        return new TaggedAst(tag, ast == null ? null : ast.copy());
    }

    @Override
    public String toString() {
        return AstPrinter.toString(this, PrintConfig.valueOnly());
    }
}
