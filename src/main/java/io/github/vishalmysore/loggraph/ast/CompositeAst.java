package io.github.vishalmysore.loggraph.ast;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The composite shape of an {@link Ast}: an operator applied to an ordered
 * list of argument ASTs.
 */
@Data
@NoArgsConstructor
public class CompositeAst {
    private Operator op;
    private List<Ast> args = new ArrayList<>();

    public CompositeAst(Operator op) {
        this.op = op;
    }

    public int size() {
        return args.size();
    }

    public Ast arg(int i) {
        return args.get(i);
    }
}
