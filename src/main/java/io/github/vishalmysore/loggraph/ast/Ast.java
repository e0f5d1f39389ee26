package io.github.vishalmysore.loggraph.ast;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Recursive representation shared by types and values.
 *
 * An AST is either primitive, composite, or null (neither shape set). Type
 * ASTs additionally carry a name and a nullability flag at every level; value
 * ASTs leave both unset. Children are owned by their parent, so {@link #copy()}
 * produces an independent tree.
 */
@Data
@NoArgsConstructor
public class Ast {
    private String name;
    private Boolean nullable;
    private PrimitiveAst primitive;
    private CompositeAst composite;

    public static Ast ofPrimitive(PrimitiveType type) {
        Ast ast = new Ast();
        ast.primitive = new PrimitiveAst(type, null);
        return ast;
    }

    public static Ast ofPrimitive(PrimitiveValue value) {
        Ast ast = new Ast();
        ast.primitive = new PrimitiveAst(value.getKind(), value);
        return ast;
    }

    public static Ast ofComposite(Operator op) {
        Ast ast = new Ast();
        ast.composite = new CompositeAst(op);
        return ast;
    }

    public boolean hasName() {
        return name != null;
    }

    public boolean hasNullable() {
        return nullable != null;
    }

    public boolean isNullableType() {
        return nullable != null && nullable;
    }

    public boolean isPrimitive() {
        return primitive != null;
    }

    public boolean isComposite() {
        return composite != null;
    }

    public boolean isNull() {
        return primitive == null && composite == null;
    }

    public boolean isPrimitive(PrimitiveType type) {
        return primitive != null && primitive.getType() == type;
    }

    public boolean isComposite(Operator op) {
        return composite != null && composite.getOp() == op;
    }

    public boolean isBool() {
        return isPrimitive(PrimitiveType.BOOL);
    }

    public boolean isInt() {
        return isPrimitive(PrimitiveType.INT);
    }

    public boolean isString() {
        return isPrimitive(PrimitiveType.STRING);
    }

    public boolean isTimestamp() {
        return isPrimitive(PrimitiveType.TIMESTAMP);
    }

    public boolean isInterval() {
        return isComposite(Operator.INTERVAL);
    }

    public boolean isList() {
        return isComposite(Operator.LIST);
    }

    public boolean isSet() {
        return isComposite(Operator.SET);
    }

    public boolean isTuple() {
        return isComposite(Operator.TUPLE);
    }

    public boolean isContainer() {
        return composite != null && composite.getOp().isContainer();
    }

    /** Arguments of a composite AST; empty for other shapes. */
    public List<Ast> args() {
        return composite == null ? List.of() : composite.getArgs();
    }

    public Ast copy() {
        Ast ast = new Ast();
        ast.name = name;
        ast.nullable = nullable;
        if (primitive != null) {
            ast.primitive = new PrimitiveAst(primitive.getType(), primitive.getValue());
        }
        if (composite != null) {
            ast.composite = new CompositeAst(composite.getOp());
            for (Ast arg : composite.getArgs()) {
                ast.composite.getArgs().add(arg.copy());
            }
        }
        return ast;
    }

    @Override
    public String toString() {
        return AstPrinter.toString(this, PrintConfig.valueOnly());
    }
}
