package io.github.vishalmysore.loggraph.typing;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstTags;
import io.github.vishalmysore.loggraph.ast.CompositeAst;
import io.github.vishalmysore.loggraph.ast.Operator;
import io.github.vishalmysore.loggraph.ast.PrimitiveAst;
import io.github.vishalmysore.loggraph.ast.PrimitiveType;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;

import java.util.List;

/**
 * Factory methods for type ASTs. Every type built here is well formed; the
 * composite constructors fail if an argument is not itself a type.
 */
public final class Types {
    private static final String INTERVAL_ARG = "bound";
    private static final String CONTAINER_ARG = "";

    private Types() {
    }

    public static Ast makeNull(String name) {
        Ast ast = new Ast();
        ast.setName(name);
        ast.setNullable(true);
        return ast;
    }

    public static Ast makeBool(String name, boolean nullable) {
        return makePrimitive(name, nullable, PrimitiveType.BOOL);
    }

    public static Ast makeInt(String name, boolean nullable) {
        return makePrimitive(name, nullable, PrimitiveType.INT);
    }

    public static Ast makeString(String name, boolean nullable) {
        return makePrimitive(name, nullable, PrimitiveType.STRING);
    }

    public static Ast makeTimestamp(String name, boolean nullable) {
        return makePrimitive(name, nullable, PrimitiveType.TIMESTAMP);
    }

    public static Ast makePrimitive(String name, boolean nullable, PrimitiveType type) {
        Ast ast = new Ast();
        ast.setName(name);
        ast.setNullable(nullable);
        ast.setPrimitive(new PrimitiveAst(type, null));
        return ast;
    }

    /** Intervals are always nullable since an empty interval has no bounds. */
    public static Ast makeInterval(String name, PrimitiveType type) {
        return makeComposite(name, true, Operator.INTERVAL,
                List.of(makePrimitive(INTERVAL_ARG, true, type)));
    }

    public static Ast makeList(String name, boolean nullable, Ast elementType) {
        return makeContainer(name, nullable, Operator.LIST, elementType);
    }

    public static Ast makeSet(String name, boolean nullable, Ast elementType) {
        return makeContainer(name, nullable, Operator.SET, elementType);
    }

    public static Ast makeContainer(String name, boolean nullable, Operator op, Ast elementType) {
        Ast ast = makeComposite(name, nullable, op, List.of(elementType));
        // Elements are addressed by position, not by name.
        ast.getComposite().arg(0).setName(CONTAINER_ARG);
        return ast;
    }

    public static Ast makeTuple(String name, boolean nullable, List<Ast> fields) {
        return makeComposite(name, nullable, Operator.TUPLE, fields);
    }

    public static Ast makeComposite(String name, boolean nullable, Operator op, List<Ast> args) {
        Ast ast = new Ast();
        ast.setName(name);
        ast.setNullable(nullable);
        ast.setComposite(new CompositeAst(op));
        for (Ast arg : args) {
            Status status = TypeChecker.isType(arg);
            Checks.checkOk(status);
            ast.getComposite().getArgs().add(arg.copy());
        }
        return ast;
    }

    // Domain types

    public static Ast makeDirectory() {
        return makeList(AstTags.DIRECTORY, true, makeString(AstTags.FILE_PATH_PART, false));
    }

    public static Ast makeFile() {
        return makeTuple(AstTags.FILE, true,
                List.of(makeDirectory(), makeString(AstTags.FILENAME, true)));
    }

    public static Ast makeIpAddress() {
        return makeString(AstTags.IP_ADDRESS, false);
    }

    public static Ast makeUrl() {
        return makeString(AstTags.URL, false);
    }
}
