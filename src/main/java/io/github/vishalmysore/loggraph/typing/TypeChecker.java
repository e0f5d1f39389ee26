package io.github.vishalmysore.loggraph.typing;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstPrinter;
import io.github.vishalmysore.loggraph.ast.CompositeAst;
import io.github.vishalmysore.loggraph.ast.PrimitiveAst;
import io.github.vishalmysore.loggraph.ast.PrimitiveType;
import io.github.vishalmysore.loggraph.ast.PrintConfig;
import io.github.vishalmysore.loggraph.ast.PrintOption;
import io.github.vishalmysore.loggraph.ast.TaggedAst;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;

import java.util.Map;

/**
 * Checks that ASTs are well-formed types and that values conform to types.
 *
 * Diagnostics name the offending field by its path from the root, built by
 * joining field names with '.'.
 */
public final class TypeChecker {
    private static final String INTERVAL_ERR =
            "The interval type constructor must have one argument which is a primitive type.";
    private static final String NO_TAG_ERR = "There is no type defined for the tag : ";
    private static final String ONE_ARG_ERR = "This type constructor must have one argument.";

    private TypeChecker() {
    }

    public static Status isType(Ast ast) {
        return checkType(ast, "");
    }

    /** Checks every type in a tag-to-type map, stopping at the first malformed one. */
    public static Status areTypes(Map<String, Ast> types) {
        for (Map.Entry<String, Ast> entry : types.entrySet()) {
            Status status = checkType(entry.getValue(), "");
            if (!status.isOk()) {
                return status;
            }
        }
        return Status.ok();
    }

    public static String toString(Map<String, Ast> types) {
        StringBuilder str = new StringBuilder();
        PrintConfig config = PrintConfig.of(PrintOption.TYPE);
        for (Map.Entry<String, Ast> entry : types.entrySet()) {
            str.append(entry.getKey()).append(" :: ")
                    .append(AstPrinter.toString(entry.getValue(), config)).append("\n");
        }
        return str.toString();
    }

    /**
     * Checks that {@code value} conforms to {@code type}. The type itself must
     * be well formed.
     */
    public static Status isTyped(Ast type, Ast value) {
        Checks.checkOk(checkType(type, ""));
        return checkTyped(type, value, "");
    }

    /** Checks a label against the type declared for its tag. */
    public static Status isTyped(Map<String, Ast> types, TaggedAst value) {
        Ast type = types.get(value.getTag());
        if (type == null) {
            return Status.error(NO_TAG_ERR + value.getTag());
        }
        Checks.checkOk(checkType(type, ""));
        if (!value.hasAst()) {
            return checkNullable(type, "");
        }
        return checkTyped(type, value.getAst(), "");
    }

    // Type validity

    private static Status checkType(Ast ast, String path) {
        if (!ast.hasName()) {
            return Status.error("A sub-field of " + path + " has no name.");
        }
        String newPath = path + "." + ast.getName();
        if (!ast.hasNullable()) {
            return Status.error("The nullable flag for " + newPath + " is missing.");
        }
        if (ast.isNull()) {
            if (!ast.getNullable()) {
                return Status.error("The AST " + newPath + " must have a type or be nullable.");
            }
            return Status.ok();
        }
        if (ast.isPrimitive()) {
            return Status.ok();
        }
        CompositeAst composite = ast.getComposite();
        switch (composite.getOp()) {
            case INTERVAL:
                return checkIntervalType(composite, newPath);
            case TUPLE:
                return checkTupleType(composite, newPath);
            default:
                return checkContainerType(composite, newPath);
        }
    }

    private static Status checkIntervalType(CompositeAst composite, String path) {
        if (composite.size() == 1 && composite.arg(0).isPrimitive()) {
            return checkType(composite.arg(0), path);
        }
        return Status.error("The type of " + path + " is malformed. " + INTERVAL_ERR);
    }

    private static Status checkContainerType(CompositeAst composite, String path) {
        if (composite.size() != 1) {
            return Status.error("The field " + path + " has type "
                    + composite.getOp().getLabel() + ". " + ONE_ARG_ERR);
        }
        return checkType(composite.arg(0), path);
    }

    private static Status checkTupleType(CompositeAst composite, String path) {
        if (composite.size() == 0) {
            return Status.error("The type constructor " + path + " requires at least one argument.");
        }
        for (Ast arg : composite.getArgs()) {
            Status status = checkType(arg, path);
            if (!status.isOk()) {
                return status;
            }
        }
        return Status.ok();
    }

    private static Status checkNullable(Ast type, String path) {
        if (!type.isNullableType()) {
            return Status.error("The field " + path + "." + type.getName() + " must not be empty.");
        }
        return Status.ok();
    }

    // Conformance of values to types

    private static Status checkTyped(Ast type, Ast value, String path) {
        if (type.isNull() && value.isNull()) {
            return Status.ok();
        }
        if (type.isPrimitive() && value.isPrimitive()) {
            return checkPrimitive(type, value.getPrimitive(), path);
        }
        if (type.isComposite() && value.isComposite()) {
            return checkComposite(type, value.getComposite(), path);
        }
        return typeMismatch(type, value, path);
    }

    private static Status typeMismatch(Ast type, Ast value, String path) {
        String expected = AstPrinter.toStringRoot(type, PrintOption.TYPE);
        String actual = AstPrinter.toStringRoot(value, PrintOption.TYPE);
        return Status.error("The field " + path + "." + type.getName() + " should have type:\n  "
                + expected + "\nbut has type :\n  " + actual);
    }

    private static Status checkPrimitive(Ast type, PrimitiveAst value, String path) {
        PrimitiveType expected = type.getPrimitive().getType();
        if (expected != value.getType()) {
            return typeMismatch(type, Ast.ofPrimitive(value.getType()), path);
        }
        if (!value.hasValue()) {
            return checkNullable(type, path);
        }
        if (!ValueChecker.isPrimitive(expected, value.getValue())) {
            return Status.error("The field " + path + "." + type.getName() + " has the wrong type.");
        }
        return Status.ok();
    }

    private static Status checkComposite(Ast type, CompositeAst value, String path) {
        if (type.getComposite().getOp() != value.getOp()) {
            return typeMismatch(type, Ast.ofComposite(value.getOp()), path);
        }
        if (value.size() == 0) {
            return checkNullable(type, path);
        }
        String newPath = path + "." + type.getName();
        switch (value.getOp()) {
            case INTERVAL:
                return checkInterval(type, value, newPath);
            case TUPLE:
                return checkTuple(type, value, newPath);
            default:
                return checkContainer(type, value, newPath);
        }
    }

    private static Status checkInterval(Ast type, CompositeAst value, String path) {
        if (value.size() != 2) {
            return Status.error("The interval " + path + " has " + value.size()
                    + " arguments but should have two.");
        }
        Ast boundType = type.getComposite().arg(0);
        Status status = checkTyped(boundType, value.arg(0), path);
        if (!status.isOk()) {
            return status;
        }
        return checkTyped(boundType, value.arg(1), path);
    }

    private static Status checkContainer(Ast type, CompositeAst value, String path) {
        Ast elementType = type.getComposite().arg(0);
        for (Ast arg : value.getArgs()) {
            Status status = checkTyped(elementType, arg, path);
            if (!status.isOk()) {
                return status;
            }
        }
        return Status.ok();
    }

    private static Status checkTuple(Ast type, CompositeAst value, String path) {
        CompositeAst fields = type.getComposite();
        if (value.size() != fields.size()) {
            return Status.error(path + " has " + value.size() + " fields instead of "
                    + fields.size() + ".");
        }
        for (int i = 0; i < value.size(); ++i) {
            Status status = checkTyped(fields.arg(i), value.arg(i), path);
            if (!status.isOk()) {
                return status;
            }
        }
        return Status.ok();
    }
}
