package io.github.vishalmysore.loggraph.typing;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstSerializer;
import io.github.vishalmysore.loggraph.ast.CompositeAst;
import io.github.vishalmysore.loggraph.ast.PrimitiveAst;
import io.github.vishalmysore.loggraph.ast.PrimitiveType;
import io.github.vishalmysore.loggraph.ast.PrimitiveValue;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.Status;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Validity, ordering, isomorphism and canonical forms of value ASTs.
 *
 * Values are checked for shape only. The elements of a list or set are each
 * required to be values, but they need not share a type; that is decided by
 * {@link TypeChecker#isTyped(Ast, Ast)} against a declared type.
 */
public final class ValueChecker {

    private ValueChecker() {
    }

    public static boolean isPrimitive(PrimitiveType type, PrimitiveValue value) {
        return value != null && value.getKind() == type;
    }

    public static Status isValue(Ast ast) {
        return checkValue(ast, "");
    }

    /**
     * Strict order on primitive values of the same kind. Booleans order
     * {@code false} before {@code true}.
     */
    public static boolean lessThan(PrimitiveAst val1, PrimitiveAst val2) {
        Checks.check(val1.getType() == val2.getType(), "Cannot compare values of different kinds.");
        Checks.check(val1.hasValue() && val2.hasValue(), "Cannot compare empty values.");
        PrimitiveValue v1 = val1.getValue();
        PrimitiveValue v2 = val2.getValue();
        Checks.check(isPrimitive(val1.getType(), v1) && isPrimitive(val2.getType(), v2),
                "Primitive value does not match its kind.");
        switch (val1.getType()) {
            case BOOL:
                return !v1.getBoolVal() && v2.getBoolVal();
            case INT:
                return v1.getIntVal() < v2.getIntVal();
            case STRING:
                return v1.getStringVal().compareTo(v2.getStringVal()) < 0;
            default:
                return v1.getTimeVal() < v2.getTimeVal();
        }
    }

    /**
     * True if both values have the same shape and the same primitive values,
     * comparing arguments position by position. Sets are only isomorphic
     * independent of insertion order after {@link #canonicalize(Ast)}.
     */
    public static boolean isomorphic(Ast val1, Ast val2) {
        Checks.checkOk(checkValue(val1, ""));
        Checks.checkOk(checkValue(val2, ""));
        return isomorphicInternal(val1, val2);
    }

    /**
     * Rewrites a value in place into the canonical member of its isomorphism
     * class: inverted intervals become empty, and set elements are
     * canonicalized, de-duplicated and sorted by their serialization.
     */
    public static void canonicalize(Ast value) {
        Checks.check(value != null, "Cannot canonicalize a missing value.");
        Checks.checkOk(checkValue(value, ""));
        canonicalizeInternal(value);
    }

    private static Status checkValue(Ast ast, String path) {
        if (ast.isNull()) {
            return Status.ok();
        }
        if (ast.isPrimitive()) {
            PrimitiveAst primitive = ast.getPrimitive();
            if (!primitive.hasValue() || isPrimitive(primitive.getType(), primitive.getValue())) {
                return Status.ok();
            }
            return Status.error("The value of " + path + "." + primitive.getType().getLabel()
                    + " is of the wrong type.");
        }
        CompositeAst composite = ast.getComposite();
        if (composite.size() == 0) {
            return Status.ok();
        }
        String newPath = path + "." + composite.getOp().getLabel();
        switch (composite.getOp()) {
            case INTERVAL:
                return checkInterval(composite, newPath);
            default:
                return checkContainerLike(composite, newPath);
        }
    }

    private static Status checkInterval(CompositeAst interval, String path) {
        if (interval.size() != 2) {
            return Status.error("The interval " + path + " must have zero or two arguments.");
        }
        Ast lower = interval.arg(0);
        Ast upper = interval.arg(1);
        if (!lower.isPrimitive() || !upper.isPrimitive()
                || lower.getPrimitive().getType() != upper.getPrimitive().getType()) {
            return Status.error("The arguments to " + path + " must have the same, ordered type.");
        }
        Status status = checkValue(lower, path + ".lower-bound");
        if (!status.isOk()) {
            return status;
        }
        return checkValue(upper, path + ".upper-bound");
    }

    private static Status checkContainerLike(CompositeAst composite, String path) {
        for (int i = 0; i < composite.size(); ++i) {
            Status status = checkValue(composite.arg(i), path + "(" + i + ")");
            if (!status.isOk()) {
                return status;
            }
        }
        return Status.ok();
    }

    private static boolean isomorphicInternal(Ast val1, Ast val2) {
        if (val1.isNull() && val2.isNull()) {
            return true;
        }
        if (val1.isPrimitive() && val2.isPrimitive()) {
            PrimitiveAst p1 = val1.getPrimitive();
            PrimitiveAst p2 = val2.getPrimitive();
            return p1.getType() == p2.getType() && Objects.equals(p1.getValue(), p2.getValue());
        }
        if (val1.isComposite() && val2.isComposite()) {
            CompositeAst c1 = val1.getComposite();
            CompositeAst c2 = val2.getComposite();
            if (c1.getOp() != c2.getOp() || c1.size() != c2.size()) {
                return false;
            }
            for (int i = 0; i < c1.size(); ++i) {
                if (!isomorphicInternal(c1.arg(i), c2.arg(i))) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static void canonicalizeInternal(Ast value) {
        if (!value.isComposite() || value.getComposite().size() == 0) {
            return;
        }
        CompositeAst composite = value.getComposite();
        switch (composite.getOp()) {
            case INTERVAL:
                canonicalizeInterval(composite);
                break;
            case SET:
                canonicalizeSet(composite);
                break;
            default:
                for (Ast arg : composite.getArgs()) {
                    canonicalizeInternal(arg);
                }
        }
    }

    private static void canonicalizeInterval(CompositeAst interval) {
        PrimitiveAst lower = interval.arg(0).getPrimitive();
        PrimitiveAst upper = interval.arg(1).getPrimitive();
        // An unset bound is unbounded, so only two set bounds can be inverted.
        if (lower.hasValue() && upper.hasValue() && lessThan(upper, lower)) {
            interval.getArgs().clear();
        }
    }

    private static void canonicalizeSet(CompositeAst set) {
        TreeMap<String, Ast> elements = new TreeMap<>();
        for (Ast arg : set.getArgs()) {
            canonicalizeInternal(arg);
            elements.putIfAbsent(AstSerializer.serialize(arg), arg);
        }
        List<Ast> sorted = new ArrayList<>(elements.values());
        set.getArgs().clear();
        set.getArgs().addAll(sorted);
    }
}
