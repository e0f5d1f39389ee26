package io.github.vishalmysore.loggraph.typing;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstSerializer;
import io.github.vishalmysore.loggraph.ast.Operator;
import io.github.vishalmysore.loggraph.ast.PrimitiveType;
import io.github.vishalmysore.loggraph.ast.PrimitiveValue;
import io.github.vishalmysore.loggraph.util.Checks;
import io.github.vishalmysore.loggraph.util.TimeUtils;

import java.util.List;
import java.util.OptionalLong;

/**
 * Factory methods and accessors for value ASTs.
 *
 * Value ASTs carry no names or nullability flags. Container helpers such as
 * {@link #append(Ast, Ast, Ast)} take the declared type of the container and
 * fail if the new element does not conform to it.
 */
public final class Values {
    private static final String LIST_TYPE_ERR = "The AST 'type' must be a list type.";
    private static final String SET_TYPE_ERR = "The AST 'type' must be a set type.";
    private static final String TUPLE_TYPE_ERR = "The AST 'type' must be a tuple type.";
    private static final String CONTAINER_SIZE_ERR = "A size is only defined for containers.";

    private Values() {
    }

    public static Ast makeNull() {
        return new Ast();
    }

    public static Ast makePrimitiveNull(PrimitiveType type) {
        return Ast.ofPrimitive(type);
    }

    public static Ast makeBool(boolean val) {
        return Ast.ofPrimitive(PrimitiveValue.ofBool(val));
    }

    public static Ast makeInt(long val) {
        return Ast.ofPrimitive(PrimitiveValue.ofInt(val));
    }

    public static Ast makeString(String val) {
        Checks.check(val != null, "A string value must not be null.");
        return Ast.ofPrimitive(PrimitiveValue.ofString(val));
    }

    public static Ast makeTimestampFromUnixMicros(long unixMicros) {
        return Ast.ofPrimitive(PrimitiveValue.ofTimestamp(unixMicros));
    }

    /** Returns a timestamp without a value if {@code time} cannot be parsed. */
    public static Ast makeTimestampFromRfc3339(String time) {
        OptionalLong micros = TimeUtils.rfc3339ToUnixMicros(time);
        if (micros.isPresent()) {
            return makeTimestampFromUnixMicros(micros.getAsLong());
        }
        return makePrimitiveNull(PrimitiveType.TIMESTAMP);
    }

    public static boolean getBool(Ast val) {
        return primitiveValue(val, PrimitiveType.BOOL).getBoolVal();
    }

    public static long getInt(Ast val) {
        return primitiveValue(val, PrimitiveType.INT).getIntVal();
    }

    public static String getString(Ast val) {
        return primitiveValue(val, PrimitiveType.STRING).getStringVal();
    }

    public static long getTimestamp(Ast val) {
        return primitiveValue(val, PrimitiveType.TIMESTAMP).getTimeVal();
    }

    private static PrimitiveValue primitiveValue(Ast val, PrimitiveType type) {
        Checks.check(val.isPrimitive(type), "Expected a " + type.getLabel() + " value.");
        Checks.check(val.getPrimitive().hasValue(), "The " + type.getLabel() + " value is empty.");
        return val.getPrimitive().getValue();
    }

    // Intervals

    public static Ast makeCompositeNull(Operator op) {
        return Ast.ofComposite(op);
    }

    public static Ast makeEmptyInterval() {
        return makeCompositeNull(Operator.INTERVAL);
    }

    /** The interval with both bounds unset, which contains every value of the kind. */
    public static Ast makeMaxInterval(PrimitiveType type) {
        Ast ast = makeCompositeNull(Operator.INTERVAL);
        ast.getComposite().getArgs().add(makePrimitiveNull(type));
        ast.getComposite().getArgs().add(makePrimitiveNull(type));
        return ast;
    }

    public static Ast makeBoolInterval(boolean lower, boolean upper) {
        return makeInterval(makeBool(lower), makeBool(upper));
    }

    public static Ast makeBoolHalfInterval(boolean val, boolean isLower) {
        return makeHalfInterval(makeBool(val), isLower);
    }

    public static Ast makeIntInterval(long lower, long upper) {
        return makeInterval(makeInt(lower), makeInt(upper));
    }

    public static Ast makeIntHalfInterval(long val, boolean isLower) {
        return makeHalfInterval(makeInt(val), isLower);
    }

    public static Ast makeStringInterval(String lower, String upper) {
        return makeInterval(makeString(lower), makeString(upper));
    }

    public static Ast makeStringHalfInterval(String val, boolean isLower) {
        return makeHalfInterval(makeString(val), isLower);
    }

    public static Ast makeTimestampInterval(long lowerMicros, long upperMicros) {
        return makeInterval(makeTimestampFromUnixMicros(lowerMicros), makeTimestampFromUnixMicros(upperMicros));
    }

    public static Ast makeTimestampHalfInterval(long micros, boolean isLower) {
        return makeHalfInterval(makeTimestampFromUnixMicros(micros), isLower);
    }

    private static Ast makeInterval(Ast lower, Ast upper) {
        Ast ast = makeMaxInterval(lower.getPrimitive().getType());
        ast.getComposite().getArgs().set(0, lower);
        ast.getComposite().getArgs().set(1, upper);
        return ast;
    }

    private static Ast makeHalfInterval(Ast bound, boolean isLower) {
        Ast ast = makeMaxInterval(bound.getPrimitive().getType());
        ast.getComposite().getArgs().set(isLower ? 0 : 1, bound);
        return ast;
    }

    // Containers

    public static int size(Ast container) {
        Checks.check(container.isContainer(), CONTAINER_SIZE_ERR);
        return container.getComposite().size();
    }

    public static Ast makeEmptyList() {
        return makeCompositeNull(Operator.LIST);
    }

    public static void append(Ast type, Ast arg, Ast list) {
        checkContainer(Operator.LIST, type, arg, list);
        list.getComposite().getArgs().add(arg.copy());
    }

    public static Ast makeEmptySet() {
        return makeCompositeNull(Operator.SET);
    }

    /** Adds the canonical form of {@code arg} unless an isomorphic element is present. */
    public static void insert(Ast type, Ast arg, Ast set) {
        checkContainer(Operator.SET, type, arg, set);
        Ast newArg = arg.copy();
        ValueChecker.canonicalize(newArg);
        String key = AstSerializer.serialize(newArg);
        for (Ast oldArg : set.getComposite().getArgs()) {
            ValueChecker.canonicalize(oldArg);
            if (AstSerializer.serialize(oldArg).equals(key)) {
                return;
            }
        }
        set.getComposite().getArgs().add(newArg);
    }

    public static Ast makeNullTuple(int numFields) {
        Checks.check(numFields >= 0, "A tuple cannot have a negative number of fields.");
        Ast ast = makeCompositeNull(Operator.TUPLE);
        for (int i = 0; i < numFields; ++i) {
            ast.getComposite().getArgs().add(makeNull());
        }
        return ast;
    }

    public static void setField(Ast type, int fieldNum, Ast arg, Ast tuple) {
        Checks.check(type.isTuple(), TUPLE_TYPE_ERR);
        Checks.checkOk(TypeChecker.isType(type));
        Checks.check(tuple != null && tuple.isTuple(), "Fields can only be set on a tuple value.");
        Checks.check(fieldNum >= 0 && fieldNum < type.getComposite().size(),
                "Field " + fieldNum + " is out of range for " + type.getName() + ".");
        Checks.check(tuple.getComposite().size() == type.getComposite().size(),
                "The tuple value does not have the arity of its type.");
        tuple.getComposite().getArgs().set(fieldNum, arg.copy());
    }

    private static void checkContainer(Operator op, Ast type, Ast arg, Ast container) {
        if (op == Operator.LIST) {
            Checks.check(type.isList(), LIST_TYPE_ERR);
        } else {
            Checks.check(type.isSet(), SET_TYPE_ERR);
        }
        Checks.checkOk(TypeChecker.isType(type));
        Checks.check(container != null && container.isComposite(op),
                "Elements can only be added to a " + op.getLabel() + " value.");
        Checks.checkOk(ValueChecker.isValue(container));
        Checks.checkOk(TypeChecker.isTyped(type.getComposite().arg(0), arg));
    }

    // Domain values

    /** A directory value from its path components, outermost first. */
    public static Ast makeDirectory(List<String> parts) {
        Ast type = Types.makeDirectory();
        Ast dir = makeEmptyList();
        for (String part : parts) {
            append(type, makeString(part), dir);
        }
        return dir;
    }

    public static Ast makeFile(List<String> directory, String filename) {
        Ast type = Types.makeFile();
        Ast file = makeNullTuple(2);
        setField(type, 0, makeDirectory(directory), file);
        setField(type, 1, filename == null ? makePrimitiveNull(PrimitiveType.STRING) : makeString(filename), file);
        return file;
    }

    public static Ast makeIpAddress(String address) {
        return makeString(address);
    }

    public static Ast makeUrl(String url) {
        return makeString(url);
    }
}
