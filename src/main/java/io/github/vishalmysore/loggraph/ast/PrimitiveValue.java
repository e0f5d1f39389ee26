package io.github.vishalmysore.loggraph.ast;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * An immutable primitive value. Exactly one of the four fields is set; the
 * field that is set determines the value's {@link #getKind() kind}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PrimitiveValue {
    Boolean boolVal;
    Long intVal;
    String stringVal;
    Long timeVal;

    public static PrimitiveValue ofBool(boolean val) {
        return new PrimitiveValue(val, null, null, null);
    }

    public static PrimitiveValue ofInt(long val) {
        return new PrimitiveValue(null, val, null, null);
    }

    public static PrimitiveValue ofString(String val) {
        return new PrimitiveValue(null, null, val, null);
    }

    public static PrimitiveValue ofTimestamp(long unixMicros) {
        return new PrimitiveValue(null, null, null, unixMicros);
    }

    public PrimitiveType getKind() {
        if (boolVal != null) {
            return PrimitiveType.BOOL;
        }
        if (intVal != null) {
            return PrimitiveType.INT;
        }
        if (stringVal != null) {
            return PrimitiveType.STRING;
        }
        return PrimitiveType.TIMESTAMP;
    }
}
