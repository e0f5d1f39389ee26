package io.github.vishalmysore.loggraph.ast;

import io.github.vishalmysore.loggraph.util.TimeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders ASTs as human-readable strings. The root of an AST prints as
 * {@code [name] [type][?] : [value]}, with each part controlled by the
 * {@link PrintOption} of the config. Composite arguments follow the root
 * between the configured delimiters.
 */
public final class AstPrinter {
    private static final String NULL_STR = "null";
    private static final String NULLABLE_MARK = "?";
    private static final String TAG_STR = "tag";

    private AstPrinter() {
    }

    public static String toString(TaggedAst tagged, PrintConfig config) {
        PrintOption opt = config.getOption();
        String typeStr = PrintOption.TYPE.isIncludedIn(opt) ? TAG_STR : "";
        String typeSep = PrintOption.VALUE.isIncludedIn(opt) ? " : " : "";
        String tagStr = tagged.getTag() == null ? "" : tagged.getTag();
        String astStr = tagged.hasAst() ? toString(tagged.getAst(), config) : NULL_STR;
        return typeStr + typeSep + tagStr + " :: " + astStr;
    }

    public static String toString(Ast ast, PrintConfig config) {
        String root = toStringRoot(ast, config.getOption());
        // Printing names alone never descends into arguments.
        if (config.getOption().isIncludedIn(PrintOption.NAME) || !ast.isComposite()) {
            return root;
        }
        List<String> argStr = new ArrayList<>();
        if (ast.args().isEmpty()) {
            argStr.add(NULL_STR);
        }
        for (Ast arg : ast.args()) {
            argStr.add(toString(arg, config));
        }
        return root + config.getOpen() + String.join(config.getSep(), argStr) + config.getClose();
    }

    public static String toString(PrimitiveValue val) {
        if (val == null) {
            return NULL_STR;
        }
        switch (val.getKind()) {
            case BOOL:
                return val.getBoolVal() ? "true" : "false";
            case INT:
                return Long.toString(val.getIntVal());
            case STRING:
                return val.getStringVal();
            default:
                return TimeUtils.unixMicrosToRfc3339(val.getTimeVal());
        }
    }

    public static String toStringRoot(Ast ast, PrintOption opt) {
        String name = "";
        if (PrintOption.NAME.isIncludedIn(opt) && ast.hasName()) {
            name = ast.getName();
        }
        String nameSep = "";
        if (!name.isEmpty() && (PrintOption.NAME_AND_TYPE.isIncludedIn(opt)
                || PrintOption.NAME_AND_VALUE.isIncludedIn(opt))) {
            nameSep = " ";
        }
        String nullMark = "";
        if (PrintOption.TYPE.isIncludedIn(opt) && ast.isNullableType()) {
            nullMark = NULLABLE_MARK;
        }
        String typeSep = "";
        if (!ast.isComposite() && PrintOption.TYPE_AND_VALUE.isIncludedIn(opt)) {
            typeSep = " : ";
        }
        return name + nameSep + typeString(ast, opt) + nullMark + typeSep + valueString(ast, opt);
    }

    private static String typeString(Ast ast, PrintOption opt) {
        if (!PrintOption.TYPE.isIncludedIn(opt)) {
            return "";
        }
        if (ast.isNull()) {
            return NULL_STR;
        }
        if (ast.isPrimitive()) {
            return ast.getPrimitive().getType().getLabel();
        }
        return ast.getComposite().getOp().getLabel();
    }

    private static String valueString(Ast ast, PrintOption opt) {
        if (!PrintOption.VALUE.isIncludedIn(opt)) {
            return "";
        }
        if (ast.isNull()) {
            return NULL_STR;
        }
        if (ast.isPrimitive()) {
            return toString(ast.getPrimitive().getValue());
        }
        return "";
    }
}
