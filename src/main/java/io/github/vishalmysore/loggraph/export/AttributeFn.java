package io.github.vishalmysore.loggraph.export;

import io.github.vishalmysore.loggraph.ast.Ast;

/**
 * Strategy that renders the DOT attribute list of a node or edge from the tag
 * and AST of its label. Implementations must return well-formed DOT, including
 * the enclosing brackets.
 */
public interface AttributeFn {

    String attributes(String tag, Ast ast);
}
