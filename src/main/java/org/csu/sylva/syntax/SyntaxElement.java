package org.csu.sylva.syntax;

import java.util.Optional;

/**
 * 语法树中的一个元素：节点或 Token。
 */
public interface SyntaxElement {

    SyntaxKind kind();

    TextRange textRange();

    Optional<SyntaxNode> parent();

    default Optional<SyntaxNode> asNode() {
        return this instanceof SyntaxNode node ? Optional.of(node) : Optional.empty();
    }

    default Optional<SyntaxToken> asToken() {
        return this instanceof SyntaxToken token ? Optional.of(token) : Optional.empty();
    }
}
