package org.csu.sylva.syntax;

import java.util.Optional;

/**
 * 词法单元句柄（终结符），树的叶子。
 */
public record SyntaxToken(SyntaxTree tree, int index) implements SyntaxElement {

    @Override
    public SyntaxKind kind() {
        return tree.kind(index);
    }

    @Override
    public TextRange textRange() {
        return tree.range(index);
    }

    @Override
    public Optional<SyntaxNode> parent() {
        int parent = tree.parent(index);
        return parent < 0 ? Optional.empty() : Optional.of(new SyntaxNode(tree, parent));
    }

    /**
     * Token 的原始文本。
     */
    public String text() {
        return textRange().substring(tree.getText());
    }

    @Override
    public String toString() {
        return kind() + "@" + textRange() + " \"" + text() + "\"";
    }
}
