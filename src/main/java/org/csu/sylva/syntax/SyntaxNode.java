package org.csu.sylva.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 语法节点句柄（非终结符）。只持有树的引用和下标，构造代价可以忽略。
 */
public record SyntaxNode(SyntaxTree tree, int index) implements SyntaxElement {

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
     * 节点覆盖的全部源码文本，包括其中的空白和注释。
     */
    public String text() {
        return textRange().substring(tree.getText());
    }

    public Optional<SyntaxElement> firstChildOrToken() {
        int[] children = tree.children(index);
        return children.length == 0 ? Optional.empty() : Optional.of(tree.element(children[0]));
    }

    public Optional<SyntaxElement> lastChildOrToken() {
        int[] children = tree.children(index);
        return children.length == 0 ? Optional.empty() : Optional.of(tree.element(children[children.length - 1]));
    }

    /**
     * 按源码顺序返回子节点和 Token（交错）。
     */
    public List<SyntaxElement> childrenWithTokens() {
        int[] children = tree.children(index);
        List<SyntaxElement> result = new ArrayList<>(children.length);
        for (int child : children) {
            result.add(tree.element(child));
        }
        return result;
    }

    /**
     * 只返回子节点，跳过 Token。
     */
    public List<SyntaxNode> children() {
        List<SyntaxNode> result = new ArrayList<>();
        for (int child : tree.children(index)) {
            if (tree.kind(child).isNode()) {
                result.add(new SyntaxNode(tree, child));
            }
        }
        return result;
    }

    /**
     * 先序遍历当前节点及其所有后代节点。
     */
    public Stream<SyntaxNode> descendants() {
        return Stream.concat(Stream.of(this), children().stream().flatMap(SyntaxNode::descendants));
    }

    /**
     * 返回完全覆盖给定区间的最深元素。区间超出本节点时返回本节点。
     */
    public SyntaxElement coveringElement(TextRange range) {
        SyntaxElement current = this;
        while (current instanceof SyntaxNode node) {
            SyntaxElement next = null;
            for (SyntaxElement child : node.childrenWithTokens()) {
                TextRange childRange = child.textRange();
                if (childRange.containsRange(range) && !(range.isEmpty() && childRange.end() == range.start())) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
        return current;
    }

    public String debugDump() {
        StringBuilder sb = new StringBuilder();
        dump(this, 0, sb);
        return sb.toString();
    }

    private static void dump(SyntaxElement element, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(element.kind()).append('@').append(element.textRange());
        if (element instanceof SyntaxToken token) {
            sb.append(' ').append('"').append(escape(token.text())).append('"').append('\n');
            return;
        }
        sb.append('\n');
        for (SyntaxElement child : ((SyntaxNode) element).childrenWithTokens()) {
            dump(child, depth + 1, sb);
        }
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t").replace("\"", "\\\"");
    }

    @Override
    public String toString() {
        return kind() + "@" + textRange();
    }
}
