package org.csu.sylva.compiler.ast;

import org.csu.sylva.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * 测试辅助：把代码片段包进一个函数体里解析，并按类型查找节点。
 */
public final class AstFixtures {

    public static final String PREFIX = "fn main() {\n";
    public static final String SUFFIX = "\n}";

    private AstFixtures() {
    }

    public static SourceFile parseBody(String body) {
        return SourceFile.parse(PREFIX + body + SUFFIX);
    }

    /**
     * 先序遍历中第一个可以被看作 {@code type} 的节点。
     */
    public static <T extends AstNode> T first(SourceFile file, Class<T> type) {
        return all(file, type).stream().findFirst()
                .orElseThrow(() -> new AssertionError("No " + type.getSimpleName() + " in:\n" + file.syntax().debugDump()));
    }

    public static <T extends AstNode> List<T> all(SourceFile file, Class<T> type) {
        return file.syntax().descendants()
                .map(node -> AstNodes.cast(node, type))
                .flatMap(Optional::stream)
                .toList();
    }

    public static String text(AstNode node) {
        return node.syntax().text();
    }

    public static String text(SyntaxNode node) {
        return node.text();
    }
}
