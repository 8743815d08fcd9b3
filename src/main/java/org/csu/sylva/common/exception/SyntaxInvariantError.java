package org.csu.sylva.common.exception;

import org.csu.sylva.syntax.SyntaxNode;

/**
 * @author hidyouth
 * @description: 语法树的形状违反了文法保证（例如字面量节点里不是字面量 Token）。
 *
 * 这说明文法或解析器本身有缺陷，不是用户输入的问题，所以是 {@link Error} 而不是可恢复的异常。
 */
public class SyntaxInvariantError extends AssertionError {

    public SyntaxInvariantError(SyntaxNode node, String message) {
        super(String.format("Invalid %s node at %s: %s", node.kind(), node.textRange(), message));
    }
}
