package org.csu.sylva.compiler.ast;

import org.csu.sylva.syntax.SyntaxNode;

/**
 * AST 节点: 对某个产生式的类型化视图，只包装一个 {@link SyntaxNode}，本身不保存任何状态。
 */
public interface AstNode {

    SyntaxNode syntax();
}
