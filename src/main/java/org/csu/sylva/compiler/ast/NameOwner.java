package org.csu.sylva.compiler.ast;

import org.csu.sylva.compiler.ast.item.Name;

import java.util.Optional;

/**
 * 带有声明名称的节点（函数、参数、let 语句）。
 */
public interface NameOwner extends AstNode {

    default Optional<Name> name() {
        return AstNodes.child(this, Name.class);
    }
}
