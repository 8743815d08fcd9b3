package org.csu.sylva.compiler.ast.stmt;

import org.csu.sylva.compiler.ast.AstNode;

public interface Stmt extends AstNode {
}
