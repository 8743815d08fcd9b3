package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.compiler.ast.NameOwner;
import org.csu.sylva.compiler.ast.expression.BlockExpr;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

/**
 * @author hidyouth
 * @description: AST 节点: 函数定义 fn name(params): Type { ... }
 */
public record FunctionDef(SyntaxNode syntax) implements NameOwner {

    public FunctionDef {
        AstNodes.requireKind(syntax, SyntaxKind.FUNCTION_DEF);
    }

    public Optional<ParamList> paramList() {
        return AstNodes.child(this, ParamList.class);
    }

    public Optional<RetType> retType() {
        return AstNodes.child(this, RetType.class);
    }

    public Optional<BlockExpr> body() {
        return AstNodes.child(this, BlockExpr.class);
    }
}
