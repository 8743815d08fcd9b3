package org.csu.sylva.compiler.ast.expression;

/**
 * else 分支的两种合法形状：终结的代码块，或者继续链接的 else-if。
 */
public interface ElseBranch {

    record Block(BlockExpr block) implements ElseBranch {
    }

    /**
     * 嵌套的条件表达式，对它再调用 {@link IfExpr#elseBranch()} 即可沿着链继续向下。
     */
    record ElseIf(IfExpr ifExpr) implements ElseBranch {
    }
}
