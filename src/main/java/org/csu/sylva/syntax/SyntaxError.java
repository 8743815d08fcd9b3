package org.csu.sylva.syntax;

/**
 * 解析过程中记录下来的语法错误。解析器不会因为用户输入错误而抛异常，而是把错误挂在语法树上。
 *
 * @param message 错误描述
 * @param range   出错位置（可能是零宽区间）
 */
public record SyntaxError(String message, TextRange range) {

    @Override
    public String toString() {
        return "error " + range + ": " + message;
    }
}
