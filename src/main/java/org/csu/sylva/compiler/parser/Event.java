package org.csu.sylva.compiler.parser;

import org.csu.sylva.syntax.SyntaxKind;

/**
 * 解析器产生的扁平事件流，由 {@link EventProcessor} 转换成树。
 */
interface Event {

    /**
     * 开始一个节点。kind 在对应的 Marker 完成之前为 null。
     * forwardParent 是相对偏移，指向后来通过 precede 插入的父节点的 Start 事件，0 表示没有。
     */
    final class Start implements Event {
        SyntaxKind kind;
        int forwardParent;

        Start(SyntaxKind kind) {
            this.kind = kind;
        }

        @Override
        public String toString() {
            return "Start(" + kind + ", " + forwardParent + ")";
        }
    }

    /**
     * 消费下一个非 trivia 的 Token。
     */
    record Token(SyntaxKind kind) implements Event {
    }

    record Finish() implements Event {
    }

    record Error(String message) implements Event {
    }
}
