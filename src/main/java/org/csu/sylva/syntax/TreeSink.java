package org.csu.sylva.syntax;

/**
 * 解析器输出的接收端。解析器按源码顺序调用这些方法，实现方负责把它们组装成一棵树。
 */
public interface TreeSink {

    void startNode(SyntaxKind kind);

    /**
     * 追加一个长度为 {@code len} 的 Token 到当前打开的节点。
     */
    void token(SyntaxKind kind, int len);

    void finishNode();

    void error(SyntaxError error);
}
