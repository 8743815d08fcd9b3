package org.csu.sylva.syntax;

import lombok.Getter;

import java.util.List;

/**
 * @description: 无损具体语法树的存储（arena）。
 *
 * 所有节点和 Token 按创建顺序编号，下标 0 是根节点。种别、区间、父节点、子元素都保存在平行数组中，
 * {@link SyntaxNode} 和 {@link SyntaxToken} 只是 (tree, index) 形式的句柄。
 * 树由 {@link TreeBuilder} 一次性构建，之后不可变，可以被多个线程同时读取。
 */
public final class SyntaxTree {

    private static final int[] NO_CHILDREN = new int[0];

    @Getter
    private final String text;
    @Getter
    private final List<SyntaxError> errors;

    private final SyntaxKind[] kinds;
    private final int[] starts;
    private final int[] ends;
    private final int[] parents;
    private final int[][] children;

    SyntaxTree(String text, List<SyntaxError> errors, SyntaxKind[] kinds,
               int[] starts, int[] ends, int[] parents, int[][] children) {
        this.text = text;
        this.errors = List.copyOf(errors);
        this.kinds = kinds;
        this.starts = starts;
        this.ends = ends;
        this.parents = parents;
        this.children = children;
    }

    public SyntaxNode root() {
        return new SyntaxNode(this, 0);
    }

    public int size() {
        return kinds.length;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * 打印整棵树以及错误列表，用于调试和快照式测试。
     */
    public String debugDump() {
        StringBuilder sb = new StringBuilder(root().debugDump());
        for (SyntaxError error : errors) {
            sb.append(error).append('\n');
        }
        return sb.toString();
    }

    // --- 供句柄使用的查询 ---

    SyntaxKind kind(int index) {
        return kinds[index];
    }

    TextRange range(int index) {
        return new TextRange(starts[index], ends[index]);
    }

    int parent(int index) {
        return parents[index];
    }

    int[] children(int index) {
        int[] result = children[index];
        return result == null ? NO_CHILDREN : result;
    }

    SyntaxElement element(int index) {
        return kinds[index].isNode() ? new SyntaxNode(this, index) : new SyntaxToken(this, index);
    }
}
