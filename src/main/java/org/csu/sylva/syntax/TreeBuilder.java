package org.csu.sylva.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * @description: 以 {@link TreeSink} 的方式逐步构建 {@link SyntaxTree}。
 *
 * Token 的长度依次累加成偏移量，所以送进来的 Token 必须按源码顺序、不重不漏地覆盖整段文本。
 */
public class TreeBuilder implements TreeSink {

    private final String text;
    private final List<SyntaxKind> kinds = new ArrayList<>();
    private final List<Integer> starts = new ArrayList<>();
    private final List<Integer> ends = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();
    private final List<SyntaxError> errors = new ArrayList<>();
    private final Deque<Integer> open = new ArrayDeque<>();
    private int offset = 0;
    private boolean rootFinished = false;

    public TreeBuilder(String text) {
        this.text = text;
    }

    @Override
    public void startNode(SyntaxKind kind) {
        if (!kind.isNode()) {
            throw new IllegalArgumentException(kind + " is not a node kind");
        }
        if (rootFinished) {
            throw new IllegalStateException("Cannot start " + kind + ": the root node is already finished");
        }
        int index = add(kind, offset, parentOrNone());
        open.push(index);
    }

    @Override
    public void token(SyntaxKind kind, int len) {
        if (!kind.isToken()) {
            throw new IllegalArgumentException(kind + " is not a token kind");
        }
        if (open.isEmpty()) {
            throw new IllegalStateException("Token " + kind + " outside of any node");
        }
        int index = add(kind, offset, open.peek());
        offset += len;
        ends.set(index, offset);
    }

    @Override
    public void finishNode() {
        if (open.isEmpty()) {
            throw new IllegalStateException("finishNode() without a matching startNode()");
        }
        int index = open.pop();
        ends.set(index, offset);
        if (open.isEmpty()) {
            rootFinished = true;
        }
    }

    @Override
    public void error(SyntaxError error) {
        errors.add(error);
    }

    public SyntaxTree finish() {
        if (!open.isEmpty() || kinds.isEmpty()) {
            throw new IllegalStateException("Unbalanced tree: " + open.size() + " node(s) still open");
        }
        if (offset != text.length()) {
            throw new IllegalStateException("Tree covers " + offset + " of " + text.length() + " characters");
        }
        int size = kinds.size();
        SyntaxKind[] kindArray = kinds.toArray(new SyntaxKind[0]);
        int[] startArray = new int[size];
        int[] endArray = new int[size];
        int[] parentArray = new int[size];
        int[][] childArray = new int[size][];
        for (int i = 0; i < size; i++) {
            startArray[i] = starts.get(i);
            endArray[i] = ends.get(i);
            parentArray[i] = parents.get(i);
            List<Integer> nested = children.get(i);
            if (nested != null) {
                childArray[i] = nested.stream().mapToInt(Integer::intValue).toArray();
            }
        }
        return new SyntaxTree(text, errors, kindArray, startArray, endArray, parentArray, childArray);
    }

    private int parentOrNone() {
        return open.isEmpty() ? -1 : open.peek();
    }

    private int add(SyntaxKind kind, int start, int parent) {
        int index = kinds.size();
        kinds.add(kind);
        starts.add(start);
        ends.add(start);
        parents.add(parent);
        children.add(kind.isNode() ? new ArrayList<>() : null);
        if (parent >= 0) {
            children.get(parent).add(index);
        }
        return index;
    }
}
