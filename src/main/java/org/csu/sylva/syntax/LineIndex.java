package org.csu.sylva.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 偏移量与 (行, 列) 之间的换算，行列号都从 1 开始。
 */
public final class LineIndex {

    public record LineCol(int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    private final List<Integer> lineStarts;
    private final int length;

    public LineIndex(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = Collections.unmodifiableList(starts);
        this.length = text.length();
    }

    public LineCol lineCol(int offset) {
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside of 0.." + length);
        }
        int line = Collections.binarySearch(lineStarts, offset);
        if (line < 0) {
            line = -line - 2;
        }
        return new LineCol(line + 1, offset - lineStarts.get(line) + 1);
    }

    public int offset(LineCol position) {
        int line = position.line() - 1;
        if (line < 0 || line >= lineStarts.size()) {
            throw new IndexOutOfBoundsException("Line " + position.line() + " outside of 1.." + lineStarts.size());
        }
        return Math.min(lineStarts.get(line) + position.column() - 1, length);
    }

    public int lineCount() {
        return lineStarts.size();
    }
}
