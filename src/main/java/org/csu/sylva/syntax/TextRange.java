package org.csu.sylva.syntax;

/**
 * 一段源码区间 [start, end)，以字符偏移量表示。
 *
 * @param start 起始偏移（包含）
 * @param end   结束偏移（不包含）
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid text range: " + start + ".." + end);
        }
    }

    public static TextRange fromTo(int start, int end) {
        return new TextRange(start, end);
    }

    public static TextRange empty(int offset) {
        return new TextRange(offset, offset);
    }

    public int len() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return start <= offset && offset < end;
    }

    public boolean containsRange(TextRange other) {
        return start <= other.start && other.end <= end;
    }

    public String substring(String text) {
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
