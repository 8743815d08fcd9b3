package org.csu.sylva.compiler.parser;

import org.csu.sylva.compiler.lexer.Token;
import org.csu.sylva.syntax.SyntaxError;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.TextRange;
import org.csu.sylva.syntax.TreeSink;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 把解析器的事件流和完整的 Token 序列（含 trivia）合并，按源码顺序喂给 {@link TreeSink}。
 *
 * trivia 的归属规则：节点开始前的空白和注释挂在外层节点上，文件末尾剩余的 trivia 挂在根节点上。
 */
final class EventProcessor {

    private final List<Token> tokens;
    private final List<Event> events;
    private final TreeSink sink;
    private final int textLength;
    private int tokenPos = 0;
    private int depth = 0;

    EventProcessor(List<Token> tokens, List<Event> events, TreeSink sink) {
        this.tokens = tokens;
        this.events = events;
        this.sink = sink;
        this.textLength = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).range().end();
    }

    void process() {
        boolean[] consumed = new boolean[events.size()];
        List<SyntaxKind> pending = new ArrayList<>();
        for (int i = 0; i < events.size(); i++) {
            if (consumed[i]) {
                continue;
            }
            Event event = events.get(i);
            if (event instanceof Event.Start start) {
                pending.clear();
                int idx = i;
                Event.Start current = start;
                while (true) {
                    if (current.kind != null) {
                        pending.add(current.kind);
                    }
                    if (current.forwardParent == 0) {
                        break;
                    }
                    idx += current.forwardParent;
                    consumed[idx] = true;
                    current = (Event.Start) events.get(idx);
                }
                // 最外层的父节点最后被 precede，需要最先打开
                for (int k = pending.size() - 1; k >= 0; k--) {
                    startNode(pending.get(k));
                }
            } else if (event instanceof Event.Token token) {
                token(token.kind());
            } else if (event instanceof Event.Finish) {
                finishNode();
            } else if (event instanceof Event.Error error) {
                sink.error(new SyntaxError(error.message(), TextRange.empty(nextSignificantOffset())));
            }
        }
    }

    private void startNode(SyntaxKind kind) {
        if (depth > 0) {
            eatTrivia();
        }
        sink.startNode(kind);
        depth++;
    }

    private void finishNode() {
        if (depth == 1) {
            eatTrivia();
        }
        sink.finishNode();
        depth--;
    }

    private void token(SyntaxKind kind) {
        eatTrivia();
        Token token = tokens.get(tokenPos++);
        if (token.kind() != kind) {
            throw new IllegalStateException("Parser bug: event " + kind + " does not match " + token);
        }
        sink.token(kind, token.len());
    }

    private void eatTrivia() {
        while (tokenPos < tokens.size() && tokens.get(tokenPos).kind().isTrivia()) {
            Token trivia = tokens.get(tokenPos++);
            sink.token(trivia.kind(), trivia.len());
        }
    }

    private int nextSignificantOffset() {
        for (int i = tokenPos; i < tokens.size(); i++) {
            if (!tokens.get(i).kind().isTrivia()) {
                return tokens.get(i).offset();
            }
        }
        return textLength;
    }
}
