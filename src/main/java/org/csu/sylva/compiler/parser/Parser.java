package org.csu.sylva.compiler.parser;

import org.csu.sylva.common.util.Debug;
import org.csu.sylva.compiler.lexer.Token;
import org.csu.sylva.compiler.parser.Marker.CompletedMarker;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.TreeSink;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.csu.sylva.syntax.SyntaxKind.*;

/**
 * @author hidyouth
 * @description: 语法分析器
 *
 * 采用递归下降 + 运算符优先级的方法，把 Token 流转换为事件流，再由 {@link EventProcessor} 组装成无损语法树。
 * 遇到错误时只记录错误事件并继续，绝不因为用户输入抛异常，所以得到的树可能缺少部分子节点。
 */
public class Parser {

    private static final Set<SyntaxKind> EXPR_FIRST = EnumSet.of(
            INT_NUMBER, FLOAT_NUMBER, STRING, TRUE_KW, FALSE_KW, IDENT,
            L_PAREN, L_CURLY, IF_KW, RETURN_KW, EXCLAMATION, MINUS
    );

    private static final Set<SyntaxKind> LITERAL_FIRST = EnumSet.of(
            INT_NUMBER, FLOAT_NUMBER, STRING, TRUE_KW, FALSE_KW
    );

    private static final Set<SyntaxKind> EXPR_RECOVERY_SET = EnumSet.of(
            LET_KW, FN_KW, R_CURLY, L_CURLY, R_PAREN, SEMI, COMMA, ELSE_KW
    );

    private static final Set<SyntaxKind> PARAM_RECOVERY_SET = EnumSet.of(R_PAREN, COMMA, L_CURLY, COLON);

    private static final Set<SyntaxKind> NAME_RECOVERY_SET = EnumSet.of(
            L_PAREN, L_CURLY, R_CURLY, COLON, EQ, SEMI, FN_KW, LET_KW
    );

    private static final Set<SyntaxKind> RIGHT_ASSOCIATIVE = EnumSet.of(
            EQ, PLUSEQ, MINUSEQ, STAREQ, SLASHEQ, PERCENTEQ, CARETEQ, CARET
    );

    // 二元运算符的绑定强度，数值越大优先级越高
    private static final Map<SyntaxKind, Integer> INFIX_BINDING_POWER = Map.ofEntries(
            Map.entry(EQ, 1), Map.entry(PLUSEQ, 1), Map.entry(MINUSEQ, 1), Map.entry(STAREQ, 1),
            Map.entry(SLASHEQ, 1), Map.entry(PERCENTEQ, 1), Map.entry(CARETEQ, 1),
            Map.entry(EQEQ, 2), Map.entry(NEQ, 2), Map.entry(LT, 2), Map.entry(LTEQ, 2),
            Map.entry(GT, 2), Map.entry(GTEQ, 2),
            Map.entry(PLUS, 3), Map.entry(MINUS, 3),
            Map.entry(STAR, 4), Map.entry(SLASH, 4), Map.entry(PERCENT, 4),
            Map.entry(CARET, 5)
    );

    private final List<Token> tokens;
    private final List<Event> events = new ArrayList<>();
    private int position = 0;

    /**
     * @param tokens 词法分析结果，trivia 会被跳过
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens.stream().filter(t -> !t.kind().isTrivia()).toList();
    }

    /**
     * 解析一个完整的源文件，并把结果按源码顺序送进 sink。
     *
     * @param tokens 完整的词法分析结果（含 trivia）
     * @param sink   接收节点、Token 和错误的一端
     */
    public static void parse(List<Token> tokens, TreeSink sink) {
        List<Event> events = new Parser(tokens).parseSourceFile();
        new EventProcessor(tokens, events, sink).process();
        Debug.logDebug("Parsed " + tokens.size() + " tokens into " + events.size() + " events");
    }

    List<Event> parseSourceFile() {
        Marker m = start();
        while (!at(EOF)) {
            if (at(FN_KW)) {
                functionDef();
            } else {
                errRecover("expected a function definition", EnumSet.noneOf(SyntaxKind.class));
            }
        }
        m.complete(this, SOURCE_FILE);
        return events;
    }

    // ---------- items ----------

    private void functionDef() {
        Marker m = start();
        bump(FN_KW);
        name();
        if (at(L_PAREN)) {
            paramList();
        } else {
            error("expected function arguments");
        }
        if (at(COLON)) {
            retType();
        }
        if (at(L_CURLY)) {
            block();
        } else {
            error("expected a block");
        }
        m.complete(this, FUNCTION_DEF);
    }

    private void paramList() {
        Marker m = start();
        bump(L_PAREN);
        while (!at(R_PAREN) && !at(EOF) && !at(L_CURLY)) {
            if (at(IDENT)) {
                param();
            } else {
                errRecover("expected value parameter", PARAM_RECOVERY_SET);
                if (at(L_CURLY)) {
                    break;
                }
            }
            if (!at(R_PAREN)) {
                expect(COMMA);
                if (!at(IDENT) && !at(R_PAREN) && !at(COMMA)) {
                    break;
                }
            }
        }
        expect(R_PAREN);
        m.complete(this, PARAM_LIST);
    }

    private void param() {
        Marker m = start();
        name();
        expect(COLON);
        pathType();
        m.complete(this, PARAM);
    }

    private void retType() {
        Marker m = start();
        bump(COLON);
        pathType();
        m.complete(this, RET_TYPE);
    }

    private void pathType() {
        if (!at(IDENT)) {
            error("expected a type");
            return;
        }
        Marker m = start();
        path();
        m.complete(this, PATH_TYPE);
    }

    private void name() {
        if (at(IDENT)) {
            Marker m = start();
            bump(IDENT);
            m.complete(this, NAME);
        } else {
            errRecover("expected a name", NAME_RECOVERY_SET);
        }
    }

    private void nameRef() {
        Marker m = start();
        bump(IDENT);
        m.complete(this, NAME_REF);
    }

    private void path() {
        Marker m = start();
        Marker segment = start();
        nameRef();
        segment.complete(this, PATH_SEGMENT);
        m.complete(this, PATH);
    }

    // ---------- statements ----------

    private CompletedMarker block() {
        Marker m = start();
        bump(L_CURLY);
        while (!at(R_CURLY) && !at(EOF)) {
            if (at(LET_KW)) {
                letStmt();
            } else if (at(SEMI)) {
                bump(SEMI);
            } else if (atExprStart()) {
                CompletedMarker expr = expr();
                if (expr == null || at(R_CURLY)) {
                    continue; // 块末尾的尾表达式不包成语句
                }
                Marker stmt = expr.precede(this);
                if (!eat(SEMI) && expr.kind() != IF_EXPR && expr.kind() != BLOCK_EXPR) {
                    error("expected a ';'");
                }
                stmt.complete(this, EXPR_STMT);
            } else {
                errRecover("expected a statement", EnumSet.of(R_CURLY, FN_KW));
                if (at(FN_KW)) {
                    break;
                }
            }
        }
        expect(R_CURLY);
        return m.complete(this, BLOCK_EXPR);
    }

    private void letStmt() {
        Marker m = start();
        bump(LET_KW);
        name();
        if (eat(COLON)) {
            pathType();
        }
        if (eat(EQ)) {
            if (atExprStart()) {
                expr();
            } else {
                error("expected expression");
            }
        }
        expect(SEMI);
        m.complete(this, LET_STMT);
    }

    // ---------- expressions ----------

    private CompletedMarker expr() {
        return exprBp(1);
    }

    private CompletedMarker exprBp(int minBindingPower) {
        CompletedMarker lhs = lhsExpr();
        if (lhs == null) {
            return null;
        }
        while (true) {
            SyntaxKind op = current();
            Integer bindingPower = INFIX_BINDING_POWER.get(op);
            if (bindingPower == null || bindingPower < minBindingPower) {
                break;
            }
            Marker m = lhs.precede(this);
            bump(op);
            exprBp(RIGHT_ASSOCIATIVE.contains(op) ? bindingPower : bindingPower + 1);
            lhs = m.complete(this, BIN_EXPR);
        }
        return lhs;
    }

    private CompletedMarker lhsExpr() {
        if (at(EXCLAMATION) || at(MINUS)) {
            Marker m = start();
            bump(current());
            lhsExpr();
            return m.complete(this, PREFIX_EXPR);
        }
        CompletedMarker atom = atomExpr();
        return atom == null ? null : postfixExpr(atom);
    }

    private CompletedMarker postfixExpr(CompletedMarker lhs) {
        while (true) {
            if (at(L_PAREN)) {
                Marker m = lhs.precede(this);
                argList();
                lhs = m.complete(this, CALL_EXPR);
            } else if (at(DOT)) {
                Marker m = lhs.precede(this);
                bump(DOT);
                if (at(IDENT)) {
                    nameRef();
                } else {
                    error("expected field name or number");
                }
                lhs = m.complete(this, FIELD_EXPR);
            } else if (at(INDEX)) {
                Marker m = lhs.precede(this);
                bump(INDEX);
                lhs = m.complete(this, FIELD_EXPR);
            } else {
                return lhs;
            }
        }
    }

    private CompletedMarker atomExpr() {
        SyntaxKind kind = current();
        if (LITERAL_FIRST.contains(kind)) {
            Marker m = start();
            bump(kind);
            return m.complete(this, LITERAL);
        }
        switch (kind) {
            case IDENT: {
                Marker m = start();
                path();
                return m.complete(this, PATH_EXPR);
            }
            case L_PAREN: {
                Marker m = start();
                bump(L_PAREN);
                expr();
                expect(R_PAREN);
                return m.complete(this, PAREN_EXPR);
            }
            case IF_KW:
                return ifExpr();
            case L_CURLY:
                return block();
            case RETURN_KW: {
                Marker m = start();
                bump(RETURN_KW);
                if (atExprStart()) {
                    expr();
                }
                return m.complete(this, RETURN_EXPR);
            }
            default:
                errRecover("expected expression", EXPR_RECOVERY_SET);
                return null;
        }
    }

    private CompletedMarker ifExpr() {
        Marker m = start();
        bump(IF_KW);
        Marker condition = start();
        expr();
        condition.complete(this, CONDITION);
        if (at(L_CURLY)) {
            block();
        } else {
            error("expected a block");
        }
        if (eat(ELSE_KW)) {
            if (at(IF_KW)) {
                ifExpr();
            } else if (at(L_CURLY)) {
                block();
            } else {
                error("expected a block");
            }
        }
        return m.complete(this, IF_EXPR);
    }

    private void argList() {
        Marker m = start();
        bump(L_PAREN);
        while (!at(R_PAREN) && !at(EOF)) {
            if (atExprStart()) {
                expr();
            } else {
                errRecover("expected expression", EnumSet.of(R_PAREN, COMMA, SEMI, R_CURLY, L_CURLY));
                if (at(SEMI) || at(R_CURLY) || at(L_CURLY)) {
                    break;
                }
            }
            if (!at(R_PAREN) && !eat(COMMA)) {
                error("expected ','");
                if (!atExprStart()) {
                    break;
                }
            }
        }
        expect(R_PAREN);
        m.complete(this, ARG_LIST);
    }

    // ---------- 辅助方法 ----------

    List<Event> events() {
        return events;
    }

    Marker start() {
        events.add(new Event.Start(null));
        return new Marker(events.size() - 1);
    }

    private void errRecover(String message, Set<SyntaxKind> recovery) {
        if (at(EOF) || recovery.contains(current())) {
            error(message);
            return;
        }
        Marker m = start();
        error(message);
        bump(current());
        m.complete(this, ERROR);
    }

    private void error(String message) {
        events.add(new Event.Error(message));
    }

    private boolean expect(SyntaxKind kind) {
        if (eat(kind)) {
            return true;
        }
        error("expected " + describe(kind));
        return false;
    }

    private boolean eat(SyntaxKind kind) {
        if (!at(kind)) {
            return false;
        }
        bump(kind);
        return true;
    }

    private void bump(SyntaxKind kind) {
        if (!at(kind)) {
            throw new IllegalStateException("Parser bug: expected " + kind + " but found " + current());
        }
        events.add(new Event.Token(kind));
        position++;
    }

    private boolean atExprStart() {
        return EXPR_FIRST.contains(current());
    }

    private boolean at(SyntaxKind kind) {
        return current() == kind;
    }

    private SyntaxKind current() {
        return position < tokens.size() ? tokens.get(position).kind() : EOF;
    }

    private static String describe(SyntaxKind kind) {
        return kind.fixedText() != null ? "'" + kind.fixedText() + "'" : kind.name();
    }
}
