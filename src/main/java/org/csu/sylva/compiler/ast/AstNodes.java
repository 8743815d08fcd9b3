package org.csu.sylva.compiler.ast;

import org.csu.sylva.compiler.ast.expression.ArgList;
import org.csu.sylva.compiler.ast.expression.BinExpr;
import org.csu.sylva.compiler.ast.expression.BlockExpr;
import org.csu.sylva.compiler.ast.expression.CallExpr;
import org.csu.sylva.compiler.ast.expression.Condition;
import org.csu.sylva.compiler.ast.expression.FieldExpr;
import org.csu.sylva.compiler.ast.expression.IfExpr;
import org.csu.sylva.compiler.ast.expression.Literal;
import org.csu.sylva.compiler.ast.expression.ParenExpr;
import org.csu.sylva.compiler.ast.expression.PathExpr;
import org.csu.sylva.compiler.ast.expression.PrefixExpr;
import org.csu.sylva.compiler.ast.expression.ReturnExpr;
import org.csu.sylva.compiler.ast.item.FunctionDef;
import org.csu.sylva.compiler.ast.item.Name;
import org.csu.sylva.compiler.ast.item.NameRef;
import org.csu.sylva.compiler.ast.item.Param;
import org.csu.sylva.compiler.ast.item.ParamList;
import org.csu.sylva.compiler.ast.item.Path;
import org.csu.sylva.compiler.ast.item.PathSegment;
import org.csu.sylva.compiler.ast.item.PathType;
import org.csu.sylva.compiler.ast.item.RetType;
import org.csu.sylva.compiler.ast.stmt.ExprStmt;
import org.csu.sylva.compiler.ast.stmt.LetStmt;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;
import org.csu.sylva.syntax.SyntaxToken;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * @description: 节点种别到类型化包装的唯一登记表，以及在子节点中查找包装的公共方法。
 *
 * 新增产生式时只需要在静态块里加一行 {@link #register}。
 */
public final class AstNodes {

    private record Entry(Class<? extends AstNode> type, Function<SyntaxNode, ? extends AstNode> factory) {
    }

    private static final Map<SyntaxKind, Entry> REGISTRY = new EnumMap<>(SyntaxKind.class);

    static {
        register(SyntaxKind.SOURCE_FILE, SourceFile.class, SourceFile::new);
        register(SyntaxKind.FUNCTION_DEF, FunctionDef.class, FunctionDef::new);
        register(SyntaxKind.PARAM_LIST, ParamList.class, ParamList::new);
        register(SyntaxKind.PARAM, Param.class, Param::new);
        register(SyntaxKind.RET_TYPE, RetType.class, RetType::new);
        register(SyntaxKind.PATH_TYPE, PathType.class, PathType::new);
        register(SyntaxKind.NAME, Name.class, Name::new);
        register(SyntaxKind.NAME_REF, NameRef.class, NameRef::new);
        register(SyntaxKind.PATH, Path.class, Path::new);
        register(SyntaxKind.PATH_SEGMENT, PathSegment.class, PathSegment::new);
        register(SyntaxKind.ARG_LIST, ArgList.class, ArgList::new);
        register(SyntaxKind.CONDITION, Condition.class, Condition::new);
        register(SyntaxKind.LET_STMT, LetStmt.class, LetStmt::new);
        register(SyntaxKind.EXPR_STMT, ExprStmt.class, ExprStmt::new);
        register(SyntaxKind.BLOCK_EXPR, BlockExpr.class, BlockExpr::new);
        register(SyntaxKind.LITERAL, Literal.class, Literal::new);
        register(SyntaxKind.PATH_EXPR, PathExpr.class, PathExpr::new);
        register(SyntaxKind.PAREN_EXPR, ParenExpr.class, ParenExpr::new);
        register(SyntaxKind.PREFIX_EXPR, PrefixExpr.class, PrefixExpr::new);
        register(SyntaxKind.BIN_EXPR, BinExpr.class, BinExpr::new);
        register(SyntaxKind.FIELD_EXPR, FieldExpr.class, FieldExpr::new);
        register(SyntaxKind.CALL_EXPR, CallExpr.class, CallExpr::new);
        register(SyntaxKind.IF_EXPR, IfExpr.class, IfExpr::new);
        register(SyntaxKind.RETURN_EXPR, ReturnExpr.class, ReturnExpr::new);
    }

    private AstNodes() {
    }

    private static <T extends AstNode> void register(SyntaxKind kind, Class<T> type, Function<SyntaxNode, T> factory) {
        REGISTRY.put(kind, new Entry(type, factory));
    }

    /**
     * 给定种别的节点能否被看作 {@code type}（可以是具体包装类，也可以是 {@code Expr} 这样的接口）。
     */
    public static boolean canCast(SyntaxKind kind, Class<? extends AstNode> type) {
        Entry entry = REGISTRY.get(kind);
        return entry != null && type.isAssignableFrom(entry.type());
    }

    /**
     * 种别匹配时返回类型化视图，否则返回空。这是构造包装的唯一检查点。
     */
    public static <T extends AstNode> Optional<T> cast(SyntaxNode node, Class<T> type) {
        Entry entry = REGISTRY.get(node.kind());
        if (entry == null || !type.isAssignableFrom(entry.type())) {
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.factory().apply(node)));
    }

    /**
     * 第一个能被看作 {@code type} 的直接子节点。
     */
    public static <T extends AstNode> Optional<T> child(AstNode parent, Class<T> type) {
        return childStream(parent, type).findFirst();
    }

    public static <T extends AstNode> List<T> children(AstNode parent, Class<T> type) {
        return childStream(parent, type).toList();
    }

    /**
     * 第一个种别为 {@code kind} 的直接子 Token。
     */
    public static Optional<SyntaxToken> token(AstNode parent, SyntaxKind kind) {
        return parent.syntax().childrenWithTokens().stream()
                .filter(element -> element.kind() == kind)
                .flatMap(element -> element.asToken().stream())
                .findFirst();
    }

    /**
     * 包装类构造时调用，拒绝种别不符的节点。
     */
    public static void requireKind(SyntaxNode node, SyntaxKind expected) {
        if (node == null) {
            throw new IllegalArgumentException("Cannot wrap a null node as " + expected);
        }
        if (node.kind() != expected) {
            throw new IllegalArgumentException("Cannot wrap " + node + " as " + expected);
        }
    }

    private static <T extends AstNode> Stream<T> childStream(AstNode parent, Class<T> type) {
        return parent.syntax().children().stream()
                .filter(node -> canCast(node.kind(), type))
                .map(node -> type.cast(REGISTRY.get(node.kind()).factory().apply(node)));
    }
}
