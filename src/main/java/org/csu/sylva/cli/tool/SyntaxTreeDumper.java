package org.csu.sylva.cli.tool;

import org.csu.sylva.common.util.Debug;
import org.csu.sylva.compiler.ast.SourceFile;
import org.csu.sylva.compiler.ast.expression.BinExpr;
import org.csu.sylva.compiler.ast.expression.ElseBranch;
import org.csu.sylva.compiler.ast.expression.Expr;
import org.csu.sylva.compiler.ast.expression.FieldExpr;
import org.csu.sylva.compiler.ast.expression.FieldKind;
import org.csu.sylva.compiler.ast.expression.IfExpr;
import org.csu.sylva.compiler.ast.expression.Literal;
import org.csu.sylva.compiler.ast.expression.PrefixExpr;
import org.csu.sylva.syntax.LineIndex;
import org.csu.sylva.syntax.SyntaxError;
import org.csu.sylva.syntax.SyntaxNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * 命令行调试工具：打印源文件的语法树、语法错误，以及每个表达式节点的分类结果。
 * <pre>
 *   SyntaxTreeDumper path/to/file.syl
 *   SyntaxTreeDumper -e "fn main() { a.0 + -b }"
 *   SyntaxTreeDumper --debug path/to/file.syl
 * </pre>
 */
public class SyntaxTreeDumper {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length > 0 && "--debug".equals(args[0])) {
            Debug.setEnabled(true);
            args = Arrays.copyOfRange(args, 1, args.length);
        }
        if (args.length == 2 && "-e".equals(args[0])) {
            Debug.log(dump(args[1]));
            return 0;
        }
        if (args.length != 1) {
            Debug.logError("Usage: SyntaxTreeDumper [--debug] <file> | -e <source>");
            return 2;
        }
        try {
            String source = Files.readString(Path.of(args[0]), StandardCharsets.UTF_8);
            Debug.log(dump(source));
            return 0;
        } catch (IOException e) {
            Debug.logError("Cannot read " + args[0] + ": " + e.getMessage());
            return 1;
        }
    }

    public static String dump(String source) {
        SourceFile file = SourceFile.parse(source);
        StringBuilder sb = new StringBuilder(file.syntax().debugDump());

        LineIndex lineIndex = new LineIndex(source);
        for (SyntaxError error : file.errors()) {
            sb.append("[Syntax Error] ").append(lineIndex.lineCol(error.range().start()))
                    .append(' ').append(error.message()).append('\n');
        }

        file.syntax().descendants()
                .map(SyntaxTreeDumper::describe)
                .flatMap(Optional::stream)
                .forEach(line -> sb.append(line).append('\n'));
        return sb.toString();
    }

    private static Optional<String> describe(SyntaxNode node) {
        Optional<Expr> expr = Expr.cast(node);
        if (expr.isEmpty()) {
            return Optional.empty();
        }
        Expr e = expr.get();
        String prefix = node + " ";
        if (e instanceof PrefixExpr prefixExpr) {
            return Optional.of(prefix + "op=" + prefixExpr.opKind().map(Enum::name).orElse("?"));
        } else if (e instanceof BinExpr binExpr) {
            return Optional.of(prefix + "op=" + binExpr.opKind().map(Enum::name).orElse("?"));
        } else if (e instanceof FieldExpr fieldExpr) {
            String field = fieldExpr.fieldAccess().map(SyntaxTreeDumper::describeField).orElse("?");
            return Optional.of(prefix + "field=" + field + " range=" + fieldExpr.fieldRange());
        } else if (e instanceof Literal literal) {
            return Optional.of(prefix + "literal=" + literal.kind());
        } else if (e instanceof IfExpr ifExpr) {
            String branch = ifExpr.elseBranch().map(SyntaxTreeDumper::describeElse).orElse("none");
            return Optional.of(prefix + "else=" + branch);
        }
        return Optional.empty();
    }

    private static String describeField(FieldKind kind) {
        if (kind instanceof FieldKind.Name name) {
            return "Name(" + name.nameRef().text() + ")";
        }
        return "Index(" + ((FieldKind.Index) kind).token().text() + ")";
    }

    private static String describeElse(ElseBranch branch) {
        return branch instanceof ElseBranch.Block ? "Block" : "ElseIf";
    }
}
