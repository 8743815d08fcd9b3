package org.csu.sylva.compiler.ast;

import org.csu.sylva.common.exception.ParseException;
import org.csu.sylva.common.util.Debug;
import org.csu.sylva.compiler.ast.item.FunctionDef;
import org.csu.sylva.compiler.lexer.Lexer;
import org.csu.sylva.compiler.lexer.Token;
import org.csu.sylva.compiler.parser.Parser;
import org.csu.sylva.syntax.LineIndex;
import org.csu.sylva.syntax.SyntaxError;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;
import org.csu.sylva.syntax.SyntaxTree;
import org.csu.sylva.syntax.TreeBuilder;

import java.util.List;

/**
 * AST 节点: 整个源文件，也是解析的入口。
 */
public record SourceFile(SyntaxNode syntax) implements AstNode {

    public SourceFile {
        AstNodes.requireKind(syntax, SyntaxKind.SOURCE_FILE);
    }

    /**
     * 词法分析 + 语法分析。对任何输入都会返回一棵覆盖全部文本的树，语法错误记录在树上。
     */
    public static SourceFile parse(String text) {
        List<Token> tokens = new Lexer(text).tokenize();
        TreeBuilder builder = new TreeBuilder(text);
        Parser.parse(tokens, builder);
        SyntaxTree tree = builder.finish();
        if (tree.hasErrors()) {
            Debug.logDebug("Source has " + tree.getErrors().size() + " syntax error(s): " + tree.getErrors());
        }
        return new SourceFile(tree.root());
    }

    public List<FunctionDef> functions() {
        return AstNodes.children(this, FunctionDef.class);
    }

    public SyntaxTree tree() {
        return syntax.tree();
    }

    public List<SyntaxError> errors() {
        return syntax.tree().getErrors();
    }

    /**
     * 要求源码没有语法错误，否则抛出 {@link ParseException}。
     */
    public SourceFile ok() {
        if (tree().hasErrors()) {
            throw new ParseException(errors(), new LineIndex(tree().getText()));
        }
        return this;
    }
}
