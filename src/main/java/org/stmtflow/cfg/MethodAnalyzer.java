package org.stmtflow.cfg;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;

import java.util.Optional;

/**
 * 方法分析器，为一个方法或构造器生成近似控制流图
 * <p>
 * 没有方法体的声明（抽象方法、接口方法、native 方法）没有可分析的语句，直接跳过。
 */
public class MethodAnalyzer {

    /**
     * 分析给定的方法或构造器声明
     *
     * @param declaration 方法或构造器
     * @return 构建好的图；没有方法体时为空
     */
    public Optional<FlowGraph> analyze(CallableDeclaration<?> declaration) {
        String name = declaration.getNameAsString();
        int beginLine = declaration.getBegin().map(p -> p.line).orElse(-1);

        Optional<BlockStmt> body = bodyOf(declaration);
        if (body.isEmpty()) {
            System.err.println("skipping " + name + " (line " + beginLine + "): no body");
            return Optional.empty();
        }
        return Optional.of(GraphBuilder.build(name, beginLine, body.get()));
    }

    private static Optional<BlockStmt> bodyOf(CallableDeclaration<?> declaration) {
        if (declaration instanceof MethodDeclaration md) {
            return md.getBody();
        }
        if (declaration instanceof ConstructorDeclaration cd) {
            return Optional.of(cd.getBody());
        }
        return Optional.empty();
    }
}
