package org.stmtflow.cfg;

import com.github.javaparser.ast.stmt.*;

import java.util.List;
import java.util.Optional;

/**
 * 构建近似控制流图。
 * <p>
 * 这里不是真正的 CFG：每个分支/循环体里的语句都从所在容器（if 或循环节点）连出 next 边，
 * 而不是从前一条兄弟语句连出；分支汇合处不建节点；return 等提前跳出也不连边。
 * 得到的是一棵按语法嵌套展开的树，外加每个循环节点上的一条 loop 自环。
 */
public final class GraphBuilder {

    private GraphBuilder() {
    }

    /**
     * 对一个方法体做一次深度优先遍历，生成新的图
     *
     * @param functionName 方法名
     * @param beginLine    方法声明的起始行
     * @param body         方法体
     * @return 以入口节点开头的图
     */
    public static FlowGraph build(String functionName, int beginLine, BlockStmt body) {
        FlowGraph g = new FlowGraph(functionName, beginLine);
        visitSequence(body.getStatements(), g.entry(), g);
        return g;
    }

    private static void visitSequence(List<Statement> stmts, StmtNode parent, FlowGraph g) {
        for (Statement s : stmts) {
            visit(s, parent, g);
        }
    }

    private static void visit(Statement stmt, StmtNode parent, FlowGraph g) {
        Optional<StmtKind> kind = StmtClassifier.classify(stmt);
        if (kind.isEmpty()) {
            // 不支持的语句：不建节点，也不进入其子语句
            System.err.println("unsupported statement type: " + stmt.getClass().getSimpleName()
                    + " (line " + stmt.getBegin().map(p -> p.line).orElse(-1) + ")");
            return;
        }

        StmtNode node = g.addNode(stmt, kind.get());
        parent.addEdge(stmt, EdgeKind.NEXT);

        switch (kind.get()) {
            case CONDITIONAL -> {
                IfStmt is = stmt.asIfStmt();
                // then 和 else 的父节点都是 if 本身
                visitSequence(sequenceOf(is.getThenStmt()), node, g);
                is.getElseStmt().ifPresent(e -> visitSequence(sequenceOf(e), node, g));
            }
            case COUNTED_LOOP -> {
                visitSequence(sequenceOf(stmt.asForStmt().getBody()), node, g);
                node.addEdge(stmt, EdgeKind.LOOP);
            }
            case ITERATION_LOOP -> {
                visitSequence(sequenceOf(stmt.asForEachStmt().getBody()), node, g);
                node.addEdge(stmt, EdgeKind.LOOP);
            }
            default -> {
                // 表达式、return 没有子语句
            }
        }
    }

    /**
     * 分支或循环体对应的语句序列。花括号块取其中的语句，单条语句（包括 else if）自成一个序列。
     */
    static List<Statement> sequenceOf(Statement body) {
        if (body.isBlockStmt()) {
            return body.asBlockStmt().getStatements();
        }
        return List.of(body);
    }
}
