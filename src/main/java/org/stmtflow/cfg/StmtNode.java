package org.stmtflow.cfg;

import com.github.javaparser.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * 表示方法中的一条语句（或入口节点）
 */
public class StmtNode {
    public final StmtKind kind;
    public final int lineStart;   // 起始行号，入口节点为 -1

    // 出边，按追加顺序
    public final List<StmtEdge> edges = new ArrayList<>();

    // AST 节点引用，入口节点为 null
    public final transient Statement astNode;

    public StmtNode(Statement astNode, StmtKind kind) {
        this.astNode = astNode;
        this.kind = kind;
        this.lineStart = astNode == null ? -1 : astNode.getBegin().map(p -> p.line).orElse(-1);
    }

    public boolean isEntry() {
        return kind == StmtKind.ENTRY;
    }

    public void addEdge(Statement target, EdgeKind edgeKind) {
        edges.add(new StmtEdge(target, edgeKind));
    }
}
