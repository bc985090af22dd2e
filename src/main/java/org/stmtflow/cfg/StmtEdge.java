package org.stmtflow.cfg;

import com.github.javaparser.ast.stmt.Statement;

/**
 * 一条出边。目标只记录语句本身，输出时再到 {@link FlowGraph} 里按引用查找对应节点。
 */
public class StmtEdge {
    public final Statement target;
    public final EdgeKind kind;

    public StmtEdge(Statement target, EdgeKind kind) {
        this.target = target;
        this.kind = kind;
    }
}
