package org.stmtflow.cfg;

import com.github.javaparser.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 存放一个方法的所有语句节点，第一个节点总是入口节点。
 * 节点只在构建时追加，不删除。
 */
public class FlowGraph {
    public final String functionName;
    public final int beginLine;

    private final List<StmtNode> nodes = new ArrayList<>();

    // JavaParser 的 Node.equals 是结构比较，这里必须按引用区分语句
    private final Map<Statement, StmtNode> stmtIndex = new IdentityHashMap<>();

    public FlowGraph(String functionName, int beginLine) {
        this.functionName = functionName;
        this.beginLine = beginLine;
        nodes.add(new StmtNode(null, StmtKind.ENTRY));
    }

    public StmtNode entry() {
        return nodes.get(0);
    }

    public List<StmtNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    StmtNode addNode(Statement stmt, StmtKind kind) {
        if (stmt == null || kind == StmtKind.ENTRY) {
            throw new IllegalArgumentException("only statements of a non-entry kind can be added");
        }
        if (stmtIndex.containsKey(stmt)) {
            throw new IllegalStateException("statement already has a node: " + stmt);
        }
        StmtNode node = new StmtNode(stmt, kind);
        nodes.add(node);
        stmtIndex.put(stmt, node);
        return node;
    }

    /**
     * 按语句引用查找节点
     *
     * @param target 边指向的语句
     * @return 对应节点；语句没有登记过（例如不支持的语句）时为空
     */
    public Optional<StmtNode> resolve(Statement target) {
        if (target == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(stmtIndex.get(target));
    }
}
