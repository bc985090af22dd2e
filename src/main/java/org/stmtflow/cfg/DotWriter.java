package org.stmtflow.cfg;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * 把 {@link FlowGraph} 输出为 Graphviz DOT 文本：先全部节点，再全部边。
 */
public class DotWriter {

    public static final String HEADER = "digraph CFG {";
    public static final String FOOTER = "}";
    public static final String ENTRY_SHAPE = "diamond";
    public static final String STMT_SHAPE = "box";
    public static final String ENTRY_ID = "entry";

    private final DanglingEdgePolicy danglingEdgePolicy;

    public DotWriter(DanglingEdgePolicy danglingEdgePolicy) {
        this.danglingEdgePolicy = danglingEdgePolicy;
    }

    public DotWriter() {
        this(DanglingEdgePolicy.TOLERATE);
    }

    /**
     * @param g      要输出的图
     * @param source 方法所在文件的源码，用来取节点标签
     * @param out    输出目标
     * @throws IOException          写出失败
     * @throws DanglingEdgeException 策略为 FAIL 且有边找不到目标节点
     */
    public void write(FlowGraph g, CharSequence source, Appendable out) throws IOException {
        out.append(HEADER).append('\n');
        for (StmtNode node : g.nodes()) {
            out.append("  ").append(nodeId(node))
                    .append(" [label=\"").append(escape(SourceLines.lineAt(node.astNode, source)))
                    .append("\", shape=\"").append(node.isEntry() ? ENTRY_SHAPE : STMT_SHAPE)
                    .append("\"];\n");
        }
        for (StmtNode node : g.nodes()) {
            for (StmtEdge edge : node.edges) {
                out.append("  ").append(nodeId(node)).append(" -> ")
                        .append(targetId(g, node, edge)).append(";\n");
            }
        }
        out.append(FOOTER).append('\n');
    }

    public String render(FlowGraph g, CharSequence source) {
        StringBuilder sb = new StringBuilder();
        try {
            write(g, source, sb);
        } catch (IOException e) {
            // StringBuilder 不会抛 IOException
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    private String targetId(FlowGraph g, StmtNode from, StmtEdge edge) {
        Optional<StmtNode> target = g.resolve(edge.target);
        if (target.isPresent()) {
            return nodeId(target.get());
        }
        if (danglingEdgePolicy == DanglingEdgePolicy.FAIL) {
            throw new DanglingEdgeException(nodeId(from), edge.kind);
        }
        return "";
    }

    /**
     * 节点标识：入口为 {@code entry}，其它为 {@code node<行>_<列>}
     */
    public static String nodeId(StmtNode node) {
        if (node.astNode == null) {
            return ENTRY_ID;
        }
        return node.astNode.getBegin()
                .map(p -> "node" + p.line + "_" + p.column)
                .orElseGet(() -> "node" + System.identityHashCode(node.astNode));
    }

    static String escape(String label) {
        StringBuilder sb = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c == '\\' || c == '"') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
