package org.stmtflow.cfg;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * 以 JSON 形式输出同一张图，方便脚本处理。边的目标同样按语句引用解析，找不到时省略 to 字段。
 */
public class GraphJsonExporter {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    public String toJson(FlowGraph g, CharSequence source) {
        return gson.toJson(toView(g, source));
    }

    GraphView toView(FlowGraph g, CharSequence source) {
        GraphView view = new GraphView();
        view.function = g.functionName;
        for (StmtNode node : g.nodes()) {
            NodeView nv = new NodeView();
            nv.id = DotWriter.nodeId(node);
            nv.kind = node.kind.tag();
            nv.line = node.lineStart;
            nv.label = SourceLines.lineAt(node.astNode, source);
            view.nodes.add(nv);
        }
        for (StmtNode node : g.nodes()) {
            for (StmtEdge edge : node.edges) {
                EdgeView ev = new EdgeView();
                ev.from = DotWriter.nodeId(node);
                ev.to = g.resolve(edge.target).map(DotWriter::nodeId).orElse(null);
                ev.kind = edge.kind.tag();
                view.edges.add(ev);
            }
        }
        return view;
    }

    static class GraphView {
        String function;
        List<NodeView> nodes = new ArrayList<>();
        List<EdgeView> edges = new ArrayList<>();
    }

    static class NodeView {
        String id;
        String kind;
        int line;
        String label;
    }

    static class EdgeView {
        String from;
        String to;
        String kind;
    }
}
