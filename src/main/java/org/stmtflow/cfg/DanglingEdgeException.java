package org.stmtflow.cfg;

public class DanglingEdgeException extends IllegalStateException {

    private final String sourceNodeId;

    public DanglingEdgeException(String sourceNodeId, EdgeKind kind) {
        super("edge " + kind.tag() + " from " + sourceNodeId + " points at a statement with no node");
        this.sourceNodeId = sourceNodeId;
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }
}
