package org.stmtflow.cfg;

/**
 * 图节点的类别（封闭集合）
 */
public enum StmtKind {
    ENTRY("entry"),
    EXPRESSION("expr"),
    RETURN("return"),
    CONDITIONAL("if"),
    COUNTED_LOOP("for"),
    ITERATION_LOOP("foreach");

    private final String tag;

    StmtKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isLoop() {
        return this == COUNTED_LOOP || this == ITERATION_LOOP;
    }
}
