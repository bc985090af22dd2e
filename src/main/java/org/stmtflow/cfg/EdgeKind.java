package org.stmtflow.cfg;

public enum EdgeKind {
    // 结构上的后继（父容器 -> 子语句）
    NEXT("next"),
    // 循环体执行完回到循环头，总是自环
    LOOP("loop");

    private final String tag;

    EdgeKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
