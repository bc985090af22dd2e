package org.stmtflow.cfg;

/**
 * 边的目标语句找不到对应节点时的处理方式
 */
public enum DanglingEdgePolicy {
    // 照常输出，目标留空
    TOLERATE,
    // 抛出 DanglingEdgeException
    FAIL
}
