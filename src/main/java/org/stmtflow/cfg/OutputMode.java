package org.stmtflow.cfg;

/**
 * 文件里有多个方法时，DOT 文件怎么落盘
 */
public enum OutputMode {
    // 所有方法共用一个输出文件，后处理的方法覆盖前面的，最终只留下最后一个
    SHARED,
    // 每个方法一个文件：<stem>.<方法名>.dot
    PER_FUNCTION
}
