package org.stmtflow.cfg;

import com.github.javaparser.ast.stmt.Statement;

/**
 * 从原始源码中取出某个位置所在的整行，作为节点标签。
 * 行结束符为 {@code \n}、{@code \r} 或 {@code \r\n}，结果不含结束符，保留行首缩进。
 */
public final class SourceLines {

    private SourceLines() {
    }

    /**
     * 返回 offset 所在的那一行
     *
     * @param offset 字符偏移，允许等于 buffer 长度；为 null 时返回空串
     * @param buffer 源码
     * @return 该行原文
     */
    public static String lineAt(Integer offset, CharSequence buffer) {
        if (offset == null) {
            return "";
        }
        if (offset < 0 || offset > buffer.length()) {
            throw new IllegalArgumentException("offset " + offset + " outside buffer of length " + buffer.length());
        }
        int start = offset;
        while (start > 0 && !isTerminator(buffer.charAt(start - 1))) {
            start--;
        }
        int end = offset;
        while (end < buffer.length() && !isTerminator(buffer.charAt(end))) {
            end++;
        }
        return buffer.subSequence(start, end).toString();
    }

    /**
     * 语句起始位置所在的行；语句为 null（入口节点）或没有位置信息时返回空串
     */
    public static String lineAt(Statement stmt, CharSequence buffer) {
        if (stmt == null || stmt.getBegin().isEmpty()) {
            return "";
        }
        return lineAt(lineStartOffset(stmt.getBegin().get().line, buffer), buffer);
    }

    /**
     * 第 line 行（从 1 开始）的起始偏移
     */
    public static int lineStartOffset(int line, CharSequence buffer) {
        if (line < 1) {
            throw new IllegalArgumentException("line numbers start at 1: " + line);
        }
        int current = 1;
        int i = 0;
        while (current < line) {
            if (i >= buffer.length()) {
                throw new IllegalArgumentException("line " + line + " is past the end of the buffer");
            }
            char c = buffer.charAt(i++);
            if (c == '\r' && i < buffer.length() && buffer.charAt(i) == '\n') {
                i++;
            }
            if (isTerminator(c)) {
                current++;
            }
        }
        return i;
    }

    private static boolean isTerminator(char c) {
        return c == '\n' || c == '\r';
    }
}
