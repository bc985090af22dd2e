package org.stmtflow.cfg;

import com.github.javaparser.ParseProblemException;

import java.io.IOException;

/**
 * 读取一个 Java 文件，对其中的每个方法：
 * - 按语句嵌套构建近似控制流图
 * - 输出 DOT（默认写到 output.dot）
 */
public class Main {

    public static void main(String[] args) {
        RunOptions options;
        try {
            options = RunOptions.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(RunOptions.USAGE);
            System.exit(2);
            return;
        }

        try {
            new CfgDotRunner(options).run();
        } catch (ParseProblemException e) {
            System.err.println("cannot parse " + options.input());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("I/O error: " + e);
            System.exit(1);
        } catch (DanglingEdgeException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }
}
