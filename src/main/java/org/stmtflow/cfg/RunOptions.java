package org.stmtflow.cfg;

import java.nio.file.Path;
import java.util.Objects;

public record RunOptions(Path input, Path output, OutputMode outputMode,
                         DanglingEdgePolicy danglingEdgePolicy, boolean printJson) {

    public static final String USAGE =
            "usage: stmt-flow-dot [--input <file>] [--output <file>] [--per-function] [--strict] [--json]";

    public RunOptions {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(outputMode, "outputMode");
        Objects.requireNonNull(danglingEdgePolicy, "danglingEdgePolicy");
    }

    public static RunOptions defaultOptions() {
        return new RunOptions(Path.of("input.java"), Path.of("output.dot"),
                OutputMode.SHARED, DanglingEdgePolicy.TOLERATE, false);
    }

    /**
     * 解析命令行参数，没给的项用默认值
     *
     * @throws IllegalArgumentException 未知参数或缺少参数值
     */
    public static RunOptions fromArgs(String[] args) {
        RunOptions defaults = defaultOptions();
        Path input = defaults.input();
        Path output = defaults.output();
        OutputMode mode = defaults.outputMode();
        DanglingEdgePolicy policy = defaults.danglingEdgePolicy();
        boolean json = defaults.printJson();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--input" -> input = Path.of(valueOf(args, ++i, arg));
                case "--output" -> output = Path.of(valueOf(args, ++i, arg));
                case "--per-function" -> mode = OutputMode.PER_FUNCTION;
                case "--strict" -> policy = DanglingEdgePolicy.FAIL;
                case "--json" -> json = true;
                default -> throw new IllegalArgumentException("unknown argument: " + arg);
            }
        }
        return new RunOptions(input, output, mode, policy, json);
    }

    private static String valueOf(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("missing value for " + flag);
        }
        return args[index];
    }
}
