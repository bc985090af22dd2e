package org.stmtflow.cfg;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 一次完整的运行：读源码 -> 解析 -> 对每个方法建图 -> 写 DOT
 */
public class CfgDotRunner {

    private final RunOptions options;
    private final SourceParser sourceParser = new SourceParser();
    private final MethodAnalyzer analyzer = new MethodAnalyzer();
    private final GraphJsonExporter jsonExporter = new GraphJsonExporter();
    private final DotWriter dotWriter;

    public CfgDotRunner(RunOptions options) {
        this.options = options;
        this.dotWriter = new DotWriter(options.danglingEdgePolicy());
    }

    /**
     * @return 按写出顺序排列的输出文件（SHARED 模式下同一路径会重复出现）
     * @throws IOException           读输入或写输出失败
     * @throws ParseProblemException 输入有语法错误
     * @throws DanglingEdgeException FAIL 策略下出现悬空边
     */
    public List<Path> run() throws IOException {
        String source = Files.readString(options.input(), StandardCharsets.UTF_8);
        CompilationUnit cu = sourceParser.parse(source);

        List<Path> written = new ArrayList<>();
        Set<Path> used = new HashSet<>();
        for (CallableDeclaration<?> declaration : cu.findAll(CallableDeclaration.class)) {
            Optional<FlowGraph> graph = analyzer.analyze(declaration);
            if (graph.isEmpty()) {
                continue;
            }
            FlowGraph g = graph.get();
            System.out.println("===== Function: " + g.functionName + " =====");

            Path target = targetFor(g, used);
            try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                dotWriter.write(g, source, out);
            }
            written.add(target);

            if (options.printJson()) {
                System.out.println(jsonExporter.toJson(g, source));
            }
        }

        if (written.isEmpty()) {
            System.err.println("no function with a body found in " + options.input());
        }
        return written;
    }

    Path targetFor(FlowGraph g, Set<Path> used) {
        Path output = options.output();
        if (options.outputMode() == OutputMode.SHARED) {
            return output;
        }
        String fileName = output.getFileName().toString();
        String stem = fileName.endsWith(".dot") ? fileName.substring(0, fileName.length() - 4) : fileName;

        Path target = output.resolveSibling(stem + "." + g.functionName + ".dot");
        if (!used.add(target)) {
            // 重载方法同名，追加起始行号区分
            target = output.resolveSibling(stem + "." + g.functionName + "_L" + g.beginLine + ".dot");
            used.add(target);
        }
        return target;
    }
}
