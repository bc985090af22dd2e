package org.stmtflow.cfg;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;

/**
 * 把源码解析为 JavaParser 的 AST，语法错误时打印全部问题再抛出
 */
public class SourceParser {

    private final JavaParser parser;

    public SourceParser() {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(config);
    }

    /**
     * @param code 源码
     * @return 编译单元
     * @throws ParseProblemException 源码有语法错误
     */
    public CompilationUnit parse(String code) {
        ParseResult<CompilationUnit> result = parser.parse(code);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }

        System.err.println("❌ [语法错误]");
        result.getProblems().forEach(p -> {
            int line = p.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.line)
                    .orElse(-1);
            System.err.println("   -> Line " + line + ": " + p.getMessage());
        });
        throw new ParseProblemException(result.getProblems());
    }
}
