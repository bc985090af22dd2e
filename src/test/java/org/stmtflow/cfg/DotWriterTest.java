package org.stmtflow.cfg;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DotWriterTest {

    private static final String IF_ELSE = ""
            + "class T {\n"
            + "    int f(boolean cond, int x, int y) {\n"
            + "        if (cond) {\n"
            + "            return x;\n"
            + "        } else {\n"
            + "            return y;\n"
            + "        }\n"
            + "    }\n"
            + "}\n";

    private static final String LOOP = ""
            + "class T {\n"
            + "    void f(int n, int x) {\n"
            + "        for (int i = 0; i < n; i++) {\n"
            + "            x++;\n"
            + "        }\n"
            + "        System.out.println(\"done \\\\ \" + x);\n"
            + "    }\n"
            + "}\n";

    private static FlowGraph graphOf(String src) {
        final MethodDeclaration md = new SourceParser().parse(src).findFirst(MethodDeclaration.class).orElseThrow();
        return new MethodAnalyzer().analyze(md).orElseThrow();
    }

    @Test
    void whenRendering_givenIfElse_shouldEmitNodesThenEdges() {
        final String dot = new DotWriter().render(graphOf(IF_ELSE), IF_ELSE);

        assertEquals(""
                + "digraph CFG {\n"
                + "  entry [label=\"\", shape=\"diamond\"];\n"
                + "  node3_9 [label=\"        if (cond) {\", shape=\"box\"];\n"
                + "  node4_13 [label=\"            return x;\", shape=\"box\"];\n"
                + "  node6_13 [label=\"            return y;\", shape=\"box\"];\n"
                + "  entry -> node3_9;\n"
                + "  node3_9 -> node4_13;\n"
                + "  node3_9 -> node6_13;\n"
                + "}\n", dot);
    }

    @Test
    void whenRendering_givenLoop_shouldEmitSelfEdgeAndEscapeLabels() {
        final String dot = new DotWriter().render(graphOf(LOOP), LOOP);

        assertTrue(dot.contains("  node3_9 -> node4_13;\n"));
        assertTrue(dot.contains("  node3_9 -> node3_9;\n"));
        assertTrue(dot.contains("  entry -> node6_9;\n"));
        assertTrue(dot.contains("[label=\"        System.out.println(\\\"done \\\\\\\\ \\\" + x);\", shape=\"box\"]"));
    }

    @Test
    void whenRendering_givenAnyGraph_shouldWrapWithHeaderAndFooterAndOrderDeclarations() {
        final List<String> lines = Arrays.asList(new DotWriter().render(graphOf(LOOP), LOOP).split("\n"));

        assertEquals(DotWriter.HEADER, lines.get(0));
        assertEquals(DotWriter.FOOTER, lines.get(lines.size() - 1));

        int lastNode = -1;
        int firstEdge = Integer.MAX_VALUE;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains("shape=")) {
                lastNode = i;
            } else if (lines.get(i).contains(" -> ")) {
                firstEdge = Math.min(firstEdge, i);
            }
        }
        assertTrue(lastNode < firstEdge);
    }

    @Test
    void whenRendering_givenAnyGraph_shouldGiveOnlyTheEntryADifferentShape() {
        final String dot = new DotWriter().render(graphOf(LOOP), LOOP);

        for (String line : dot.split("\n")) {
            if (!line.contains("shape=")) {
                continue;
            }
            if (line.startsWith("  entry ")) {
                assertTrue(line.endsWith("shape=\"" + DotWriter.ENTRY_SHAPE + "\"];"), line);
            } else {
                assertTrue(line.endsWith("shape=\"" + DotWriter.STMT_SHAPE + "\"];"), line);
            }
        }
    }

    @Test
    void whenRendering_givenDanglingEdgeAndTolerantPolicy_shouldEmitEmptyTarget() {
        final FlowGraph g = graphOf(IF_ELSE);
        g.entry().addEdge(StaticJavaParser.parseStatement("z++;"), EdgeKind.NEXT);

        final String dot = new DotWriter(DanglingEdgePolicy.TOLERATE).render(g, IF_ELSE);

        assertTrue(dot.contains("  entry -> ;\n"));
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    void whenRendering_givenDanglingEdgeAndStrictPolicy_shouldThrow() {
        final FlowGraph g = graphOf(IF_ELSE);
        g.entry().addEdge(StaticJavaParser.parseStatement("z++;"), EdgeKind.NEXT);

        final DanglingEdgeException e = assertThrows(DanglingEdgeException.class,
                () -> new DotWriter(DanglingEdgePolicy.FAIL).render(g, IF_ELSE));
        assertEquals("entry", e.getSourceNodeId());
    }

    @Test
    void whenEscaping_givenQuotesAndBackslashes_shouldPrefixThem() {
        assertEquals("say \\\"hi\\\" \\\\", DotWriter.escape("say \"hi\" \\"));
        assertEquals("\tplain", DotWriter.escape("\tplain"));
    }
}
