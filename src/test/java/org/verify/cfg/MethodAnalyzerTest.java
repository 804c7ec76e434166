package org.verify.cfg;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MethodAnalyzerTest {

    private final MethodAnalyzer analyzer = new MethodAnalyzer(ContractRegistry.empty());

    @Test
    public void ifElseIsSimplifiedAndPathsFound() {
        MethodDeclaration md = CfgBuilderTest.method("int f(int n) { pre(\"n >= 0\"); post(\"r >= 0\"); int r;"
                + " if (n == 0) { r = 1; } else { r = n; } return r; }");

        AnalysisResult result = analyzer.analyze(md);
        ControlFlowGraph g = result.graph();

        assertEquals("f", result.methodName());
        assertEquals(1, g.nodesOfKind(NodeKind.CONDITION).size());
        assertEquals(2, g.nodesOfKind(NodeKind.STATEMENT).size());
        assertEquals(1, g.nodesOfKind(NodeKind.PRECONDITION).size());
        assertEquals(1, g.nodesOfKind(NodeKind.POSTCONDITION).size());
        assertTrue(g.nodesOfKind(NodeKind.MERGE_POINT).isEmpty());
        // 1 pre, 2 post
        assertEquals(List.of(List.of(1, 2)), result.paths());
    }

    @Test
    public void factorialSample() throws Exception {
        Path file = Path.of(getClass().getResource("/samples/Factorial.java").toURI());
        CompilationUnit cu = SourceLoader.parse(file);

        AnalysisResult result = analyzer.analyze(SourceLoader.selectMethod(cu, null));
        ControlFlowGraph g = result.graph();

        assertEquals("factorial", result.methodName());
        assertEquals(3, result.paths().size());
        List<Integer> first = result.paths().get(0);
        assertEquals(NodeKind.PRECONDITION, g.node(first.get(0)).kind());
        assertEquals(NodeKind.POSTCONDITION, g.node(first.get(1)).kind());
        List<Integer> loop = result.paths().get(2);
        assertEquals(NodeKind.INVARIANT, g.node(loop.get(0)).kind());
        assertEquals(loop.get(0), loop.get(loop.size() - 1));
        assertEquals("while: counter <= n", g.node(loop.get(1)).text());
    }
}
