package org.verify.cfg;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.verify.cfg.CfgBuilderTest.build;

public class PathFinderTest {

    private static List<List<Integer>> paths(String source) {
        ControlFlowGraph g = build(source);
        GraphSimplifier.simplify(g);
        return PathFinder.findPaths(g);
    }

    @Test
    public void noConditionNodesMeansNoPaths() {
        assertTrue(paths("void s() { int a = 1; a++; if (a > 1) { a--; } }").isEmpty());
    }

    @Test
    public void preconditionToPostcondition() {
        List<List<Integer>> paths = paths("int f(int x) { pre(\"x > 0\"); int y = x + 1; post(\"y > 1\"); return y; }");

        // 0 f, 1 pre, 2 int y = x + 1, 3 post, 4 return
        assertEquals(List.of(List.of(1, 2, 3)), paths);
    }

    @Test
    public void loopBodyPathReturnsToTheInvariant() {
        List<List<Integer>> paths = paths("void h(int n) { int i = 0; invariant(\"i <= n\"); while (i < n) { i++; } }");

        // 2 inv, 3 while, 4 i++
        assertEquals(List.of(List.of(2, 3, 4, 2)), paths);
    }

    @Test
    public void cutoffSplitsAnUnannotatedLoop() {
        List<List<Integer>> paths = paths("void h(int n) { pre(\"n > 0\"); int i = 0;"
                + " while (i < n) { i++; } post(\"i == n\"); }");

        // 0 h, 1 pre, 2 int i = 0, 3 cutoff, 4 while, 5 i++, 6 merge (removed), 7 post
        assertEquals(List.of(
                List.of(1, 2, 3),
                List.of(3, 4, 5, 3),
                List.of(3, 4, 7)), paths);
    }

    @Test
    public void branchesProduceOnePathEach() {
        List<List<Integer>> paths = paths("int f(int n) { pre(\"true\"); int r = 0;"
                + " if (n > 0) { r = n; } else { r = -n; } post(\"r >= 0\"); return r; }");

        // 1 pre, 2 int r = 0, 3 if, 4 r = n, 6 r = -n, 7 post
        assertEquals(List.of(
                List.of(1, 2, 3, 4, 7),
                List.of(1, 2, 3, 6, 7)), paths);
    }

    @Test
    public void parallelEdgesYieldOnePath() {
        List<List<Integer>> paths = paths("void k(boolean x) { pre(\"x\"); if (x) { } post(\"true\"); }");

        assertEquals(1, paths.size());
    }

    @Test
    public void cycleWithoutConditionNodeTerminates() {
        ControlFlowGraph g = new ControlFlowGraph();
        int pre = g.addNode(CfgNode.precondition("a"));
        int s1 = g.addNode(CfgNode.statement("s1"));
        int s2 = g.addNode(CfgNode.statement("s2"));
        int post = g.addNode(CfgNode.postcondition("b"));
        g.addEdge(pre, s1, "");
        g.addEdge(s1, s2, "");
        g.addEdge(s2, s1, "back");
        g.addEdge(s2, post, "");

        assertEquals(List.of(List.of(pre, s1, s2, post)), PathFinder.findPaths(g));
    }

    @Test
    public void pathsAreImmutable() {
        List<List<Integer>> paths = paths("int f(int x) { pre(\"x > 0\"); post(\"x > 0\"); return x; }");

        assertThrows(UnsupportedOperationException.class, () -> paths.get(0).add(9));
    }
}
