package org.verify.cfg;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 枚举验证路径：从一个携带条件的节点（pre / post / invariant / cutoff）出发，
 * 沿出边深度优先搜索，到达下一个携带条件的节点时记录路径并停止向前。
 * <p>
 * 到达的携带条件节点总是路径的终点，包括回到起点的情况（循环体路径 invariant -> ... -> invariant）。
 * 除此之外搜索不会重复进入当前路径上已有的节点，所以即使图中存在不经过携带条件节点的环也一定会结束。
 * 同一对节点之间的平行边只走一次，每个节点序列只报告一次。
 */
public class PathFinder {

    private final ControlFlowGraph graph;
    private final List<List<Integer>> paths = new ArrayList<>();

    public PathFinder(ControlFlowGraph graph) {
        this.graph = graph;
    }

    public static List<List<Integer>> findPaths(ControlFlowGraph graph) {
        return new PathFinder(graph).find();
    }

    /**
     * @return 所有简单路径，每条路径是节点下标的序列；按起点下标升序、出边加入顺序排列
     */
    public List<List<Integer>> find() {
        paths.clear();
        for (int start : conditionNodes()) {
            search(start, new ArrayList<>(), new LinkedHashSet<>());
        }
        return paths.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList());
    }

    private void search(int node, List<Integer> path, Set<Integer> onPath) {
        if (!path.isEmpty() && graph.node(node).isConditionBearing()) {
            // 终点；可以是起点本身（循环回边回到 invariant / cutoff）
            List<Integer> found = new ArrayList<>(path);
            found.add(node);
            paths.add(found);
            return;
        }
        if (!onPath.add(node)) {
            return;
        }
        path.add(node);
        for (int next : successors(node)) {
            search(next, path, onPath);
        }
        path.remove(path.size() - 1);
        onPath.remove(node);
    }

    private Set<Integer> successors(int node) {
        Set<Integer> result = new LinkedHashSet<>();
        for (CfgEdge e : graph.outgoing(node)) {
            result.add(e.target());
        }
        return result;
    }

    private List<Integer> conditionNodes() {
        List<Integer> result = new ArrayList<>();
        for (int index : graph.nodeIndices()) {
            if (graph.node(index).isConditionBearing()) {
                result.add(index);
            }
        }
        return result;
    }
}
