package org.verify.cfg;

import static com.google.common.base.Preconditions.checkState;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * CFG 化简：去掉翻译时引入的合并点，并规整语句/条件节点的文本
 */
public final class GraphSimplifier {

    private static final Logger LOG = LogManager.getLogger(GraphSimplifier.class);

    private GraphSimplifier() {
    }

    /**
     * 原地化简。合并点的所有入边被改接到它唯一的后继上，然后删除合并点；边标签保持不变。
     * 对已经化简过的图再次调用不会有任何变化。
     *
     * @throws IllegalStateException 合并点有多于一条出边（构图缺陷）
     */
    public static void simplify(ControlFlowGraph graph) {
        Deque<Integer> worklist = new ArrayDeque<>(graph.nodesOfKind(NodeKind.MERGE_POINT));
        int removed = 0;

        while (!worklist.isEmpty()) {
            int merge = worklist.pollLast();
            if (!graph.contains(merge)) {
                continue;
            }
            List<CfgEdge> out = graph.outgoing(merge);
            if (out.isEmpty()) {
                // 没有后继（已经和图断开），保留
                continue;
            }
            checkState(out.size() == 1,
                    "merge point %s has %s outgoing edges, expected exactly one", merge, out.size());

            int target = out.get(0).target();
            redirectAndRemove(graph, merge, target);
            removed++;
            if (graph.node(target).is(NodeKind.MERGE_POINT)) {
                // 目标也是合并点：它刚得到了新的入边，重新检查
                worklist.addLast(target);
            }
        }

        // 规整文本
        for (int index : graph.nodeIndices()) {
            CfgNode node = graph.node(index);
            if (node.is(NodeKind.CONDITION) || node.is(NodeKind.STATEMENT)) {
                graph.replaceNode(index, node.withText(SourceText.normalize(node.text())));
            }
        }
        LOG.debug("Removed {} merge points, {} nodes left", removed, graph.nodeCount());
    }

    private static void redirectAndRemove(ControlFlowGraph graph, int merge, int target) {
        List<CfgEdge> incoming = graph.incoming(merge);
        graph.removeNode(merge);
        for (CfgEdge e : incoming) {
            graph.addEdge(e.source(), target, e.label());
        }
    }
}
