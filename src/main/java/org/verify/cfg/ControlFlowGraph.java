package org.verify.cfg;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 一个方法的控制流图（有向多重图）
 * <p>
 * 节点和边都按下标存放在列表中，下标就是它们的身份。删除节点/边只留下空位，下标不会被复用。
 * 出边、入边都按加边的先后顺序返回。
 */
public class ControlFlowGraph {

    // 节点列表，删除后对应位置为 null
    private final List<CfgNode> nodes = new ArrayList<>();

    // 边列表，删除后对应位置为 null
    private final List<CfgEdge> edges = new ArrayList<>();

    public int addNode(CfgNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    /**
     * 下一个 addNode 将得到的下标
     */
    public int nextIndex() {
        return nodes.size();
    }

    public void addEdge(int source, int target, String label) {
        checkLive(source);
        checkLive(target);
        edges.add(new CfgEdge(source, target, label));
    }

    public CfgNode node(int index) {
        checkLive(index);
        return nodes.get(index);
    }

    public boolean contains(int index) {
        return index >= 0 && index < nodes.size() && nodes.get(index) != null;
    }

    public void replaceNode(int index, CfgNode node) {
        checkLive(index);
        nodes.set(index, node);
    }

    /**
     * 删除节点及所有与它相连的边
     */
    public void removeNode(int index) {
        checkLive(index);
        nodes.set(index, null);
        for (int i = 0; i < edges.size(); i++) {
            CfgEdge e = edges.get(i);
            if (e != null && (e.source() == index || e.target() == index)) {
                edges.set(i, null);
            }
        }
    }

    /**
     * 当前仍存在的节点下标（升序）
     */
    public List<Integer> nodeIndices() {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) != null) {
                result.add(i);
            }
        }
        return result;
    }

    public List<Integer> nodesOfKind(NodeKind kind) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            CfgNode n = nodes.get(i);
            if (n != null && n.kind() == kind) {
                result.add(i);
            }
        }
        return result;
    }

    public List<CfgEdge> edges() {
        List<CfgEdge> result = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e != null) {
                result.add(e);
            }
        }
        return result;
    }

    public List<CfgEdge> outgoing(int index) {
        checkLive(index);
        List<CfgEdge> result = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e != null && e.source() == index) {
                result.add(e);
            }
        }
        return result;
    }

    public List<CfgEdge> incoming(int index) {
        checkLive(index);
        List<CfgEdge> result = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e != null && e.target() == index) {
                result.add(e);
            }
        }
        return result;
    }

    /**
     * source 到 target 的第一条边（多条平行边时取最早加入的那条）
     */
    public Optional<CfgEdge> firstEdge(int source, int target) {
        for (CfgEdge e : edges) {
            if (e != null && e.source() == source && e.target() == target) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public int nodeCount() {
        return nodeIndices().size();
    }

    public int edgeCount() {
        return edges().size();
    }

    private void checkLive(int index) {
        checkElementIndex(index, nodes.size(), "node index");
        checkState(nodes.get(index) != null, "node %s has been removed", index);
    }
}
