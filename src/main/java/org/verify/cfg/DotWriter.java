package org.verify.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 把 CFG 或单条路径输出为 Graphviz DOT 格式
 */
public final class DotWriter {

    private static final Logger LOG = LogManager.getLogger(DotWriter.class);

    private DotWriter() {
    }

    /**
     * 整张图：所有节点按下标顺序，所有边按加入顺序
     */
    public static String render(ControlFlowGraph graph) {
        StringBuilder sb = new StringBuilder("digraph G {\n");
        for (int index : graph.nodeIndices()) {
            appendNode(sb, index, graph.node(index));
        }
        for (CfgEdge e : graph.edges()) {
            appendEdge(sb, e);
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * 单条路径：路径上的节点，以及相邻两个节点之间的第一条边
     *
     * @throws IllegalStateException 路径上相邻的两个节点在图中没有边
     */
    public static String renderPath(ControlFlowGraph graph, List<Integer> path) {
        StringBuilder sb = new StringBuilder("digraph Path {\n");
        for (int index : path) {
            appendNode(sb, index, graph.node(index));
        }
        for (int i = 0; i + 1 < path.size(); i++) {
            int from = path.get(i);
            int to = path.get(i + 1);
            CfgEdge edge = graph.firstEdge(from, to)
                    .orElseThrow(() -> new IllegalStateException("path step " + from + " -> " + to + " has no edge"));
            appendEdge(sb, edge);
        }
        sb.append("}\n");
        return sb.toString();
    }

    public static void writeGraph(ControlFlowGraph graph, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, render(graph), StandardCharsets.UTF_8);
        LOG.info("DOT file saved as {}", file);
    }

    /**
     * 每条路径一个文件：simple_path_&lt;i&gt;.dot
     */
    public static void writePaths(ControlFlowGraph graph, List<List<Integer>> paths, Path dir) throws IOException {
        Files.createDirectories(dir);
        for (int i = 0; i < paths.size(); i++) {
            Path file = dir.resolve(pathFileName(i));
            Files.writeString(file, renderPath(graph, paths.get(i)), StandardCharsets.UTF_8);
        }
        LOG.info("Wrote {} path files to {}", paths.size(), dir);
    }

    static String pathFileName(int i) {
        return "simple_path_" + i + ".dot";
    }

    private static void appendNode(StringBuilder sb, int index, CfgNode node) {
        sb.append(index)
                .append(" [label=\"").append(escape(node.displayLabel()))
                .append("\", shape=").append(node.kind().shape())
                .append("]\n");
    }

    private static void appendEdge(StringBuilder sb, CfgEdge e) {
        sb.append(e.source()).append(" -> ").append(e.target());
        if (e.hasLabel()) {
            sb.append(" [label=\"").append(escape(e.label())).append("\"]");
        }
        sb.append(";\n");
    }

    static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
