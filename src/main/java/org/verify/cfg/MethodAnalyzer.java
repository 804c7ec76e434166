package org.verify.cfg;

import com.github.javaparser.ast.body.MethodDeclaration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * 方法分析器：构建 CFG -> 化简 -> 枚举验证路径
 */
public class MethodAnalyzer {

    private static final Logger LOG = LogManager.getLogger(MethodAnalyzer.class);

    private final ContractRegistry registry;

    public MethodAnalyzer(ContractRegistry registry) {
        this.registry = registry;
    }

    /**
     * 分析给定的方法
     *
     * @param md 要分析的方法声明（必须有方法体）
     * @return 化简后的控制流图和所有验证路径
     */
    public AnalysisResult analyze(MethodDeclaration md) {
        ControlFlowGraph graph = new CfgBuilder(registry).build(md);
        GraphSimplifier.simplify(graph);
        List<List<Integer>> paths = PathFinder.findPaths(graph);

        LOG.info("Method {}: {} nodes, {} edges, {} verification paths",
                md.getNameAsString(), graph.nodeCount(), graph.edgeCount(), paths.size());
        return new AnalysisResult(md.getNameAsString(), graph, paths);
    }
}
