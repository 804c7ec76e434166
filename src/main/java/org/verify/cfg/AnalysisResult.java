package org.verify.cfg;

import java.util.List;

/**
 * 一个方法的分析结果：化简后的 CFG + 验证路径
 */
public record AnalysisResult(String methodName, ControlFlowGraph graph, List<List<Integer>> paths) {
}
