package org.verify.cfg;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 读取一个 Java 文件，选出其中带 pre / post / invariant 的方法：
 * - 构建并化简 CFG
 * - 枚举验证路径
 * - 输出 DOT 文件（整张图一个，每条路径一个）
 * <p>
 * 用法：Main &lt;input.java&gt; [methodName]
 */
public class Main {

    private static final Logger LOG = LogManager.getLogger(Main.class);

    static final int EXIT_USAGE = 1;
    static final int EXIT_INPUT = 2;
    static final int EXIT_OUTPUT = 3;

    public static void main(String[] args) {
        System.exit(run(args, AnalyzerConfig.fromSystemProperties()));
    }

    static int run(String[] args, AnalyzerConfig config) {
        if (args.length < 1) {
            LOG.error("Usage: Main <input.java> [methodName]");
            return EXIT_USAGE;
        }
        Path input = Path.of(args[0]);
        String methodName = args.length > 1 ? args[1] : null;

        // 1. 外部方法契约（加载失败时为空表）
        ContractRegistry registry = ContractRegistry.load(config.registryFile());

        // 2. 解析输入并选出方法
        MethodDeclaration md;
        try {
            CompilationUnit cu = SourceLoader.parse(input);
            md = SourceLoader.selectMethod(cu, methodName);
        } catch (AnalysisException e) {
            LOG.error(e.getMessage());
            return EXIT_INPUT;
        }

        // 3. 构建 CFG、化简、找路径
        AnalysisResult result = new MethodAnalyzer(registry).analyze(md);

        // 4. 输出
        String baseName = SourceLoader.baseName(input);
        try {
            DotWriter.writeGraph(result.graph(), config.graphFile(baseName));
            DotWriter.writePaths(result.graph(), result.paths(), config.pathsDir(baseName));
        } catch (IOException e) {
            LOG.error("Unable to write output for {}: {}", input, e.toString());
            return EXIT_OUTPUT;
        }
        return 0;
    }
}
