package org.verify.cfg;

import java.nio.file.Path;

/**
 * 运行配置，来自系统属性：
 * <ul>
 *     <li>cfgpaths.registry：外部方法契约文件，默认 config/conditions.json</li>
 *     <li>cfgpaths.output：输出目录，默认 graphs</li>
 * </ul>
 */
public record AnalyzerConfig(Path registryFile, Path outputDir) {

    public static final String REGISTRY_PROPERTY = "cfgpaths.registry";
    public static final String OUTPUT_PROPERTY = "cfgpaths.output";

    static final String DEFAULT_REGISTRY = "config/conditions.json";
    static final String DEFAULT_OUTPUT = "graphs";

    public static AnalyzerConfig fromSystemProperties() {
        return new AnalyzerConfig(
                Path.of(System.getProperty(REGISTRY_PROPERTY, DEFAULT_REGISTRY)),
                Path.of(System.getProperty(OUTPUT_PROPERTY, DEFAULT_OUTPUT)));
    }

    /**
     * 整张图的输出文件：&lt;output&gt;/&lt;base&gt;.dot
     */
    public Path graphFile(String baseName) {
        return outputDir.resolve(baseName + ".dot");
    }

    /**
     * 路径文件所在目录：&lt;output&gt;/&lt;base&gt;_paths
     */
    public Path pathsDir(String baseName) {
        return outputDir.resolve(baseName + "_paths");
    }
}
