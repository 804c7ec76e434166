package org.verify.cfg;

import com.github.javaparser.ast.Node;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.PrinterConfiguration;

import java.util.regex.Pattern;

/**
 * 节点标签的文本工具：打印 AST 片段（不带注释）并规整空白
 */
final class SourceText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final PrinterConfiguration NO_COMMENTS = new DefaultPrinterConfiguration()
            .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS))
            .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_JAVADOC));

    private SourceText() {
    }

    /**
     * 打印 AST 节点的源码并规整成一行
     */
    static String of(Node node) {
        return normalize(node.toString(NO_COMMENTS));
    }

    /**
     * 把连续空白（含换行）压成一个空格，去掉首尾空白。幂等。
     */
    static String normalize(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
