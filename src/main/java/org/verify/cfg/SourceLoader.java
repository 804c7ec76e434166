package org.verify.cfg;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 读取并解析输入的 Java 文件，选出要分析的方法
 */
public final class SourceLoader {

    private static final Logger LOG = LogManager.getLogger(SourceLoader.class);

    // 自己持有解析器和配置，不改 StaticJavaParser 的全局配置
    private static final JavaParser PARSER = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    private SourceLoader() {
    }

    /**
     * @throws AnalysisException 文件读不了，或者有语法错误（错误列表带行号）
     */
    public static CompilationUnit parse(Path file) throws AnalysisException {
        ParseResult<CompilationUnit> result;
        try {
            result = PARSER.parse(file);
        } catch (IOException e) {
            throw new AnalysisException("Could not read " + file + ": " + e.getMessage(), e);
        }
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        String problems = result.getProblems().stream()
                .map(SourceLoader::describe)
                .collect(Collectors.joining("\n"));
        throw new AnalysisException("Unable to parse " + file + ":\n" + problems);
    }

    private static String describe(Problem p) {
        int line = p.getLocation()
                .flatMap(l -> l.getBegin().getRange())
                .map(r -> r.begin.line)
                .orElse(-1);
        return "  -> Line " + line + ": " + p.getMessage();
    }

    /**
     * 选择要分析的方法：
     * 给了名字就按名字找；否则取第一个含有 pre / post / invariant 的方法，再否则取第一个有方法体的方法。
     *
     * @param methodName 方法名，可以为 null
     */
    public static MethodDeclaration selectMethod(CompilationUnit cu, String methodName) throws AnalysisException {
        List<MethodDeclaration> candidates = cu.findAll(MethodDeclaration.class).stream()
                .filter(md -> md.getBody().isPresent())
                .collect(Collectors.toList());

        if (methodName != null) {
            return candidates.stream()
                    .filter(md -> md.getNameAsString().equals(methodName))
                    .findFirst()
                    .orElseThrow(() -> new AnalysisException("No method named " + methodName + " with a body"));
        }

        Optional<MethodDeclaration> annotated = candidates.stream()
                .filter(md -> !md.findAll(MethodCallExpr.class, CfgBuilder::isMarker).isEmpty())
                .findFirst();
        if (annotated.isPresent()) {
            return annotated.get();
        }
        if (candidates.isEmpty()) {
            throw new AnalysisException("No method with a body found");
        }
        LOG.warn("No annotated method found, analysing {}", candidates.get(0).getNameAsString());
        return candidates.get(0);
    }

    /**
     * 文件名去掉 .java 后缀
     */
    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".java") ? name.substring(0, name.length() - ".java".length()) : name;
    }
}
