package org.verify.cfg;

import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SourceLoaderTest {

    private static final String SOURCE = "class C {\n"
            + "  abstract static class Base { abstract int size(); }\n"
            + "  void helper() { log(); }\n"
            + "  int checked(int n) { pre(\"n > 0\"); return n; }\n"
            + "  int other(int n) { invariant(\"n > 0\"); return n; }\n"
            + "}\n";

    @Test
    public void syntaxErrorsAreReportedWithLineNumbers(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("Broken.java");
        Files.writeString(file, "class Broken {\n  void f() {\n    int x = ;\n  }\n}\n");

        AnalysisException e = assertThrows(AnalysisException.class, () -> SourceLoader.parse(file));

        assertTrue(e.getMessage().contains("Line 3"), e.getMessage());
    }

    @Test
    public void parsesJava17SourcesWithoutGlobalConfiguration(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("Shapes.java");
        Files.writeString(file, "record Point(int x, int y) { }\n"
                + "class Shapes {\n"
                + "  String kind(Object o) {\n"
                + "    pre(\"o != null\");\n"
                + "    if (o instanceof Point p) { return \"point \" + p.x(); }\n"
                + "    return \"\"\"\n      other\n      \"\"\";\n"
                + "  }\n"
                + "}\n");
        ParserConfiguration.LanguageLevel before = StaticJavaParser.getParserConfiguration().getLanguageLevel();

        CompilationUnit cu = SourceLoader.parse(file);

        assertEquals("kind", SourceLoader.selectMethod(cu, null).getNameAsString());
        assertEquals(before, StaticJavaParser.getParserConfiguration().getLanguageLevel());
    }

    @Test
    public void unreadableFileIsAnInputError(@TempDir Path tmp) {
        assertThrows(AnalysisException.class, () -> SourceLoader.parse(tmp.resolve("Missing.java")));
    }

    @Test
    public void selectsByName() throws AnalysisException {
        CompilationUnit cu = StaticJavaParser.parse(SOURCE);

        assertEquals("other", SourceLoader.selectMethod(cu, "other").getNameAsString());
        assertThrows(AnalysisException.class, () -> SourceLoader.selectMethod(cu, "size"));
        assertThrows(AnalysisException.class, () -> SourceLoader.selectMethod(cu, "missing"));
    }

    @Test
    public void prefersTheFirstAnnotatedMethod() throws AnalysisException {
        CompilationUnit cu = StaticJavaParser.parse(SOURCE);

        assertEquals("checked", SourceLoader.selectMethod(cu, null).getNameAsString());
    }

    @Test
    public void fallsBackToTheFirstMethodWithABody() throws AnalysisException {
        CompilationUnit cu = StaticJavaParser.parse("interface I { void a(); }\nclass D { void b() { } void c() { } }");

        assertEquals("b", SourceLoader.selectMethod(cu, null).getNameAsString());
    }

    @Test
    public void noMethodWithABody() {
        CompilationUnit cu = StaticJavaParser.parse("interface I { void a(); }");

        assertThrows(AnalysisException.class, () -> SourceLoader.selectMethod(cu, null));
    }

    @Test
    public void baseNameDropsTheJavaSuffix() {
        assertEquals("Factorial", SourceLoader.baseName(Path.of("samples", "Factorial.java")));
        assertEquals("notes.txt", SourceLoader.baseName(Path.of("notes.txt")));
    }
}
