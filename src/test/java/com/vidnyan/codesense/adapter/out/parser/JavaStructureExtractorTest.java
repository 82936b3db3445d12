package com.vidnyan.codesense.adapter.out.parser;

import com.vidnyan.codesense.domain.model.ClassEntity;
import com.vidnyan.codesense.domain.model.FunctionEntity;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceLanguage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaStructureExtractorTest {

    private final JavaStructureExtractor extractor = new JavaStructureExtractor();

    private ParseResult parse(String... lines) {
        return extractor.extract(String.join("\n", lines), SourceLanguage.JAVA);
    }

    @Test
    void extract_ShouldWalkCompilationUnit() {
        ParseResult result = parse(
                "package demo;",
                "",
                "import java.util.List;",
                "import java.util.concurrent.*;",
                "",
                "/**",
                " * Order service.",
                " */",
                "@Service",
                "public class OrderService extends BaseService implements Runnable, AutoCloseable {",
                "",
                "    private final List<String> orders = List.of();",
                "    int count, total;",
                "",
                "    /** Create it. */",
                "    public OrderService() {",
                "    }",
                "",
                "    @Override",
                "    public void run() {",
                "        if (count > 0 && total > 0) {",
                "            for (String o : orders) {",
                "                System.out.println(o);",
                "            }",
                "        }",
                "    }",
                "",
                "    public int sum(int... values) throws Exception {",
                "        try {",
                "            return values.length;",
                "        } catch (RuntimeException e) {",
                "            return 0;",
                "        }",
                "    }",
                "",
                "    public void close() {}",
                "",
                "    record Point(int x, int y) {}",
                "}");

        assertTrue(result.errors().isEmpty());
        assertEquals("java", result.language());
        assertEquals(List.of("java.util.List", "java.util.concurrent.*"), result.imports());
        assertTrue(result.functions().isEmpty());
        assertEquals(List.of("OrderService", "Point"), result.classes().stream().map(ClassEntity::name).toList());

        ClassEntity service = result.classes().get(0);
        assertEquals(10, service.startLine());
        assertEquals(39, service.endLine());
        assertEquals(List.of("BaseService", "Runnable", "AutoCloseable"), service.bases());
        assertEquals(List.of("@Service"), service.decorators());
        assertEquals("Order service.", service.docstring());
        assertEquals(List.of(
                new ClassEntity.Attribute("orders", "List<String>", 12),
                new ClassEntity.Attribute("count", "int", 13),
                new ClassEntity.Attribute("total", "int", 13)), service.attributes());
        assertEquals(List.of("OrderService", "run", "sum", "close"),
                service.methods().stream().map(FunctionEntity::name).toList());

        FunctionEntity constructor = service.methods().get(0);
        assertNull(constructor.returnType());
        assertEquals("Create it.", constructor.docstring());
        assertEquals(16, constructor.startLine());
        assertEquals(17, constructor.endLine());

        FunctionEntity run = service.methods().get(1);
        assertEquals(20, run.startLine());
        assertEquals(26, run.endLine());
        assertEquals("void", run.returnType());
        assertEquals(List.of("@Override"), run.decorators());
        assertTrue(run.method());
        assertEquals("OrderService", run.className());
        assertTrue(run.body().startsWith("    public void run() {"));

        FunctionEntity sum = service.methods().get(2);
        assertEquals(List.of(new FunctionEntity.Parameter("values", "int...", null)), sum.parameters());
        assertTrue(sum.signature().contains("sum(int... values)"));

        ClassEntity point = result.classes().get(1);
        assertEquals(List.of(
                new ClassEntity.Attribute("x", "int", 38),
                new ClassEntity.Attribute("y", "int", 38)), point.attributes());

        // 1 + if + for-each + catch + &&
        assertEquals(25.0, result.complexityScore());
    }

    @Test
    void extract_ShouldTreatBareMethodsAsTopLevelFunctions() {
        ParseResult result = parse(
                "public int add(int a, int b) {",
                "    return a + b;",
                "}");

        assertTrue(result.errors().isEmpty());
        assertTrue(result.classes().isEmpty());
        assertEquals(1, result.functions().size());
        FunctionEntity add = result.functions().get(0);
        assertEquals("add", add.name());
        assertFalse(add.method());
        assertNull(add.className());
        assertEquals(1, add.startLine());
        assertEquals(3, add.endLine());
    }

    @Test
    void extract_ShouldAcceptStatementSnippets() {
        ParseResult result = parse(
                "int x = 1;",
                "if (x > 0) {",
                "    x++;",
                "}");

        assertTrue(result.errors().isEmpty());
        assertTrue(result.functions().isEmpty());
        assertEquals(10.0, result.complexityScore());
    }

    @Test
    void extract_ShouldReportSyntaxError() {
        ParseResult result = parse("public class {");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Syntax error at line 1: "), result.errors().get(0));
        assertEquals(0.0, result.complexityScore());
        assertTrue(result.classes().isEmpty());
    }

    @Test
    void extract_ShouldGiveBaseComplexityForEmptyInput() {
        ParseResult result = extractor.extract("", SourceLanguage.JAVA);

        assertTrue(result.errors().isEmpty());
        assertEquals(5.0, result.complexityScore());
    }
}
