package com.vidnyan.codesense.adapter.in.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codesense.adapter.out.ml.RandomForestDefectClassifier;
import com.vidnyan.codesense.adapter.out.parser.StructuralParser;
import com.vidnyan.codesense.adapter.out.rule.ClasspathRuleRepository;
import com.vidnyan.codesense.application.service.CodeAnalysisService;
import com.vidnyan.codesense.application.service.MetricsCalculator;
import com.vidnyan.codesense.application.service.PatternRuleEngine;
import com.vidnyan.codesense.config.AnalysisProperties;
import com.vidnyan.codesense.config.CodeSenseConfiguration;
import com.vidnyan.codesense.domain.analysis.ScoreFusion;
import com.vidnyan.codesense.domain.rule.FlaggedSection;
import com.vidnyan.codesense.domain.rule.Severity;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisCliRunnerTest {

    private static ObjectMapper objectMapper;
    private static AnalysisCliRunner runner;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void setUp() {
        AnalysisProperties properties = new AnalysisProperties();
        objectMapper = new CodeSenseConfiguration().objectMapper();
        CodeAnalysisService service = new CodeAnalysisService(
                StructuralParser.withDefaults(),
                new MetricsCalculator(),
                new PatternRuleEngine(new ClasspathRuleRepository(objectMapper, properties), properties),
                new RandomForestDefectClassifier(properties),
                new ScoreFusion());
        runner = new AnalysisCliRunner(service, objectMapper);
    }

    @Test
    void analyze_ShouldInferLanguageFromExtension() throws Exception {
        // Arrange
        Path file = tempDir.resolve("sample.py");
        Files.writeString(file, "def run(x):\n    return eval(x)\n");

        // Act
        AnalysisCliRunner.Report report = runner.analyze(file, "");

        // Assert
        assertEquals("python", report.language());
        assertEquals(1, report.structure().functions().size());
        assertEquals(3, report.metrics().totalLines());
        assertTrue(report.prediction().flaggedSections().stream()
                .map(FlaggedSection::ruleId)
                .anyMatch("PY-EVAL"::equals));
        assertEquals(1, report.severities().get(Severity.SECURITY));
    }

    @Test
    void analyze_ShouldPreferExplicitLanguage() throws Exception {
        Path file = tempDir.resolve("snippet.txt");
        Files.writeString(file, "var x = 1;\n");

        AnalysisCliRunner.Report report = runner.analyze(file, "JavaScript");

        assertEquals("javascript", report.language());
        assertEquals("JS-VAR", report.prediction().flaggedSections().get(0).ruleId());
    }

    @Test
    void toJson_ShouldUseSnakeCaseReportKeys() throws Exception {
        Path file = tempDir.resolve("sample.py");
        Files.writeString(file, "def run(x):\n    return eval(x)\n");

        String json = runner.toJson(runner.analyze(file, null));

        JsonNode root = objectMapper.readTree(json);
        assertEquals("python", root.get("language").asText());
        assertTrue(root.get("prediction").has("risk_score"));
        assertEquals(1, root.get("severity_summary").get("security").asInt());
        assertEquals(1, root.get("structure").get("functions").get(0).get("start_line").asInt());
        assertEquals(3, root.get("metrics").get("total_lines").asInt());
    }

    @Test
    void analyze_ShouldReplaceInvalidUtf8Bytes() throws Exception {
        // Arrange
        Path file = tempDir.resolve("latin1.py");
        Files.write(file, new byte[] {'x', ' ', '=', ' ', '1', '\n', '#', ' ', (byte) 0xFF, '\n'});

        // Act
        AnalysisCliRunner.Report report = assertDoesNotThrow(() -> runner.analyze(file, null));

        // Assert
        assertEquals("python", report.language());
        assertTrue(report.structure().errors().isEmpty());
        assertEquals("x", report.structure().globalVariables().get(0).name());
        assertEquals("x = 1\n# \uFFFD\n", AnalysisCliRunner.readLenient(file));
    }

    @Test
    void run_ShouldDoNothingWithoutFile() {
        assertDoesNotThrow(() -> runner.run());
    }
}
