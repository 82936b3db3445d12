package com.vidnyan.codesense.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codesense.adapter.out.rule.ClasspathRuleRepository;
import com.vidnyan.codesense.config.AnalysisProperties;
import com.vidnyan.codesense.domain.rule.FlaggedSection;
import com.vidnyan.codesense.domain.rule.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternRuleEngineTest {

    private final AnalysisProperties properties = new AnalysisProperties();
    private final PatternRuleEngine engine = new PatternRuleEngine(
            new ClasspathRuleRepository(new ObjectMapper(), properties), properties);

    @Test
    void scan_ShouldFlagBareExceptAndPass() {
        // Arrange
        String code = "try:\n    x = 1\nexcept:\n    pass";

        // Act
        List<FlaggedSection> flagged = engine.scan(code, "python");

        // Assert
        assertEquals(List.of(
                new FlaggedSection(3, "except:", "Bare except clause catches all exceptions", Severity.ERROR, "PY-BARE-EXCEPT"),
                new FlaggedSection(4, "pass", "Empty block with pass", Severity.INFO, "PY-PASS")), flagged);
        assertEquals("Line 3: Bare except clause catches all exceptions", flagged.get(0).summary());
    }

    @Test
    void scan_ShouldOrderByRuleThenLine() {
        String code = "result = eval(data)\nprint(result)\nexec(data)";

        List<FlaggedSection> flagged = engine.scan(code, "python");

        assertEquals(List.of("PY-EVAL", "PY-EXEC", "PY-DEBUG-PRINT"),
                flagged.stream().map(FlaggedSection::ruleId).toList());
        assertEquals(List.of(1, 3, 2), flagged.stream().map(FlaggedSection::line).toList());
    }

    @Test
    void scan_ShouldUseLanguageRulesCaseInsensitively() {
        List<FlaggedSection> flagged = engine.scan("var x = 1;\nconsole.log(x);", "JavaScript");

        assertEquals(List.of("JS-VAR", "JS-CONSOLE-LOG"), flagged.stream().map(FlaggedSection::ruleId).toList());
    }

    @Test
    void scan_ShouldApplyOnlyGeneralRulesToLanguagesWithoutCatalog() {
        assertTrue(engine.scan("var x = 1;", "typescript").isEmpty());
        assertEquals(List.of("GEN-PASSWORD"),
                engine.scan("let pwd = read();", "go").stream().map(FlaggedSection::ruleId).toList());
    }

    @Test
    void scan_ShouldMatchCaseInsensitively() {
        List<FlaggedSection> flagged = engine.scan("x = EVAL(y)", "python");

        assertEquals("PY-EVAL", flagged.get(0).ruleId());
    }

    @Test
    void scan_ShouldFindNothingInEmptyCode() {
        assertTrue(engine.scan("", "python").isEmpty());
    }

    @Test
    void detectSmells_ShouldReportLongLinesThenNestingThenConditions() {
        // Arrange
        String code = String.join("\n",
                "if a and b or c and d or e:",
                " ".repeat(20) + "y = 1",
                "x".repeat(121));

        // Act
        List<String> smells = engine.detectSmells(code);

        // Assert
        assertEquals(List.of(
                "Line 3: Line too long (> 120 chars) (121 chars)",
                "Line 2: Deep nesting level (> 4) (level 5)",
                "Line 1: Complex boolean condition (> 3 operators)"), smells);
    }

    @Test
    void detectSmells_ShouldFlagSixLevelsOfIndentation() {
        assertEquals(List.of("Line 2: Deep nesting level (> 4) (level 6)"),
                engine.detectSmells("def f():\n" + " ".repeat(24) + "return 1\n"));
    }

    @Test
    void detectSmells_ShouldNotFlagAtThresholds() {
        String code = String.join("\n",
                "x".repeat(120),
                " ".repeat(16) + "y = 1",
                "if a and b or c and d:");

        assertTrue(engine.detectSmells(code).isEmpty());
    }

    @Test
    void detectSmells_ShouldHonourConfiguredThresholds() {
        properties.getSmells().setLongLine(10);

        assertEquals(List.of("Line 1: Line too long (> 10 chars) (11 chars)"), engine.detectSmells("a".repeat(11)));
    }

    @Test
    void countBooleanOperators_ShouldRequireWordBoundaries() {
        assertEquals(2, PatternRuleEngine.countBooleanOperators("a && b || candor"));
        assertEquals(2, PatternRuleEngine.countBooleanOperators("x AND y or z"));
        assertEquals(0, PatternRuleEngine.countBooleanOperators("order = organic"));
    }
}
