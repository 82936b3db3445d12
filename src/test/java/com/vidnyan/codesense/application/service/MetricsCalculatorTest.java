package com.vidnyan.codesense.application.service;

import com.vidnyan.codesense.adapter.out.parser.StructuralParser;
import com.vidnyan.codesense.domain.model.CodeMetrics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCalculatorTest {

    private final StructuralParser parser = StructuralParser.withDefaults();
    private final MetricsCalculator calculator = new MetricsCalculator();

    private CodeMetrics metrics(String code, String language) {
        return calculator.calculate(code, parser.parse(code, language));
    }

    @Test
    void calculate_ShouldClassifyLines() {
        // Arrange
        String code = "import os\n\n# comment\ndef f():\n    return 1\n";

        // Act
        CodeMetrics metrics = metrics(code, "python");

        // Assert
        assertEquals(6, metrics.totalLines());
        assertEquals(3, metrics.codeLines());
        assertEquals(2, metrics.blankLines());
        assertEquals(1, metrics.commentLines());
        assertEquals(1, metrics.functionCount());
        assertEquals(0, metrics.classCount());
        assertEquals(1, metrics.importCount());
        assertEquals(5.0, metrics.complexityScore());
        assertEquals(2.0, metrics.averageFunctionLength());
    }

    @Test
    void calculate_ShouldCountTopLevelFunctionsOnly() {
        // Arrange
        String code = "class A:\n    def m(self):\n        pass\n\ndef g():\n    pass\n    return 1";

        // Act
        CodeMetrics metrics = metrics(code, "python");

        // Assert
        assertEquals(1, metrics.functionCount());
        assertEquals(1, metrics.classCount());
        assertEquals(3.0, metrics.averageFunctionLength());
    }

    @Test
    void calculate_ShouldIgnoreMethodsWhenNoTopLevelFunctionExists() {
        CodeMetrics metrics = metrics("class A:\n    def m(self):\n        x = 1\n        return x", "python");

        assertEquals(0, metrics.functionCount());
        assertEquals(0.0, metrics.averageFunctionLength());
        assertEquals(1, metrics.classCount());
    }

    @Test
    void calculate_ShouldRecogniseCStyleComments() {
        String code = "// header\n/* block\n * more\n */\nint x = 1;";

        CodeMetrics metrics = metrics(code, "java");

        assertEquals(5, metrics.totalLines());
        assertEquals(4, metrics.commentLines());
        assertEquals(1, metrics.codeLines());
    }

    @Test
    void calculate_ShouldGiveZeroCountsForEmptyCode() {
        CodeMetrics metrics = metrics("", "python");

        assertEquals(0, metrics.totalLines());
        assertEquals(0, metrics.codeLines());
        assertEquals(0, metrics.functionCount());
        assertEquals(0.0, metrics.averageFunctionLength());
        assertEquals(5.0, metrics.complexityScore());
    }

    @Test
    void calculate_ShouldKeepLineTotalsConsistentForMalformedCode() {
        String code = "def broken(:\n\n    # note\n";

        CodeMetrics metrics = metrics(code, "python");

        assertEquals(metrics.totalLines(), metrics.codeLines() + metrics.blankLines() + metrics.commentLines());
        assertEquals(0.0, metrics.complexityScore());
        assertEquals(0, metrics.functionCount());
    }
}
