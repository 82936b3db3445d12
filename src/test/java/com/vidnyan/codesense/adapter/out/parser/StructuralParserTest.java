package com.vidnyan.codesense.adapter.out.parser;

import com.vidnyan.codesense.domain.model.ParseResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuralParserTest {

    private final StructuralParser parser = StructuralParser.withDefaults();

    @Test
    void parse_ShouldDispatchByLanguageIgnoringCase() {
        assertEquals("python", parser.parse("def f():\n    pass\n", "Python").language());
        assertEquals("java", parser.parse("class A {}", " JAVA ").language());
        assertEquals("javascript", parser.parse("function f() {}", "javascript").language());
    }

    @Test
    void parse_ShouldFallBackToHeuristicForUnsupportedLanguage() {
        ParseResult result = parser.parse("if x := 1; x > 0 { }", "go");

        assertEquals("go", result.language());
        assertEquals(List.of("No specific parser for go, using generic analysis"), result.errors());
        assertTrue(result.functions().isEmpty());
        assertTrue(result.isDegraded());
        // one "if"
        assertEquals(4.0, result.complexityScore());
    }

    @Test
    void parse_ShouldGiveBaseComplexityForEmptyStructuredInput() {
        assertEquals(5.0, parser.parse("", "python").complexityScore());
        assertEquals(5.0, parser.parse("", "java").complexityScore());
    }

    @Test
    void parse_ShouldRejectContractViolations() {
        assertThrows(NullPointerException.class, () -> parser.parse(null, "python"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("x = 1", " "));
    }

    @Test
    void parse_ShouldNotThrowOnMalformedInput() {
        ParseResult result = parser.parse("def (((:\n\tclass", "python");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Syntax error at line "));
        assertEquals(0.0, result.complexityScore());
    }
}
