package com.vidnyan.codesense.adapter.out.parser;

import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceText;

import java.util.List;

/**
 * Keyword-count complexity estimate for code without a syntax tree.
 * Counts raw substrings, so "if" inside "elif" or an identifier also counts.
 */
final class HeuristicComplexity {

    static final List<String> KEYWORDS = List.of(
            "if", "else", "for", "while", "switch", "case", "try", "catch", "&&", "||", "?");

    private static final int SCALE = 2;

    private HeuristicComplexity() {
    }

    /**
     * {@code min(100, (1 + occurrences) * 2)}.
     */
    static double estimate(String code) {
        long raw = 1;
        for (String keyword : KEYWORDS) {
            raw += SourceText.countOccurrences(code, keyword);
        }
        return Math.min(ParseResult.MAX_COMPLEXITY, raw * SCALE);
    }
}
