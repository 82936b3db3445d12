package com.vidnyan.codesense.application.service;

import com.vidnyan.codesense.domain.model.CodeMetrics;
import com.vidnyan.codesense.domain.model.FunctionEntity;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceText;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Line counts and structure statistics of a snippet, computed from its text and its parse result.
 * Function count and average length cover top-level functions only; methods are counted with their classes.
 */
@Component
public class MetricsCalculator {

    private static final List<String> COMMENT_MARKERS = List.of("#", "//", "/*", "*");

    public CodeMetrics calculate(String code, ParseResult parse) {
        List<String> lines = SourceText.lines(code);
        int blank = 0;
        int comment = 0;
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                blank++;
            } else if (isComment(trimmed)) {
                comment++;
            }
        }

        List<FunctionEntity> functions = parse.functions();
        double averageLength = functions.stream()
                .mapToInt(FunctionEntity::length)
                .average()
                .orElse(0.0);

        return new CodeMetrics(
                lines.size(),
                lines.size() - blank - comment,
                blank,
                comment,
                functions.size(),
                parse.classes().size(),
                parse.imports().size(),
                parse.complexityScore(),
                averageLength);
    }

    private static boolean isComment(String trimmed) {
        return COMMENT_MARKERS.stream().anyMatch(trimmed::startsWith);
    }
}
