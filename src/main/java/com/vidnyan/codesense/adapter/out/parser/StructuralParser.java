package com.vidnyan.codesense.adapter.out.parser;

import com.vidnyan.codesense.application.port.out.SourceCodeParser;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceLanguage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Dispatches a snippet to the extractor of its language.
 * Unknown languages get an empty structure, one diagnostic and a heuristic complexity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuralParser implements SourceCodeParser {

    private final PythonStructureExtractor pythonExtractor;
    private final JavaStructureExtractor javaExtractor;
    private final ScriptStructureExtractor scriptExtractor;

    /**
     * Parser wired with the default extractors.
     */
    public static StructuralParser withDefaults() {
        return new StructuralParser(
                new PythonStructureExtractor(),
                new JavaStructureExtractor(),
                new ScriptStructureExtractor());
    }

    @Override
    public ParseResult parse(String code, String language) {
        Objects.requireNonNull(code, "code");
        String tag = SourceLanguage.normalize(language);
        Optional<SourceLanguage> resolved = SourceLanguage.fromTag(tag);

        if (resolved.isEmpty()) {
            log.debug("No extractor for '{}', falling back to heuristic analysis", tag);
            return ParseResult.degraded(tag,
                    List.of("No specific parser for " + tag + ", using generic analysis"),
                    HeuristicComplexity.estimate(code));
        }

        SourceLanguage sourceLanguage = resolved.get();
        StructureExtractor extractor = switch (sourceLanguage) {
            case PYTHON -> pythonExtractor;
            case JAVA -> javaExtractor;
            case JAVASCRIPT, TYPESCRIPT -> scriptExtractor;
        };

        try {
            ParseResult result = extractor.extract(code, sourceLanguage);
            log.debug("Parsed {} snippet: {} functions, {} classes, {} imports, complexity {}",
                    tag, result.functions().size(), result.classes().size(),
                    result.imports().size(), result.complexityScore());
            return result;
        } catch (RuntimeException e) {
            log.warn("Extractor for {} failed: {}", tag, e.getMessage());
            return ParseResult.degraded(tag, List.of("Parse error: " + e.getMessage()), 0.0);
        }
    }
}
