package com.vidnyan.codesense.application.service;

import com.vidnyan.codesense.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.codesense.application.port.out.DefectClassifier;
import com.vidnyan.codesense.application.port.out.SourceCodeParser;
import com.vidnyan.codesense.domain.analysis.DefectPrediction;
import com.vidnyan.codesense.domain.analysis.ScoreFusion;
import com.vidnyan.codesense.domain.model.CodeMetrics;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.rule.FlaggedSection;
import com.vidnyan.codesense.domain.rule.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main application service that orchestrates parsing, metrics, rule scanning and classification.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeAnalysisService implements AnalyzeCodeUseCase {

    private final SourceCodeParser sourceCodeParser;
    private final MetricsCalculator metricsCalculator;
    private final PatternRuleEngine patternRuleEngine;
    private final DefectClassifier defectClassifier;
    private final ScoreFusion scoreFusion;

    @Override
    public ParseResult parse(String code, String language) {
        return sourceCodeParser.parse(code, language);
    }

    @Override
    public CodeMetrics metrics(String code, String language) {
        ParseResult parse = sourceCodeParser.parse(code, language);
        return metricsCalculator.calculate(code, parse);
    }

    @Override
    public DefectPrediction analyze(String code, String language) {
        Objects.requireNonNull(code, "code");
        List<FlaggedSection> flagged = patternRuleEngine.scan(code, language);
        List<String> smells = patternRuleEngine.detectSmells(code);
        double probability = defectClassifier.classify(code);

        DefectPrediction prediction = scoreFusion.fuse(flagged, probability, defectClassifier.confidence(), smells);
        log.debug("Analyzed {} snippet: {} rule hits, {} smells, ml={}, risk={} ({})",
                language, flagged.size(), smells.size(), probability,
                prediction.riskScore(), prediction.riskLevel());
        return prediction;
    }

    @Override
    public Map<Severity, Integer> summarize(List<FlaggedSection> flagged) {
        Map<Severity, Integer> summary = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            summary.put(severity, 0);
        }
        flagged.forEach(section -> summary.merge(section.severity(), 1, Integer::sum));
        return Collections.unmodifiableMap(summary);
    }
}
