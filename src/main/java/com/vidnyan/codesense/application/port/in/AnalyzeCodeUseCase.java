package com.vidnyan.codesense.application.port.in;

import com.vidnyan.codesense.domain.analysis.DefectPrediction;
import com.vidnyan.codesense.domain.model.CodeMetrics;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.rule.FlaggedSection;
import com.vidnyan.codesense.domain.rule.Severity;

import java.util.List;
import java.util.Map;

/**
 * Primary use case: static analysis and defect-risk scoring of a code snippet.
 * This is the entry point used by documentation, review and API layers.
 */
public interface AnalyzeCodeUseCase {

    /**
     * Extract the structural model of a snippet.
     */
    ParseResult parse(String code, String language);

    /**
     * Size and complexity statistics of a snippet.
     */
    CodeMetrics metrics(String code, String language);

    /**
     * Rule scan, code smells and classifier probability fused into one risk verdict.
     */
    DefectPrediction analyze(String code, String language);

    /**
     * Count flagged sections per severity. Every severity is present, absent ones count zero.
     */
    Map<Severity, Integer> summarize(List<FlaggedSection> flagged);
}
