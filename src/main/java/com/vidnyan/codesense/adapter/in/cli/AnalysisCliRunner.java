package com.vidnyan.codesense.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codesense.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.codesense.domain.analysis.DefectPrediction;
import com.vidnyan.codesense.domain.model.CodeMetrics;
import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceLanguage;
import com.vidnyan.codesense.domain.rule.FlaggedSection;
import com.vidnyan.codesense.domain.rule.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI Runner for analysing one local file.
 * Runs when the codesense.analyze.file property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private static final int MAX_ISSUES = 100;

    private final AnalyzeCodeUseCase analyzeCodeUseCase;
    private final ObjectMapper objectMapper;

    @Value("${codesense.analyze.file:}")
    private String file;

    @Value("${codesense.analyze.language:}")
    private String language;

    @Value("${codesense.analyze.json:false}")
    private boolean json;

    @Override
    public void run(String... args) throws IOException {
        if (file == null || file.isBlank()) {
            log.info("No file specified. Set codesense.analyze.file property.");
            return;
        }
        Report report = analyze(Path.of(file), language);
        if (json) {
            log.info("{}", toJson(report));
        } else {
            print(report);
        }
    }

    /**
     * Analyse a file. A blank language is inferred from the file extension.
     * Bytes that are not valid UTF-8 are replaced with U+FFFD.
     */
    public Report analyze(Path path, String languageOverride) throws IOException {
        String code = readLenient(path);
        String tag = languageOverride == null || languageOverride.isBlank()
                ? SourceLanguage.inferTag(path.getFileName().toString())
                : SourceLanguage.normalize(languageOverride);

        ParseResult structure = analyzeCodeUseCase.parse(code, tag);
        CodeMetrics metrics = analyzeCodeUseCase.metrics(code, tag);
        DefectPrediction prediction = analyzeCodeUseCase.analyze(code, tag);
        Map<Severity, Integer> severities = analyzeCodeUseCase.summarize(prediction.flaggedSections());
        return new Report(path.toString(), tag, structure, metrics, prediction, severities);
    }

    static String readLenient(Path path) throws IOException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .decode(ByteBuffer.wrap(Files.readAllBytes(path)))
                .toString();
    }

    /**
     * Everything known about one analysed file.
     */
    public record Report(
            String file,
            String language,
            ParseResult structure,
            CodeMetrics metrics,
            DefectPrediction prediction,
            Map<Severity, Integer> severities
    ) {}

    String toJson(Report report) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("file", report.file());
        body.put("language", report.language());
        body.put("structure", report.structure());
        body.put("metrics", report.metrics());
        body.put("prediction", report.prediction());
        Map<String, Integer> severities = new LinkedHashMap<>();
        report.severities().forEach((severity, count) -> severities.put(severity.tag(), count));
        body.put("severity_summary", severities);
        return objectMapper.writeValueAsString(body);
    }

    private void print(Report report) {
        CodeMetrics metrics = report.metrics();
        DefectPrediction prediction = report.prediction();

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║           CodeSense - Defect Risk Analysis                   ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ File:     {}", truncate(report.file(), 50));
        log.info("║ Language: {}", report.language());
        log.info("╚══════════════════════════════════════════════════════════════╝");

        report.structure().errors().forEach(error -> log.warn(" {}", error));

        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" METRICS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Lines:            {} total, {} code, {} blank, {} comment",
                metrics.totalLines(), metrics.codeLines(), metrics.blankLines(), metrics.commentLines());
        log.info(" Functions:        {} (avg {} lines)", metrics.functionCount(),
                String.format("%.1f", metrics.averageFunctionLength()));
        log.info(" Classes:          {}", metrics.classCount());
        log.info(" Imports:          {}", metrics.importCount());
        log.info(" Complexity:       {}/100", metrics.complexityScore());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" RISK:             {} ({}), confidence {}",
                prediction.riskScore(), prediction.riskLevel().tag().toUpperCase(Locale.ROOT), prediction.confidence());
        report.severities().forEach((severity, count) ->
                log.info("   {} {}", String.format("%-11s", severity.tag() + ":"), count));
        log.info("═══════════════════════════════════════════════════════════════");

        if (prediction.issuesDetected().isEmpty()) {
            log.info("");
            log.info("No issues found.");
            return;
        }

        log.info("");
        log.info(" ISSUES:");
        log.info("───────────────────────────────────────────────────────────────");
        int count = 0;
        for (FlaggedSection section : prediction.flaggedSections()) {
            if (++count > MAX_ISSUES) {
                log.info(" ... and {} more", prediction.flaggedSections().size() - MAX_ISSUES);
                break;
            }
            log.info(" [{}] {} {}", section.severity().tag().toUpperCase(Locale.ROOT), section.ruleId(), section.summary());
            log.info("     {}", section.code());
        }
        int smells = prediction.issuesDetected().size() - prediction.flaggedSections().size();
        prediction.issuesDetected().stream()
                .skip(prediction.flaggedSections().size())
                .limit(MAX_ISSUES)
                .forEach(smell -> log.info(" [SMELL] {}", smell));
        if (smells > MAX_ISSUES) {
            log.info(" ... and {} more smells", smells - MAX_ISSUES);
        }
    }

    private static String truncate(String path, int maxLength) {
        return path.length() <= maxLength ? path : "..." + path.substring(path.length() - maxLength + 3);
    }
}
