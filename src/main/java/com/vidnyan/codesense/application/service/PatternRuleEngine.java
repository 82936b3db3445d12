package com.vidnyan.codesense.application.service;

import com.vidnyan.codesense.application.port.out.RuleRepository;
import com.vidnyan.codesense.config.AnalysisProperties;
import com.vidnyan.codesense.domain.model.SourceLanguage;
import com.vidnyan.codesense.domain.model.SourceText;
import com.vidnyan.codesense.domain.rule.FlaggedSection;
import com.vidnyan.codesense.domain.rule.Rule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-by-line anti-pattern scan plus threshold-based code smells.
 *
 * Matching is textual: a rule also fires inside strings and comments. Output is rule-major, then
 * by ascending line within a rule.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternRuleEngine {

    private static final Pattern BOOLEAN_OPERATOR = Pattern.compile(
            "\\b(?:and|or)\\b|&&|\\|\\|", Pattern.CASE_INSENSITIVE);

    private final RuleRepository ruleRepository;
    private final AnalysisProperties properties;

    /**
     * Flag every line matched by a rule of the language or of the general set.
     */
    public List<FlaggedSection> scan(String code, String language) {
        String tag = SourceLanguage.normalize(language);
        List<Rule> rules = ruleRepository.catalog().rulesFor(tag);
        List<String> lines = SourceText.lines(code);

        List<FlaggedSection> flagged = new ArrayList<>();
        for (Rule rule : rules) {
            for (int i = 0; i < lines.size(); i++) {
                if (rule.matches(lines.get(i))) {
                    flagged.add(FlaggedSection.of(rule, i + 1, lines.get(i)));
                }
            }
        }
        log.debug("Scanned {} lines with {} {} rules: {} hits", lines.size(), rules.size(), tag, flagged.size());
        return flagged;
    }

    /**
     * Smell summaries: all long lines, then deep nesting, then complex conditions.
     */
    public List<String> detectSmells(String code) {
        AnalysisProperties.Smells smells = properties.getSmells();
        List<String> lines = SourceText.lines(code);
        List<String> issues = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int length = line.codePointCount(0, line.length());
            if (length > smells.getLongLine()) {
                issues.add(String.format("Line %d: Line too long (> %d chars) (%d chars)",
                        i + 1, smells.getLongLine(), length));
            }
        }
        for (int i = 0; i < lines.size(); i++) {
            int nesting = SourceText.leadingWhitespace(lines.get(i)) / smells.getIndentWidth();
            if (nesting > smells.getDeepNesting()) {
                issues.add(String.format("Line %d: Deep nesting level (> %d) (level %d)",
                        i + 1, smells.getDeepNesting(), nesting));
            }
        }
        for (int i = 0; i < lines.size(); i++) {
            if (countBooleanOperators(lines.get(i)) > smells.getComplexCondition()) {
                issues.add(String.format("Line %d: Complex boolean condition (> %d operators)",
                        i + 1, smells.getComplexCondition()));
            }
        }
        return issues;
    }

    static int countBooleanOperators(String line) {
        Matcher matcher = BOOLEAN_OPERATOR.matcher(line);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
