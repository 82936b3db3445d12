package com.vidnyan.codesense.domain.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Versioned, read-only table of anti-pattern rules keyed by language.
 * Rules tagged {@value #GENERAL} apply to every language.
 * Immutable and thread-safe.
 */
public final class RuleCatalog {

    public static final String GENERAL = "general";

    private final String version;
    private final Map<String, List<Rule>> rulesByLanguage;

    private RuleCatalog(String version, Map<String, List<Rule>> rulesByLanguage) {
        this.version = version;
        this.rulesByLanguage = rulesByLanguage;
    }

    /**
     * Build a catalog, keeping rule order within each language.
     */
    public static RuleCatalog of(String version, List<Rule> rules) {
        Set<String> ids = new HashSet<>();
        Map<String, List<Rule>> grouped = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new RuleCatalogException("duplicate rule id: " + rule.id());
            }
            grouped.computeIfAbsent(rule.language(), k -> new ArrayList<>()).add(rule);
        }
        Map<String, List<Rule>> frozen = new LinkedHashMap<>();
        grouped.forEach((language, list) -> frozen.put(language, List.copyOf(list)));
        return new RuleCatalog(version, Collections.unmodifiableMap(frozen));
    }

    /**
     * Rules applied to a language: its own rules in catalog order, then the general rules.
     */
    public List<Rule> rulesFor(String language) {
        List<Rule> result = new ArrayList<>(rulesByLanguage.getOrDefault(language, List.of()));
        if (!GENERAL.equals(language)) {
            result.addAll(rulesByLanguage.getOrDefault(GENERAL, List.of()));
        }
        return List.copyOf(result);
    }

    public String version() {
        return version;
    }

    public Set<String> languages() {
        return rulesByLanguage.keySet();
    }

    public int size() {
        return rulesByLanguage.values().stream().mapToInt(List::size).sum();
    }
}
