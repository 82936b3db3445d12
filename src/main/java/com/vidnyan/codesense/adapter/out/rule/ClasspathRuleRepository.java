package com.vidnyan.codesense.adapter.out.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codesense.application.port.out.RuleRepository;
import com.vidnyan.codesense.config.AnalysisProperties;
import com.vidnyan.codesense.domain.rule.Rule;
import com.vidnyan.codesense.domain.rule.RuleCatalog;
import com.vidnyan.codesense.domain.rule.RuleCatalogException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classpath based rule repository.
 * Loads one JSON catalog file per language; any defect in a file fails start-up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClasspathRuleRepository implements RuleRepository {

    private final ObjectMapper objectMapper;
    private final AnalysisProperties properties;

    private volatile RuleCatalog catalog;

    @PostConstruct
    public void loadRules() {
        catalog = readCatalog(properties.getRulesPath());
    }

    @Override
    public RuleCatalog catalog() {
        RuleCatalog loaded = catalog;
        if (loaded == null) {
            synchronized (this) {
                if (catalog == null) {
                    loadRules();
                }
                loaded = catalog;
            }
        }
        return loaded;
    }

    RuleCatalog readCatalog(String rulesPath) {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(rulesPath);
        } catch (IOException e) {
            throw new RuleCatalogException("cannot resolve rule catalog location " + rulesPath, e);
        }
        if (resources.length == 0) {
            throw new RuleCatalogException("no rule catalog files found at " + rulesPath);
        }
        // resolver order is not guaranteed; file name order keeps loading reproducible
        Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));

        List<Rule> rules = new ArrayList<>();
        Set<String> versions = new TreeSet<>();
        for (Resource resource : resources) {
            CatalogFileDto file = read(resource);
            if (file.language == null || file.language.isBlank()) {
                throw new RuleCatalogException("catalog file " + resource.getFilename() + " has no language");
            }
            if (file.version != null) {
                versions.add(file.version);
            }
            List<RuleDto> entries = file.rules != null ? file.rules : List.of();
            for (RuleDto dto : entries) {
                rules.add(Rule.compile(dto.id, file.language, dto.pattern, dto.message, dto.severity));
            }
            log.info("Loaded {} {} rules from {}", entries.size(), file.language, resource.getFilename());
        }

        if (rules.isEmpty()) {
            throw new RuleCatalogException("rule catalog at " + rulesPath + " contains no rules");
        }
        String version = versions.isEmpty() ? "unversioned" : String.join("+", versions);
        RuleCatalog loaded = RuleCatalog.of(version, rules);
        log.info("Rule catalog {} ready: {} rules for languages {}", version, loaded.size(), loaded.languages());
        return loaded;
    }

    private CatalogFileDto read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, CatalogFileDto.class);
        } catch (IOException e) {
            throw new RuleCatalogException("cannot read rule catalog " + resource.getFilename() + ": " + e.getMessage(), e);
        }
    }

    // DTO classes for JSON deserialization
    static class CatalogFileDto {
        public String language;
        public String version;
        public List<RuleDto> rules;
    }

    static class RuleDto {
        public String id;
        public String pattern;
        public String message;
        public String severity;
    }
}
