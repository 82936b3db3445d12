package com.vidnyan.codesense.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.codesense.domain.analysis.ScoreFusion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for CodeSense components.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class CodeSenseConfiguration {

    /**
     * ObjectMapper for catalog files and JSON reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Score fusion policy with the configured weights.
     */
    @Bean
    public ScoreFusion scoreFusion(AnalysisProperties properties) {
        AnalysisProperties.Fusion fusion = properties.getFusion();
        log.info("Score fusion: ml weight {}, pattern weight {}, pattern normalizer {}",
                fusion.getMlWeight(), fusion.getPatternWeight(), fusion.getPatternNormalizer());
        return new ScoreFusion(new ScoreFusion.Weights(
                fusion.getMlWeight(), fusion.getPatternWeight(), fusion.getPatternNormalizer()));
    }
}
