package com.vidnyan.codegraph.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.codegraph.GraphAnalysisProperties;
import com.vidnyan.codegraph.domain.analysis.PageRankSettings;
import com.vidnyan.codegraph.domain.analysis.PatternThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for CodeGraph components.
 * Turns configuration properties into the domain's settings values.
 */
@Slf4j
@Configuration
public class CodeGraphConfiguration {

    /**
     * ObjectMapper for reading relationship files and writing reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public PageRankSettings pageRankSettings(GraphAnalysisProperties properties) {
        PageRankSettings settings = properties.toPageRankSettings();
        log.info("PageRank: damping={}, maxIterations={}, tolerance={}",
                settings.damping(), settings.maxIterations(), settings.tolerance());
        return settings;
    }

    @Bean
    public PatternThresholds patternThresholds(GraphAnalysisProperties properties) {
        PatternThresholds thresholds = properties.toPatternThresholds();
        if (!thresholds.equals(PatternThresholds.DEFAULTS)) {
            log.info("Using custom diagnostic thresholds: {}", thresholds);
        }
        return thresholds;
    }
}
