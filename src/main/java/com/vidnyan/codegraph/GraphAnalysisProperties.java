package com.vidnyan.codegraph;

import com.vidnyan.codegraph.domain.analysis.PageRankSettings;
import com.vidnyan.codegraph.domain.analysis.PatternThresholds;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for graph analysis.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "codegraph.analysis")
public class GraphAnalysisProperties {
    
    /**
     * JSON relationship file to analyze.
     * Default: empty, the CLI runner does nothing
     */
    private String inputPath = "";
    
    /**
     * Where to write the JSON report. Empty: log only.
     */
    private String outputPath = "";
    
    /**
     * Also compute clustering, path lengths and connectivity.
     */
    private boolean includeNetworkMetrics = true;
    
    private PageRank pageRank = new PageRank();
    
    private Thresholds thresholds = new Thresholds();
    
    @Data
    public static class PageRank {
        private double damping = PageRankSettings.DEFAULTS.damping();
        private int maxIterations = PageRankSettings.DEFAULTS.maxIterations();
        private double tolerance = PageRankSettings.DEFAULTS.tolerance();
    }
    
    @Data
    public static class Thresholds {
        private int maxCallCycles = PatternThresholds.DEFAULTS.maxCallCycles();
        private double maxAverageInstability = PatternThresholds.DEFAULTS.maxAverageInstability();
        private int maxNodeCoupling = PatternThresholds.DEFAULTS.maxNodeCoupling();
        private double maxDependencyDensity = PatternThresholds.DEFAULTS.maxDependencyDensity();
        private double maxCallDensity = PatternThresholds.DEFAULTS.maxCallDensity();
    }
    
    @PostConstruct
    public void init() {
        // Fail fast on out-of-range PageRank settings
        toPageRankSettings();
    }
    
    public PageRankSettings toPageRankSettings() {
        return new PageRankSettings(pageRank.damping, pageRank.maxIterations, pageRank.tolerance);
    }
    
    public PatternThresholds toPatternThresholds() {
        return new PatternThresholds(
                thresholds.maxCallCycles,
                thresholds.maxAverageInstability,
                thresholds.maxNodeCoupling,
                thresholds.maxDependencyDensity,
                thresholds.maxCallDensity
        );
    }
}
