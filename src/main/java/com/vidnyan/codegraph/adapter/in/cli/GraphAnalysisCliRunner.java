package com.vidnyan.codegraph.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codegraph.GraphAnalysisProperties;
import com.vidnyan.codegraph.application.port.in.AnalyzeGraphUseCase;
import com.vidnyan.codegraph.application.port.in.AnalyzeGraphUseCase.AnalysisReport;
import com.vidnyan.codegraph.application.port.in.AnalyzeGraphUseCase.AnalysisRequest;
import com.vidnyan.codegraph.application.port.out.RelationshipLoadException;
import com.vidnyan.codegraph.domain.graph.GraphKind;
import com.vidnyan.codegraph.domain.metrics.CentralityMetrics;
import com.vidnyan.codegraph.domain.metrics.GraphStats;
import com.vidnyan.codegraph.domain.metrics.NetworkMetrics;
import com.vidnyan.codegraph.report.GraphReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * CLI Runner for standalone graph analysis.
 * Runs analysis when codegraph.analysis.input-path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphAnalysisCliRunner implements CommandLineRunner {

    private static final int MAX_CYCLES_SHOWN = 10;
    private static final int TOP_NODES = 5;

    private final AnalyzeGraphUseCase analyzeGraphUseCase;
    private final GraphAnalysisProperties properties;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) throws Exception {
        String inputPath = properties.getInputPath();
        if (inputPath == null || inputPath.isBlank()) {
            log.info("No input path specified. Set codegraph.analysis.input-path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              CodeGraph - Codebase Graph Analysis              ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(inputPath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            AnalysisRequest request = new AnalysisRequest(Path.of(inputPath), properties.isIncludeNetworkMetrics());
            AnalysisReport report = analyzeGraphUseCase.analyze(request);

            printResults(report);
            printIssues(report);

            String outputPath = properties.getOutputPath();
            if (outputPath != null && !outputPath.isBlank()) {
                writeReport(report, Path.of(outputPath));
            }

            log.info("");
            log.info("Analysis complete!");
        } catch (RelationshipLoadException e) {
            exitCode = 1;
            log.error("Graph analysis unavailable: {}", e.getMessage(), e);
        } finally {
            final int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(AnalysisReport report) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" GRAPH ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Relationships:    {}", report.stats().relationshipsLoaded());
        log.info(" Total cycles:     {}", report.result().cycles().totalCycles());
        log.info(" Components:       {}", report.result().components().totalComponents());
        log.info(" Duration:         {}ms", report.stats().totalDurationMs());

        for (GraphKind kind : GraphKind.values()) {
            GraphStats stats = report.result().statistics().statsFor(kind);
            log.info("───────────────────────────────────────────────────────────────");
            log.info(" {}", kind.key().toUpperCase());
            log.info("   Nodes: {}  Edges: {}  Density: {}  Avg degree: {}",
                    stats.nodeCount(), stats.edgeCount(),
                    format(stats.density()), format(stats.averageDegree()));

            NetworkMetrics network = report.networkMetrics().get(kind);
            if (network != null) {
                log.info("   Clustering: {}  Avg path: {}  Diameter: {}  Components: {} (largest {})",
                        format(network.clusteringCoefficient()),
                        format(network.averagePathLength()),
                        network.diameter(),
                        network.connectedComponents(),
                        network.largestComponentSize());
            }

            CentralityMetrics centrality = report.result().centralityFor(kind);
            List<Map.Entry<Integer, Double>> top = centrality.topPageRank(TOP_NODES);
            if (!top.isEmpty()) {
                log.info("   Top PageRank: {}", top.stream()
                        .map(e -> report.nameOf(kind, e.getKey()) + "=" + format(e.getValue()))
                        .collect(Collectors.joining(", ")));
            }

            printCycles(report, kind);
        }
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void printCycles(AnalysisReport report, GraphKind kind) {
        List<List<Integer>> cycles = report.result().cycles().cyclesFor(kind);
        if (cycles.isEmpty()) {
            return;
        }
        log.info("   Cycles: {}", cycles.size());
        int count = 0;
        for (List<Integer> cycle : cycles) {
            if (++count > MAX_CYCLES_SHOWN) {
                log.info("     ... and {} more cycles", cycles.size() - MAX_CYCLES_SHOWN);
                break;
            }
            String path = cycle.stream()
                    .map(node -> report.nameOf(kind, node))
                    .collect(Collectors.joining(" → "));
            log.info("     {} → {}", path, report.nameOf(kind, cycle.get(0)));
        }
    }

    private void printIssues(AnalysisReport report) {
        if (!report.hasIssues()) {
            log.info("");
            log.info("✅ No problematic patterns found.");
            return;
        }

        log.info("");
        log.info(" ISSUES ({}):", report.issueCount());
        log.info("───────────────────────────────────────────────────────────────");
        report.issues().forEach((category, messages) -> {
            log.info(" [{}]", category);
            messages.forEach(message -> log.info("   - {}", message));
        });
    }

    private void writeReport(AnalysisReport report, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(output.toFile(), GraphReport.build(report));
        log.info("Report written to: {}", output);
    }

    private static String format(double value) {
        return String.format("%.3f", value);
    }

    private String truncatePath(String path, int maxLength) {
        if (path.length() <= maxLength) {
            return path;
        }
        return "..." + path.substring(path.length() - maxLength + 3);
    }
}
