package com.di.qualitygate.report;

import com.di.qualitygate.exception.ReportingException;
import com.di.qualitygate.model.AnomalyReport;
import com.di.qualitygate.model.ColumnProfile;
import com.di.qualitygate.model.TableProfile;
import com.di.qualitygate.model.ValidationResult;
import com.di.qualitygate.pipeline.ExecutionStats;
import com.di.qualitygate.pipeline.TableExecution;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the results of a run into a summary, a JSON document and an HTML page.
 * Aggregation is pure; only the export methods touch the file system, and they overwrite earlier output.
 */
@Slf4j
public class DataQualityReporter {

    public static final String JSON_FILE = "quality_report.json";
    public static final String HTML_FILE = "data_quality_report.html";

    private static final String STYLE = """
            body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', sans-serif; margin: 0; padding: 20px; background: #f5f5f5; }
            .container { max-width: 1200px; margin: 0 auto; background: white; padding: 30px; border-radius: 8px; box-shadow: 0 2px 8px rgba(0,0,0,0.1); }
            h1 { color: #333; border-bottom: 3px solid #4CAF50; padding-bottom: 10px; }
            h2 { color: #555; margin-top: 30px; }
            .summary { display: grid; grid-template-columns: repeat(auto-fit, minmax(200px, 1fr)); gap: 20px; margin: 20px 0; }
            .summary-card { background: #f8f9fa; padding: 20px; border-radius: 6px; border-left: 4px solid #4CAF50; }
            .summary-card h3 { margin: 0 0 10px 0; color: #666; font-size: 14px; }
            .summary-card .value { font-size: 28px; font-weight: bold; color: #333; }
            table { width: 100%; border-collapse: collapse; margin: 20px 0; }
            th { background: #4CAF50; color: white; padding: 12px; text-align: left; font-weight: 600; }
            td { padding: 10px; border-bottom: 1px solid #ddd; }
            tr:hover { background: #f5f5f5; }
            .pass { background: #e8f5e9; }
            .fail { background: #ffebee; }
            .timestamp { color: #999; font-size: 14px; text-align: center; margin-top: 30px; }
            """;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DataQualityReporter(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public DataQualityReporter() {
        this(Clock.systemDefaultZone());
    }

    public QualitySummary generateSummaryReport(ExecutionStats stats) {
        long total = 0;
        long passed = 0;
        long critical = 0;
        long warnings = 0;
        int profiledTables = 0;
        long rows = 0;
        long columns = 0;
        long outliers = 0;
        for (TableExecution table : stats.getTables().values()) {
            for (ValidationResult result : table.getValidationResults()) {
                total++;
                if (result.isPassed()) {
                    passed++;
                } else if (result.isCriticalFailure()) {
                    critical++;
                } else {
                    warnings++;
                }
            }
            TableProfile profile = table.getProfile();
            if (profile != null) {
                profiledTables++;
                rows += profile.getRowCount();
                columns += profile.getColumnCount();
            }
            if (table.getAnomalies() != null) {
                outliers += table.getAnomalies().totalOutliers();
            }
        }
        return new QualitySummary(
                Instant.now(clock),
                stats.getRunId(),
                total,
                passed,
                total - passed,
                critical,
                warnings,
                total == 0 ? 0.0 : passed * 100.0 / total,
                profiledTables,
                rows,
                columns,
                outliers,
                stats.getLoadedTables(),
                stats.getPartiallyLoadedTables(),
                stats.getFailedTables());
    }

    /**
     * Writes {@code table -> {status, execution, validation, profile, anomalies}} as JSON.
     *
     * @throws ReportingException if the file cannot be written
     */
    public Path exportToJson(ExecutionStats stats, Path output) {
        Map<String, Object> root = new LinkedHashMap<>();
        stats.getTables().forEach((name, table) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", table.getStatus());
            entry.put("execution", table);
            entry.put("validation", table.getValidationResults());
            entry.put("profile", table.getProfile());
            entry.put("anomalies", table.getAnomalies());
            root.put(name, entry);
        });
        try {
            createParent(output);
            objectMapper.writeValue(output.toFile(), root);
        } catch (IOException e) {
            throw new ReportingException("Failed to write JSON report to " + output + ": " + e.getMessage(), e);
        }
        log.info("[REPORT] JSON report written to {}", output);
        return output;
    }

    /**
     * Writes a standalone HTML page with summary cards, table status, validation results, profiles and anomalies.
     *
     * @throws ReportingException if the file cannot be written
     */
    public Path generateHtmlReport(ExecutionStats stats, Path output) {
        String html = renderHtml(stats, generateSummaryReport(stats));
        try {
            createParent(output);
            Files.writeString(output, html, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportingException("Failed to write HTML report to " + output + ": " + e.getMessage(), e);
        }
        log.info("[REPORT] HTML report written to {}", output);
        return output;
    }

    /** Writes both artifacts into {@code reportDir}. */
    public List<Path> writeReports(ExecutionStats stats, Path reportDir) {
        List<Path> written = new ArrayList<>(2);
        written.add(exportToJson(stats, reportDir.resolve(JSON_FILE)));
        written.add(generateHtmlReport(stats, reportDir.resolve(HTML_FILE)));
        return written;
    }

    String renderHtml(ExecutionStats stats, QualitySummary summary) {
        StringBuilder html = new StringBuilder(8192);
        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n")
                .append("<title>Data Quality Report</title>\n<style>\n").append(STYLE).append("</style>\n</head>\n")
                .append("<body>\n<div class=\"container\">\n<h1>Data Quality Report</h1>\n")
                .append("<p>Run ").append(esc(stats.getRunId())).append("</p>\n");

        html.append("<div class=\"summary\">\n");
        card(html, "Total Checks", String.valueOf(summary.totalChecks()), null);
        card(html, "Passed", String.valueOf(summary.passedChecks()), "#4CAF50");
        card(html, "Failed", String.valueOf(summary.failedChecks()), "#f44336");
        card(html, "Pass Rate", String.format(Locale.ROOT, "%.1f%%", summary.passRate()), null);
        card(html, "Rows Loaded", String.valueOf(stats.getRowsLoaded()), null);
        card(html, "Outliers", String.valueOf(summary.totalOutliers()), null);
        html.append("</div>\n");

        html.append("<h2>Table Status</h2>\n<table>\n<thead><tr><th>Table</th><th>Status</th><th>Extracted</th>")
                .append("<th>Dropped</th><th>Rejected</th><th>Loaded</th><th>Failed</th><th>Load</th><th>Failure</th></tr></thead>\n<tbody>\n");
        stats.getTables().forEach((name, t) -> html.append("<tr class=\"")
                .append(t.getFailureStage() == null ? "pass" : "fail").append("\">")
                .append(td(name)).append(td(t.getStatus())).append(td(t.getRowsExtracted()))
                .append(td(t.getRowsDroppedByTransform())).append(td(t.getRowsRejected()))
                .append(td(t.getRowsLoaded())).append(td(t.getRowsFailed())).append(td(t.getLoadOutcome()))
                .append(td(t.getFailureStage() == null ? "" : t.getFailureStage() + ": " + t.getFailureCause()))
                .append("</tr>\n"));
        html.append("</tbody>\n</table>\n");

        html.append("<h2>Validation Results</h2>\n<table>\n<thead><tr><th>Table</th><th>Check</th><th>Source</th>")
                .append("<th>Severity</th><th>Message</th><th>Failing Rows</th><th>Percentage</th></tr></thead>\n<tbody>\n");
        for (TableExecution t : stats.getTables().values()) {
            for (ValidationResult r : t.getValidationResults()) {
                html.append("<tr class=\"").append(r.isPassed() ? "pass" : "fail").append("\">")
                        .append(td(t.getTable())).append(td(r.getRuleName())).append(td(r.getSource()))
                        .append(td(r.getSeverity())).append(td(r.getMessage())).append(td(r.getFailingRowCount()))
                        .append(td(String.format(Locale.ROOT, "%.2f%%", r.getFailingPercentage())))
                        .append("</tr>\n");
            }
        }
        html.append("</tbody>\n</table>\n");

        html.append("<h2>Profiles</h2>\n<table>\n<thead><tr><th>Table</th><th>Column</th><th>Kind</th><th>Nulls</th>")
                .append("<th>Mean</th><th>Std</th><th>Min</th><th>Max</th><th>Distinct</th><th>Top Value</th></tr></thead>\n<tbody>\n");
        for (TableExecution t : stats.getTables().values()) {
            if (t.getProfile() == null) {
                continue;
            }
            for (ColumnProfile c : t.getProfile().getColumns()) {
                html.append("<tr>").append(td(t.getTable())).append(td(c.getColumn())).append(td(c.getKind()))
                        .append(td(String.format(Locale.ROOT, "%d (%.2f%%)", c.getNullCount(), c.getNullPercentage())))
                        .append(td(num(c.getMean()))).append(td(num(c.getStd())))
                        .append(td(c.getMinDate() != null ? c.getMinDate() : num(c.getMin())))
                        .append(td(c.getMaxDate() != null ? c.getMaxDate() : num(c.getMax())))
                        .append(td(c.getDistinctCount())).append(td(c.getTopValue()))
                        .append("</tr>\n");
            }
        }
        html.append("</tbody>\n</table>\n");

        html.append("<h2>Anomalies</h2>\n<table>\n<thead><tr><th>Table</th><th>Columns</th><th>Method</th>")
                .append("<th>Outliers</th><th>Percentage</th><th>Sample Values</th></tr></thead>\n<tbody>\n");
        for (TableExecution t : stats.getTables().values()) {
            if (t.getAnomalies() == null) {
                continue;
            }
            for (AnomalyReport a : t.getAnomalies().getReports()) {
                html.append("<tr>").append(td(t.getTable())).append(td(String.join(", ", a.getColumns())))
                        .append(td(a.getMethod())).append(td(a.getOutlierCount()))
                        .append(td(String.format(Locale.ROOT, "%.2f%%", a.getOutlierPercentage())))
                        .append(td(a.getSampleValues()))
                        .append("</tr>\n");
            }
        }
        html.append("</tbody>\n</table>\n");

        html.append("<div class=\"timestamp\">Generated ").append(esc(summary.generatedAt())).append("</div>\n")
                .append("</div>\n</body>\n</html>\n");
        return html.toString();
    }

    private static void card(StringBuilder html, String title, String value, String color) {
        html.append("<div class=\"summary-card\"><h3>").append(esc(title)).append("</h3><div class=\"value\"");
        if (color != null) {
            html.append(" style=\"color: ").append(color).append(";\"");
        }
        html.append('>').append(esc(value)).append("</div></div>\n");
    }

    private static String td(Object value) {
        return "<td>" + esc(value) + "</td>";
    }

    private static String esc(Object value) {
        return value == null ? "" : HtmlUtils.htmlEscape(String.valueOf(value));
    }

    private static String num(Double value) {
        return value == null ? "" : String.format(Locale.ROOT, "%.2f", value);
    }

    private static void createParent(Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
