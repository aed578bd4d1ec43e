package org.carball.showplan.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.model.plan.MissingIndex;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders an analyzed plan as JSON or Markdown. Warnings below the minimum
 * severity are left out of both renderings and the counts.
 */
@Slf4j
public class AnalysisReport {

    private static final int MAX_STATEMENT_TEXT = 500;

    private final ParsedPlan plan;
    private final WarningSeverity minSeverity;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AnalysisReport(ParsedPlan plan) {
        this(plan, WarningSeverity.INFO);
    }

    public AnalysisReport(ParsedPlan plan, WarningSeverity minSeverity) {
        this.plan = plan;
        this.minSeverity = minSeverity;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Execution Plan Analysis Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        if (plan.getBuild() != null) {
            md.append("**SQL Server Build:** ").append(plan.getBuild()).append("  \n");
        }
        md.append("\n");

        if (!plan.hasStatements()) {
            md.append("**The plan contains no statements to analyze.**\n");
            return md.toString();
        }

        Map<WarningSeverity, Integer> counts = countBySeverity();
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Statements | ").append(plan.allStatements().size()).append(" |\n");
        for (WarningSeverity severity : WarningSeverity.values()) {
            if (severity.isAtLeast(minSeverity)) {
                md.append("| ").append(severity.getMarker()).append(" ").append(severity.getDisplayName())
                        .append(" | ").append(counts.get(severity)).append(" |\n");
            }
        }
        md.append("| Missing Indexes | ").append(plan.allMissingIndexes().size()).append(" |\n\n");

        int number = 1;
        for (PlanStatement statement : plan.allStatements()) {
            appendStatement(md, number++, statement);
        }

        List<MissingIndex> missingIndexes = plan.allMissingIndexes();
        if (!missingIndexes.isEmpty()) {
            md.append("## Missing Indexes\n\n");
            for (MissingIndex index : missingIndexes) {
                md.append(String.format("**%s.%s** (impact %.1f%%)\n\n", index.getSchema(), index.getTable(),
                        index.getImpact()));
                if (index.getCreateStatement() != null) {
                    md.append("```sql\n").append(index.getCreateStatement()).append("\n```\n\n");
                }
            }
        }
        return md.toString();
    }

    private void appendStatement(StringBuilder md, int number, PlanStatement statement) {
        md.append("## Statement ").append(number);
        if (!statement.getStatementType().isEmpty()) {
            md.append(" (").append(statement.getStatementType()).append(")");
        }
        md.append("\n\n");
        if (!statement.getStatementText().isEmpty()) {
            md.append("```sql\n").append(abbreviate(statement.getStatementText())).append("\n```\n\n");
        }
        md.append(String.format("- **Estimated cost:** %.4f\n", statement.getStatementSubTreeCost()));
        md.append(String.format("- **Estimated rows:** %,.0f\n", statement.getStatementEstRows()));
        if (statement.getDegreeOfParallelism() > 0) {
            md.append("- **DOP:** ").append(statement.getDegreeOfParallelism()).append("\n");
        }
        if (statement.getQueryTimeStats() != null) {
            md.append(String.format("- **CPU / elapsed:** %,d ms / %,d ms\n",
                    statement.getQueryTimeStats().cpuTimeMs(), statement.getQueryTimeStats().elapsedTimeMs()));
        }
        md.append("\n");

        List<PlanWarning> statementWarnings = visible(statement.getPlanWarnings());
        List<NodeFinding> nodeFindings = nodeFindings(statement);
        if (statementWarnings.isEmpty() && nodeFindings.isEmpty()) {
            md.append("No findings.\n\n");
            return;
        }

        md.append("| Severity | Category | Operator | Message |\n");
        md.append("|----------|----------|----------|---------|\n");
        for (PlanWarning warning : statementWarnings) {
            appendWarningRow(md, warning, "Statement");
        }
        for (NodeFinding finding : nodeFindings) {
            appendWarningRow(md, finding.getWarning(), finding.getOperator() + " (Node " + finding.getNodeId() + ")");
        }
        md.append("\n");
    }

    private static void appendWarningRow(StringBuilder md, PlanWarning warning, String location) {
        md.append("| ").append(warning.getSeverity().getMarker()).append(" ")
                .append(warning.getSeverity().getDisplayName())
                .append(" | ").append(warning.getCategory())
                .append(" | ").append(location)
                .append(" | ").append(escapeCell(warning.getMessage()))
                .append(" |\n");
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();

        Map<WarningSeverity, Integer> counts = countBySeverity();
        Map<String, Integer> warningCounts = new LinkedHashMap<>();
        counts.forEach((severity, count) -> warningCounts.put(severity.name(), count));
        data.setMetadata(new ReportMetadata(timestamp, plan.getBuildVersion(), plan.getBuild(),
                plan.allStatements().size(), minSeverity.name(), warningCounts));

        List<StatementReport> statements = new ArrayList<>();
        for (PlanStatement statement : plan.allStatements()) {
            StatementReport report = new StatementReport();
            report.setStatementText(statement.getStatementText());
            report.setStatementType(statement.getStatementType());
            report.setEstimatedCost(statement.getStatementSubTreeCost());
            report.setEstimatedRows(statement.getStatementEstRows());
            report.setDegreeOfParallelism(statement.getDegreeOfParallelism());
            report.setWarnings(visible(statement.getPlanWarnings()));
            report.setNodeWarnings(nodeFindings(statement));
            statements.add(report);
        }
        data.setStatements(statements);
        data.setMissingIndexes(plan.allMissingIndexes());
        return data;
    }

    private Map<WarningSeverity, Integer> countBySeverity() {
        Map<WarningSeverity, Integer> counts = new EnumMap<>(WarningSeverity.class);
        for (WarningSeverity severity : WarningSeverity.values()) {
            if (severity.isAtLeast(minSeverity)) {
                counts.put(severity, 0);
            }
        }
        for (PlanStatement statement : plan.allStatements()) {
            for (PlanWarning warning : visible(statement.getAllWarnings())) {
                counts.merge(warning.getSeverity(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private List<NodeFinding> nodeFindings(PlanStatement statement) {
        List<NodeFinding> findings = new ArrayList<>();
        statement.forEachNode(node -> {
            for (PlanWarning warning : visible(node.getWarnings())) {
                findings.add(new NodeFinding(node.getNodeId(), node.getPhysicalOp(), objectOf(node), warning));
            }
        });
        return findings;
    }

    private List<PlanWarning> visible(List<PlanWarning> warnings) {
        List<PlanWarning> result = new ArrayList<>();
        for (PlanWarning warning : warnings) {
            if (warning.getSeverity().isAtLeast(minSeverity)) {
                result.add(warning);
            }
        }
        return result;
    }

    private static String objectOf(PlanNode node) {
        return node.getFullObjectName() != null ? node.getFullObjectName() : node.getObjectName();
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_STATEMENT_TEXT ? text : text.substring(0, MAX_STATEMENT_TEXT) + "...";
    }

    private static String escapeCell(String value) {
        return value == null ? "" : value.replace("|", "\\|").replace("\n", "<br>");
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private List<StatementReport> statements;
        private List<MissingIndex> missingIndexes;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime generatedAt;
        private String buildVersion;
        private String build;
        private int statementCount;
        private String minimumSeverity;
        private Map<String, Integer> warningCounts;
    }

    @lombok.Data
    private static class StatementReport {
        private String statementText;
        private String statementType;
        private double estimatedCost;
        private double estimatedRows;
        private int degreeOfParallelism;
        private List<PlanWarning> warnings;
        private List<NodeFinding> nodeWarnings;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class NodeFinding {
        private int nodeId;
        private String operator;
        private String object;
        private PlanWarning warning;
    }
}
