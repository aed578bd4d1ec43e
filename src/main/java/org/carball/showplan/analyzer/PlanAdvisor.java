package org.carball.showplan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.config.AdvisorConfig;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.parser.ShowPlanParser;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes a plan and runs the analyzer over it.
 */
@Slf4j
public class PlanAdvisor {

    private final PlanAnalyzer analyzer;

    public PlanAdvisor() {
        this(AnalyzerThresholds.defaults());
    }

    public PlanAdvisor(AdvisorConfig config) {
        this(config.getThresholds() != null ? config.getThresholds() : AnalyzerThresholds.defaults());
    }

    public PlanAdvisor(AnalyzerThresholds thresholds) {
        this.analyzer = new PlanAnalyzer(thresholds);
        log.debug("Initialized PlanAdvisor: {}", thresholds.getConfigurationSummary());
    }

    public ParsedPlan analyze(String xml) {
        ParsedPlan plan = ShowPlanParser.parse(xml);
        analyzer.analyze(plan);
        logSummary(plan);
        return plan;
    }

    public ParsedPlan analyzeFile(Path planFile) throws IOException {
        ParsedPlan plan = ShowPlanParser.parseFile(planFile);
        analyzer.analyze(plan);
        logSummary(plan);
        return plan;
    }

    private static void logSummary(ParsedPlan plan) {
        if (!plan.hasStatements()) {
            log.info("Plan contains no statements");
            return;
        }
        int statements = 0;
        int warnings = 0;
        for (PlanStatement statement : plan.allStatements()) {
            statements++;
            warnings += statement.getAllWarnings().size();
        }
        log.info("Analyzed {} statement(s), {} warning(s), {} missing index suggestion(s)",
                statements, warnings, plan.allMissingIndexes().size());
    }
}
