package org.carball.showplan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.analyzer.rules.CompileMemoryExceededRule;
import org.carball.showplan.analyzer.rules.CteMultipleReferencesRule;
import org.carball.showplan.analyzer.rules.DataTypeMismatchRule;
import org.carball.showplan.analyzer.rules.EagerIndexSpoolRule;
import org.carball.showplan.analyzer.rules.ExcessiveMemoryGrantRule;
import org.carball.showplan.analyzer.rules.FilterOperatorRule;
import org.carball.showplan.analyzer.rules.HighCompileCpuRule;
import org.carball.showplan.analyzer.rules.ImplicitConversionSeekAdjuster;
import org.carball.showplan.analyzer.rules.IneffectiveParallelismRule;
import org.carball.showplan.analyzer.rules.JoinOrClauseRule;
import org.carball.showplan.analyzer.rules.LargeMemoryGrantRule;
import org.carball.showplan.analyzer.rules.LazySpoolRule;
import org.carball.showplan.analyzer.rules.LocalVariablesRule;
import org.carball.showplan.analyzer.rules.LookupRule;
import org.carball.showplan.analyzer.rules.ManyToManyMergeJoinRule;
import org.carball.showplan.analyzer.rules.MemoryGrantWaitRule;
import org.carball.showplan.analyzer.rules.NestedLoopsExecutionsRule;
import org.carball.showplan.analyzer.rules.NodeUdfExecutionRule;
import org.carball.showplan.analyzer.rules.OptimizeForUnknownRule;
import org.carball.showplan.analyzer.rules.ParallelSkewRule;
import org.carball.showplan.analyzer.rules.RowCountSpoolRule;
import org.carball.showplan.analyzer.rules.RowEstimateMismatchRule;
import org.carball.showplan.analyzer.rules.RowGoalRule;
import org.carball.showplan.analyzer.rules.ScalarUdfRule;
import org.carball.showplan.analyzer.rules.ScanPredicateRule;
import org.carball.showplan.analyzer.rules.SerialPlanRule;
import org.carball.showplan.analyzer.rules.SpillSeverityAdjuster;
import org.carball.showplan.analyzer.rules.StatementUdfExecutionRule;
import org.carball.showplan.analyzer.rules.TableValuedFunctionRule;
import org.carball.showplan.analyzer.rules.TableVariableRule;
import org.carball.showplan.analyzer.rules.TopAboveScanRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;

import java.util.List;

/**
 * Walks a decoded plan and attaches findings for common performance problems.
 *
 * <p>For each statement the statement rules run first, in order. The operator tree
 * is then visited pre-order; at each node the node rules run in order, followed
 * by the warning adjusters. Statements of UDF and stored procedure sub-plans are
 * analyzed the same way.
 *
 * <p>An analyzer holds only immutable rule lists and can be shared across threads
 * as long as each call works on its own plan.
 */
@Slf4j
public class PlanAnalyzer {

    private final List<StatementRule> statementRules;
    private final List<NodeRule> nodeRules;
    private final List<WarningAdjuster> adjusters;

    public PlanAnalyzer() {
        this(AnalyzerThresholds.defaults());
    }

    public PlanAnalyzer(AnalyzerThresholds thresholds) {
        this(defaultStatementRules(thresholds), defaultNodeRules(thresholds), defaultAdjusters(thresholds));
    }

    public PlanAnalyzer(List<StatementRule> statementRules, List<NodeRule> nodeRules, List<WarningAdjuster> adjusters) {
        this.statementRules = List.copyOf(statementRules);
        this.nodeRules = List.copyOf(nodeRules);
        this.adjusters = List.copyOf(adjusters);
    }

    public static List<StatementRule> defaultStatementRules(AnalyzerThresholds thresholds) {
        return List.of(
                new SerialPlanRule(),
                new ExcessiveMemoryGrantRule(thresholds),
                new MemoryGrantWaitRule(thresholds),
                new LargeMemoryGrantRule(thresholds),
                new CompileMemoryExceededRule(),
                new HighCompileCpuRule(thresholds),
                new StatementUdfExecutionRule(thresholds),
                new LocalVariablesRule(),
                new CteMultipleReferencesRule(),
                new OptimizeForUnknownRule(),
                new IneffectiveParallelismRule(thresholds));
    }

    public static List<NodeRule> defaultNodeRules(AnalyzerThresholds thresholds) {
        return List.of(
                new FilterOperatorRule(thresholds),
                new EagerIndexSpoolRule(),
                new NodeUdfExecutionRule(thresholds),
                new RowEstimateMismatchRule(thresholds),
                new ScalarUdfRule(),
                new ParallelSkewRule(thresholds),
                new LookupRule(thresholds),
                new ScanPredicateRule(thresholds),
                new DataTypeMismatchRule(),
                new LazySpoolRule(thresholds),
                new JoinOrClauseRule(),
                new NestedLoopsExecutionsRule(thresholds),
                new ManyToManyMergeJoinRule(),
                new TableVariableRule(),
                new TableValuedFunctionRule(),
                new TopAboveScanRule(),
                new RowGoalRule(),
                new RowCountSpoolRule(thresholds));
    }

    public static List<WarningAdjuster> defaultAdjusters(AnalyzerThresholds thresholds) {
        return List.of(
                new SpillSeverityAdjuster(thresholds),
                new ImplicitConversionSeekAdjuster());
    }

    public void analyze(ParsedPlan plan) {
        if (plan == null) {
            return;
        }
        List<PlanStatement> statements = plan.allStatements();
        for (PlanStatement statement : statements) {
            analyzeStatement(statement);
        }
        log.debug("Analyzed {} statement(s) with {} statement rules, {} node rules and {} adjusters",
                statements.size(), statementRules.size(), nodeRules.size(), adjusters.size());
    }

    public void analyzeStatement(PlanStatement statement) {
        for (StatementRule rule : statementRules) {
            statement.getPlanWarnings().addAll(rule.evaluate(statement));
        }
        statement.forEachNode(node -> analyzeNode(node, statement));

        for (PlanStatement nested : statement.getSubPlanStatements()) {
            analyzeStatement(nested);
        }
    }

    private void analyzeNode(PlanNode node, PlanStatement statement) {
        for (NodeRule rule : nodeRules) {
            List<PlanWarning> findings = rule.evaluate(node, statement);
            if (!findings.isEmpty()) {
                log.debug("{} raised {} finding(s) on node {}", rule.name(), findings.size(), node.getNodeId());
                node.getWarnings().addAll(findings);
            }
        }
        for (WarningAdjuster adjuster : adjusters) {
            adjuster.adjust(node, statement);
        }
    }
}
