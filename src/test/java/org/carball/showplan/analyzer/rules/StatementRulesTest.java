package org.carball.showplan.analyzer.rules;

import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.MemoryGrantInfo;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanParameter;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.QueryTimeStats;
import org.carball.showplan.model.plan.WarningSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.showplan.PlanFixtures.actual;
import static org.carball.showplan.PlanFixtures.node;
import static org.carball.showplan.PlanFixtures.statement;
import static org.carball.showplan.PlanFixtures.timed;
import static org.carball.showplan.PlanFixtures.withChildren;

public class StatementRulesTest {

    private final AnalyzerThresholds thresholds = AnalyzerThresholds.defaults();

    @Test
    void shouldExplainSerialPlanReason() {
        // Given
        PlanStatement statement = statement("SELECT 1");
        statement.setNonParallelPlanReason("MaxDOPSetToOne");

        // When
        List<PlanWarning> warnings = new SerialPlanRule().evaluate(statement);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getCategory()).isEqualTo("Serial Plan");
        assertThat(warnings.get(0).getMessage()).isEqualTo("Query running serially: MAXDOP is set to 1.");
        assertThat(SerialPlanRule.explain("SomeNewReason")).isEqualTo("SomeNewReason");
        assertThat(new SerialPlanRule().evaluate(statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldFlagExcessiveMemoryGrant() {
        // Given
        PlanStatement wasteful = withGrant(statement("SELECT 1"), 2_000_000, 100_000);
        PlanStatement small = withGrant(statement("SELECT 1"), 500_000, 10);

        // When
        List<PlanWarning> warnings = new ExcessiveMemoryGrantRule(thresholds).evaluate(wasteful);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage())
                .startsWith("Granted 2,000,000 KB but only used 100,000 KB (20x overestimate).");
        assertThat(new ExcessiveMemoryGrantRule(thresholds).evaluate(small)).isEmpty();
    }

    @Test
    void shouldGradeMemoryGrantWait() {
        // Given
        PlanStatement longWait = withGrant(statement("SELECT 1"), 1024, 1024);
        longWait.getMemoryGrant().setGrantWaitTimeMs(6_000);
        PlanStatement shortWait = withGrant(statement("SELECT 1"), 1024, 1024);
        shortWait.getMemoryGrant().setGrantWaitTimeMs(200);
        MemoryGrantWaitRule rule = new MemoryGrantWaitRule(thresholds);

        // When
        List<PlanWarning> critical = rule.evaluate(longWait);
        List<PlanWarning> warning = rule.evaluate(shortWait);

        // Then
        assertThat(critical).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.CRITICAL);
        assertThat(critical.get(0).getMessage()).startsWith("Query waited 6,000ms for a memory grant");
        assertThat(warning).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.WARNING);
        assertThat(rule.evaluate(withGrant(statement("SELECT 1"), 1024, 1024))).isEmpty();
    }

    @Test
    void shouldNameMemoryConsumersOfLargeGrant() {
        // Given
        PlanNode hash = node(1, "Hash Match", "Inner Join");
        hash.setEstimateRows(5000);
        PlanNode sort = actual(node(2, "Sort"), 100, 10);
        withChildren(hash, sort);
        PlanStatement statement = withGrant(statement("SELECT 1", hash), 5_000_000, 4_000_000);

        // When
        List<PlanWarning> warnings = new LargeMemoryGrantRule(thresholds).evaluate(statement);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getSeverity()).isEqualTo(WarningSeverity.CRITICAL);
        assertThat(warnings.get(0).getMessage())
                .startsWith("Query granted 4883 MB of memory.")
                .contains(" Memory consumers: Hash Match (Node 1, 5,000 estimated rows), Sort (Node 2, 100 actual rows).");
    }

    @Test
    void shouldReportLargeGrantWithoutConsumersAsWarning() {
        // Given
        PlanStatement statement = withGrant(statement("SELECT 1", node(0, "Table Scan")), 2_097_152, 2_000_000);

        // When
        List<PlanWarning> warnings = new LargeMemoryGrantRule(thresholds).evaluate(statement);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getSeverity()).isEqualTo(WarningSeverity.WARNING);
        assertThat(warnings.get(0).getMessage()).isEqualTo("Query granted 2048 MB of memory.");
    }

    @Test
    void shouldFlagCompileMemoryLimit() {
        // Given
        PlanStatement aborted = statement("SELECT 1");
        aborted.setEarlyAbortReason("MemoryLimitExceeded");
        PlanStatement timedOut = statement("SELECT 1");
        timedOut.setEarlyAbortReason("TimeOut");

        // Then
        assertThat(new CompileMemoryExceededRule().evaluate(aborted))
                .extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.CRITICAL);
        assertThat(new CompileMemoryExceededRule().evaluate(timedOut)).isEmpty();
    }

    @Test
    void shouldGradeCompileCpu() {
        // Given
        HighCompileCpuRule rule = new HighCompileCpuRule(thresholds);

        // Then
        assertThat(rule.evaluate(compiled(999))).isEmpty();
        assertThat(rule.evaluate(compiled(1000))).extracting(PlanWarning::getSeverity)
                .containsExactly(WarningSeverity.WARNING);
        assertThat(rule.evaluate(compiled(7500))).extracting(PlanWarning::getSeverity)
                .containsExactly(WarningSeverity.CRITICAL);
        assertThat(rule.evaluate(compiled(7500)).get(0).getMessage()).startsWith("Query took 7,500ms of CPU");
    }

    @Test
    void shouldReportStatementLevelUdfTime() {
        // Given
        PlanStatement slow = statement("SELECT dbo.fn_Tax(Total) FROM Orders");
        slow.setQueryTimeStats(new QueryTimeStats(3000, 4000, 1200, 1500));
        PlanStatement fast = statement("SELECT dbo.fn_Tax(Total) FROM Orders");
        fast.setQueryTimeStats(new QueryTimeStats(3000, 4000, 20, 30));
        StatementUdfExecutionRule rule = new StatementUdfExecutionRule(thresholds);

        // When
        List<PlanWarning> critical = rule.evaluate(slow);

        // Then
        assertThat(critical).hasSize(1);
        assertThat(critical.get(0).getCategory()).isEqualTo("UDF Execution");
        assertThat(critical.get(0).getSeverity()).isEqualTo(WarningSeverity.CRITICAL);
        assertThat(critical.get(0).getMessage()).startsWith("Scalar UDF cost in this statement: 1,500ms elapsed, 1,200ms CPU.");
        assertThat(rule.evaluate(fast)).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.WARNING);
        assertThat(rule.evaluate(timed(statement("SELECT 1"), 10, 10))).isEmpty();
    }

    @Test
    void shouldFlagUnsniffedLocalVariables() {
        // Given
        PlanStatement statement = statement("SELECT * FROM Orders WHERE CustomerId = @a AND Region = @r");
        statement.setParameters(List.of(
                new PlanParameter("@a", "int", null, "(5)"),
                new PlanParameter("@r", "nvarchar(20)", "N'West'", "N'West'")));

        // When
        List<PlanWarning> warnings = new LocalVariablesRule().evaluate(statement);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).startsWith("Local variables detected: @a. ");
    }

    @Test
    void shouldSkipLocalVariablesWhenRecompiled() {
        // Given
        PlanStatement statement = statement("SELECT * FROM Orders WHERE CustomerId = @a OPTION (RECOMPILE)");
        statement.setParameters(List.of(new PlanParameter("@a", "int", "", null)));

        // Then
        assertThat(new LocalVariablesRule().evaluate(statement)).isEmpty();
    }

    @Test
    void shouldFlagCteReferencedMoreThanOnce() {
        // Given
        PlanStatement statement = statement("WITH recent AS (SELECT * FROM Orders), totals AS (SELECT 1 AS x) "
                + "SELECT * FROM recent r JOIN recent r2 ON r.Id = r2.ParentId CROSS JOIN totals");

        // When
        List<PlanWarning> warnings = new CteMultipleReferencesRule().evaluate(statement);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).startsWith("CTE \"recent\" is referenced 2 times.");
        assertThat(CteMultipleReferencesRule.countReferences("SELECT * FROM totals", "totals")).isEqualTo(1);
        assertThat(CteMultipleReferencesRule.countReferences("SELECT * FROM totalsArchive", "totals")).isZero();
    }

    @Test
    void shouldFlagOptimizeForUnknownHint() {
        assertThat(new OptimizeForUnknownRule().evaluate(statement("SELECT 1 OPTION (optimize  for unknown)")))
                .extracting(PlanWarning::getCategory).containsExactly("Optimize For Unknown");
        assertThat(new OptimizeForUnknownRule().evaluate(statement("SELECT 1 OPTION (OPTIMIZE FOR (@a = 1))")))
                .isEmpty();
    }

    @Test
    void shouldFlagParallelPlanThatRanSerially() {
        // Given
        IneffectiveParallelismRule rule = new IneffectiveParallelismRule(thresholds);

        // When
        List<PlanWarning> warnings = rule.evaluate(parallel(4, 1100, 1000));

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).startsWith("Parallel plan (DOP 4) but CPU time (1,100ms)");
        assertThat(rule.evaluate(parallel(4, 4000, 1000))).isEmpty();
        assertThat(rule.evaluate(parallel(4, 500, 500))).isEmpty();
        assertThat(rule.evaluate(parallel(1, 1000, 1000))).isEmpty();
        assertThat(rule.evaluate(parallel(4, 0, 2000))).isEmpty();
    }

    private static PlanStatement withGrant(PlanStatement statement, long grantedKb, long usedKb) {
        MemoryGrantInfo grant = new MemoryGrantInfo();
        grant.setGrantedMemoryKb(grantedKb);
        grant.setMaxUsedMemoryKb(usedKb);
        statement.setMemoryGrant(grant);
        return statement;
    }

    private static PlanStatement compiled(long compileCpuMs) {
        PlanStatement statement = statement("SELECT 1");
        statement.setCompileCpuMs(compileCpuMs);
        return statement;
    }

    private static PlanStatement parallel(int dop, long cpuMs, long elapsedMs) {
        PlanStatement statement = timed(statement("SELECT 1"), cpuMs, elapsedMs);
        statement.setDegreeOfParallelism(dop);
        return statement;
    }
}
