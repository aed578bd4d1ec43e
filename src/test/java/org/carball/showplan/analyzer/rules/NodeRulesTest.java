package org.carball.showplan.analyzer.rules;

import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.ScalarUdfReference;
import org.carball.showplan.model.plan.WarningSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.showplan.PlanFixtures.actual;
import static org.carball.showplan.PlanFixtures.node;
import static org.carball.showplan.PlanFixtures.statement;
import static org.carball.showplan.PlanFixtures.withChildren;

public class NodeRulesTest {

    private final AnalyzerThresholds thresholds = AnalyzerThresholds.defaults();

    @Test
    void shouldFlagFilterOperatorWithPredicate() {
        // Given
        PlanNode filter = node(2, "Filter");
        filter.setPredicate("[o].[Total]>(100)");

        // When
        List<PlanWarning> warnings = new FilterOperatorRule(thresholds).evaluate(filter, statement("SELECT 1"));

        // Then
        assertThat(warnings).extracting(PlanWarning::getCategory).containsExactly("Filter Operator");
        assertThat(warnings.get(0).getMessage()).endsWith("Predicate: [o].[Total]>(100)");
        assertThat(new FilterOperatorRule(thresholds).evaluate(node(3, "Filter"), statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldAppendSuggestedIndexToEagerIndexSpool() {
        // Given
        PlanNode spool = node(5, "Index Spool", "Eager Spool");
        spool.setSuggestedIndex("CREATE INDEX [CustomerId] ON dbo.Orders (CustomerId);");
        PlanNode lazy = node(6, "Index Spool", "Lazy Spool");

        // When
        List<PlanWarning> warnings = new EagerIndexSpoolRule().evaluate(spool, statement("SELECT 1"));

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getSeverity()).isEqualTo(WarningSeverity.CRITICAL);
        assertThat(warnings.get(0).getMessage())
                .endsWith("\n\nCreate this index:\nCREATE INDEX [CustomerId] ON dbo.Orders (CustomerId);");
        assertThat(new EagerIndexSpoolRule().evaluate(lazy, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldReportEagerSpoolWithoutSuggestion() {
        // When
        List<PlanWarning> warnings = new EagerIndexSpoolRule()
                .evaluate(node(5, "Table Spool", "Eager Spool"), statement("SELECT 1"));

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).doesNotContain("Create this index");
    }

    @Test
    void shouldGradeOperatorUdfTime() {
        // Given
        PlanNode slow = node(1, "Compute Scalar");
        slow.setUdfElapsedTimeMs(1500);
        slow.setUdfCpuTimeMs(1400);
        PlanNode quick = node(2, "Compute Scalar");
        quick.setUdfElapsedTimeMs(50);
        NodeUdfExecutionRule rule = new NodeUdfExecutionRule(thresholds);

        // When
        List<PlanWarning> warnings = rule.evaluate(slow, statement("SELECT 1"));

        // Then
        assertThat(warnings).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.CRITICAL);
        assertThat(warnings.get(0).getMessage()).startsWith("Scalar UDF executing on this operator (1,500ms elapsed, 1,400ms CPU).");
        assertThat(rule.evaluate(quick, statement("SELECT 1"))).extracting(PlanWarning::getSeverity)
                .containsExactly(WarningSeverity.WARNING);
        assertThat(rule.evaluate(node(3, "Compute Scalar"), statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldReportEachScalarUdfReference() {
        // Given
        PlanNode compute = node(1, "Compute Scalar");
        compute.setScalarUdfs(List.of(
                new ScalarUdfReference("[Sales].[dbo].[fn_Tax]", false),
                new ScalarUdfReference("[Sales].[dbo].[clr_Hash]", true)));

        // When
        List<PlanWarning> warnings = new ScalarUdfRule().evaluate(compute, statement("SELECT 1"));

        // Then
        assertThat(warnings).extracting(PlanWarning::getMessage).satisfiesExactly(
                first -> assertThat(first).startsWith("Scalar T-SQL UDF: [Sales].[dbo].[fn_Tax]."),
                second -> assertThat(second).startsWith("Scalar CLR UDF: [Sales].[dbo].[clr_Hash]."));
    }

    @Test
    void shouldDistinguishRidAndKeyLookups() {
        // Given
        PlanNode rid = node(3, "RID Lookup");
        rid.setLookup(true);
        PlanNode key = node(4, "Clustered Index Seek");
        key.setLookup(true);
        key.setPredicate("[o].[Status]=N'Open'");
        PlanNode plainKey = node(5, "Clustered Index Seek");
        plainKey.setLookup(true);
        LookupRule rule = new LookupRule(thresholds);

        // Then
        assertThat(rule.evaluate(rid, statement("SELECT 1"))).extracting(PlanWarning::getCategory)
                .containsExactly("RID Lookup");
        assertThat(rule.evaluate(key, statement("SELECT 1"))).extracting(PlanWarning::getCategory)
                .containsExactly("Key Lookup");
        assertThat(rule.evaluate(key, statement("SELECT 1")).get(0).getMessage())
                .endsWith("Predicate: [o].[Status]=N'Open'");
        assertThat(rule.evaluate(plainKey, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldDetectSeekRangeThroughMismatchedTypes() {
        // Given
        PlanNode mismatched = node(2, "Compute Scalar");
        mismatched.setDefinedValues("Expr1005 = GetRangeWithMismatchedTypes([@code],NULL,(62))");
        PlanNode converted = node(3, "Compute Scalar");
        converted.setDefinedValues("Expr1006 = GetRangeThroughConvert([@d],[@d],(62))");
        PlanNode plain = node(4, "Compute Scalar");
        plain.setDefinedValues("Expr1007 = [o].[Total]*(2)");
        DataTypeMismatchRule rule = new DataTypeMismatchRule();

        // Then
        assertThat(rule.evaluate(mismatched, statement("SELECT 1")).get(0).getMessage())
                .startsWith("Mismatched data types");
        assertThat(rule.evaluate(converted, statement("SELECT 1")).get(0).getMessage())
                .startsWith("CONVERT/CAST wrapping a column");
        assertThat(rule.evaluate(plain, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldFlagLazySpoolWithoutCacheHits() {
        // Given
        PlanNode spool = node(6, "Table Spool", "Lazy Spool");
        spool.setEstimateRebinds(200);

        // When
        List<PlanWarning> warnings = new LazySpoolRule(thresholds).evaluate(spool, statement("SELECT 1"));

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getCategory()).isEqualTo("Lazy Spool Ineffective");
        assertThat(warnings.get(0).getSeverity()).isEqualTo(WarningSeverity.CRITICAL);
        assertThat(warnings.get(0).getMessage())
                .contains("(estimated)")
                .contains("no rewinds (cache hits) at all");
    }

    @Test
    void shouldPreferActualSpoolCounters() {
        // Given
        PlanNode spool = actual(node(6, "Table Spool", "Lazy Spool"), 10, 10);
        spool.setActualRebinds(200);
        spool.setActualRewinds(400);
        spool.setEstimateRebinds(1);
        LazySpoolRule rule = new LazySpoolRule(thresholds);

        // When
        List<PlanWarning> warnings = rule.evaluate(spool, statement("SELECT 1"));

        // Then
        assertThat(warnings).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.WARNING);
        assertThat(warnings.get(0).getMessage()).contains("(actual)").contains("2.0x rewinds");

        spool.setActualRewinds(1000);
        assertThat(rule.evaluate(spool, statement("SELECT 1"))).isEmpty();
        spool.setActualRebinds(50);
        spool.setActualRewinds(0);
        assertThat(rule.evaluate(spool, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldRecognizeOrExpansionInJoin() {
        // Given
        PlanNode concatenation = withChildren(node(6, "Concatenation"),
                withChildren(node(7, "Compute Scalar"), node(8, "Constant Scan")),
                node(9, "Constant Scan"));
        PlanNode join = withChildren(node(1, "Nested Loops", "Inner Join"),
                node(2, "Clustered Index Scan"),
                withChildren(node(3, "Merge Interval"),
                        withChildren(node(4, "Sort", "TopN Sort"),
                                withChildren(node(5, "Compute Scalar"), concatenation))));

        // When
        List<PlanWarning> warnings = new JoinOrClauseRule().evaluate(concatenation, statement("SELECT 1", join));

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).contains("rewrote the OR as 2 separate lookups");
    }

    @Test
    void shouldIgnoreConcatenationOutsideOrExpansion() {
        // Given
        PlanNode concatenation = withChildren(node(1, "Concatenation"),
                node(2, "Constant Scan"), node(3, "Constant Scan"));
        statement("SELECT 1 UNION ALL SELECT 2", concatenation);

        // Then
        assertThat(new JoinOrClauseRule().evaluate(concatenation, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldReportActualNestedLoopsExecutions() {
        // Given
        PlanNode inner = actual(node(3, "Index Seek"), 150_000, 800);
        inner.setActualExecutions(150_000);
        PlanNode join = withChildren(node(1, "Nested Loops", "Inner Join"), node(2, "Index Scan"), inner);
        PlanStatement statement = statement("SELECT 1", join);
        statement.setDegreeOfParallelism(4);
        NestedLoopsExecutionsRule rule = new NestedLoopsExecutionsRule(thresholds);

        // When
        List<PlanWarning> warnings = rule.evaluate(join, statement);

        // Then
        assertThat(warnings).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.WARNING);
        assertThat(warnings.get(0).getMessage()).contains("executed 150,000 times (DOP 4)");

        inner.setActualExecutions(2_000_000);
        assertThat(rule.evaluate(join, statement)).extracting(PlanWarning::getSeverity)
                .containsExactly(WarningSeverity.CRITICAL);
    }

    @Test
    void shouldFallBackToEstimatedRebinds() {
        // Given
        PlanNode inner = node(3, "Index Seek");
        inner.setEstimateRebinds(200_000);
        PlanNode join = withChildren(node(1, "Nested Loops", "Left Semi Join"), node(2, "Index Scan"), inner);
        NestedLoopsExecutionsRule rule = new NestedLoopsExecutionsRule(thresholds);

        // When
        List<PlanWarning> warnings = rule.evaluate(join, statement("SELECT 1", join));

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).contains("estimated to execute 200,001 times");

        inner.setEstimateRebinds(5_000);
        assertThat(rule.evaluate(join, statement("SELECT 1", join))).isEmpty();
    }

    @Test
    void shouldReportManyToManyMergeJoinWorktable() {
        // Given
        PlanNode estimated = node(1, "Merge Join", "Inner Join");
        estimated.setManyToMany(true);
        PlanNode withReads = actual(node(2, "Merge Join", "Inner Join"), 10, 10);
        withReads.setManyToMany(true);
        withReads.setActualLogicalReads(1234);
        PlanNode withoutReads = actual(node(3, "Merge Join", "Inner Join"), 10, 10);
        withoutReads.setManyToMany(true);
        ManyToManyMergeJoinRule rule = new ManyToManyMergeJoinRule();

        // Then
        assertThat(rule.evaluate(estimated, statement("SELECT 1")).get(0).getMessage()).contains("will create");
        assertThat(rule.evaluate(withReads, statement("SELECT 1")).get(0).getMessage()).contains("(1,234 logical reads)");
        assertThat(rule.evaluate(withoutReads, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldFlagTableVariablesAndTableValuedFunctions() {
        // Given
        PlanNode tableVariable = node(1, "Table Scan");
        tableVariable.setObjectName("@orders");
        PlanNode function = node(2, "Table-valued function", "Table-valued function");
        function.setObjectName("[dbo].[fn_Orders]");

        // Then
        assertThat(new TableVariableRule().evaluate(tableVariable, statement("SELECT 1")))
                .extracting(PlanWarning::getCategory).containsExactly("Table Variable");
        assertThat(new TableVariableRule().evaluate(function, statement("SELECT 1"))).isEmpty();
        assertThat(new TableValuedFunctionRule().evaluate(function, statement("SELECT 1")).get(0).getMessage())
                .startsWith("Table-valued function: [dbo].[fn_Orders].");
        assertThat(new TableValuedFunctionRule().evaluate(tableVariable, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldFlagTopOverScanOnInnerSide() {
        // Given
        PlanNode scan = node(6, "Clustered Index Scan");
        scan.setPredicate("[o].[CustomerId]=[c].[Id]");
        PlanNode top = withChildren(node(4, "Top"), withChildren(node(5, "Compute Scalar"), scan));
        PlanNode join = withChildren(node(1, "Nested Loops", "Inner Join"),
                node(2, "Index Scan"),
                withChildren(node(3, "Compute Scalar"), top));

        // When
        List<PlanWarning> warnings = new TopAboveScanRule().evaluate(top, statement("SELECT 1", join));

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage())
                .startsWith("Top operator reads from Clustered Index Scan (Node 6) on the inner side of Nested Loops (Node 1).")
                .contains("residual predicate");
    }

    @Test
    void shouldIgnoreTopOnOuterSideOrOverSeek() {
        // Given
        PlanNode outerTop = withChildren(node(2, "Top"), node(3, "Clustered Index Scan"));
        withChildren(node(1, "Nested Loops", "Inner Join"), outerTop, node(4, "Index Seek"));
        PlanNode seekTop = withChildren(node(6, "Top"), node(7, "Index Seek"));
        withChildren(node(5, "Nested Loops", "Inner Join"), node(8, "Index Scan"), seekTop);
        TopAboveScanRule rule = new TopAboveScanRule();

        // Then
        assertThat(rule.evaluate(outerTop, statement("SELECT 1"))).isEmpty();
        assertThat(rule.evaluate(seekTop, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldReportRowGoalAsInfo() {
        // Given
        PlanNode scan = node(2, "Index Scan");
        scan.setEstimateRows(10);
        scan.setEstimateRowsWithoutRowGoal(5000);
        PlanNode noGoal = node(3, "Index Scan");
        noGoal.setEstimateRows(10);

        // When
        List<PlanWarning> warnings = new RowGoalRule().evaluate(scan, statement("SELECT TOP 10 * FROM Orders"));

        // Then
        assertThat(warnings).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.INFO);
        assertThat(warnings.get(0).getMessage()).startsWith("Row goal active: estimate reduced from 5,000 to 10 (500x reduction)");
        assertThat(new RowGoalRule().evaluate(noGoal, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldFlagRowCountSpoolFromNotIn() {
        // Given
        PlanNode spool = node(3, "Row Count Spool", "Lazy Spool");
        spool.setEstimateRewinds(50_000);
        PlanNode antiJoin = node(1, "Nested Loops", "Left Anti Semi Join");
        antiJoin.setPredicate("[o].[CustomerId] IS NULL OR [o].[CustomerId]=[c].[Id]");
        withChildren(antiJoin, node(2, "Clustered Index Scan"), spool);
        PlanStatement notIn = statement("SELECT * FROM Customers c WHERE c.Id NOT IN (SELECT CustomerId FROM Orders)", antiJoin);
        RowCountSpoolRule rule = new RowCountSpoolRule(thresholds);

        // When
        List<PlanWarning> warnings = rule.evaluate(spool, notIn);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getCategory()).isEqualTo("Row Count Spool (NOT IN)");
        assertThat(warnings.get(0).getSeverity()).isEqualTo(WarningSeverity.WARNING);
        assertThat(warnings.get(0).getMessage()).startsWith("Row Count Spool with 50,000 rewinds.");

        actual(spool, 0, 100).setActualRewinds(2_000_000);
        assertThat(rule.evaluate(spool, notIn)).extracting(PlanWarning::getSeverity)
                .containsExactly(WarningSeverity.CRITICAL);
        assertThat(rule.evaluate(spool, statement("SELECT * FROM Customers WHERE NOT EXISTS (SELECT 1)"))).isEmpty();
    }
}
