package org.carball.showplan.analyzer.rules;

import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.showplan.PlanFixtures.actual;
import static org.carball.showplan.PlanFixtures.node;
import static org.carball.showplan.PlanFixtures.statement;

public class RowEstimateMismatchRuleTest {

    private RowEstimateMismatchRule rule;

    @BeforeEach
    void setUp() {
        rule = new RowEstimateMismatchRule(AnalyzerThresholds.defaults());
    }

    @Test
    void shouldFlagSevereUnderestimateAsCritical() {
        // When
        List<PlanWarning> warnings = evaluate(10, 1000);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getCategory()).isEqualTo("Row Estimate Mismatch");
        assertThat(warnings.get(0).getSeverity()).isEqualTo(WarningSeverity.CRITICAL);
        assertThat(warnings.get(0).getMessage()).startsWith("Estimated 10 rows, actual 1,000 (100x underestimated).");
    }

    @Test
    void shouldFlagSevereOverestimateAsCritical() {
        // When
        List<PlanWarning> warnings = evaluate(1000, 10);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getSeverity()).isEqualTo(WarningSeverity.CRITICAL);
        assertThat(warnings.get(0).getMessage()).startsWith("Estimated 1,000 rows, actual 10 (100x overestimated).");
    }

    @Test
    void shouldFlagModerateMismatchAsWarning() {
        // When
        List<PlanWarning> warnings = evaluate(10, 200);

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getSeverity()).isEqualTo(WarningSeverity.WARNING);
        assertThat(warnings.get(0).getMessage()).contains("(20x underestimated)");
    }

    @Test
    void shouldIgnoreMismatchBelowRatio() {
        assertThat(evaluate(10, 50)).isEmpty();
        assertThat(evaluate(50, 10)).isEmpty();
    }

    @Test
    void shouldGradeZeroRowResultsByEstimate() {
        // When
        List<PlanWarning> small = evaluate(5, 0);
        List<PlanWarning> large = evaluate(100, 0);

        // Then
        assertThat(small).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.WARNING);
        assertThat(small.get(0).getMessage()).startsWith("Estimated 5 rows but actual 0 rows returned.");
        assertThat(large).extracting(PlanWarning::getSeverity).containsExactly(WarningSeverity.CRITICAL);
    }

    @Test
    void shouldSkipEstimatedPlansAndZeroEstimates() {
        // Given
        PlanNode estimatedOnly = node(1, "Index Seek");
        estimatedOnly.setEstimateRows(10);
        estimatedOnly.setActualRows(10_000);

        // Then
        assertThat(rule.evaluate(estimatedOnly, statement("SELECT 1"))).isEmpty();
        assertThat(evaluate(0, 10_000)).isEmpty();
    }

    private List<PlanWarning> evaluate(double estimateRows, long actualRows) {
        PlanNode node = actual(node(1, "Index Seek"), actualRows, 10);
        node.setEstimateRows(estimateRows);
        return rule.evaluate(node, statement("SELECT 1"));
    }
}
