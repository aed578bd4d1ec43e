package org.carball.showplan.analyzer.rules;

import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;
import org.carball.showplan.parser.PlanWarningParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.showplan.PlanFixtures.node;
import static org.carball.showplan.PlanFixtures.statement;

public class ImplicitConversionSeekAdjusterTest {

    private final ImplicitConversionSeekAdjuster adjuster = new ImplicitConversionSeekAdjuster();

    @Test
    void shouldEscalateConversionThatAffectedSeekPlan() {
        // Given
        PlanNode scan = node(2, "Index Scan");
        PlanWarning warning = PlanWarning.of(PlanWarningParser.IMPLICIT_CONVERSION,
                "Seek Plan: CONVERT_IMPLICIT(nvarchar(20),[c].[Region],0)=[@region]", WarningSeverity.WARNING);
        scan.addWarning(warning);

        // When
        adjuster.adjust(scan, statement("SELECT 1"));

        // Then
        assertThat(warning.getSeverity()).isEqualTo(WarningSeverity.CRITICAL);
        assertThat(warning.getMessage())
                .startsWith(ImplicitConversionSeekAdjuster.SEEK_PLAN_PREFIX)
                .endsWith("Seek Plan: CONVERT_IMPLICIT(nvarchar(20),[c].[Region],0)=[@region]");
    }

    @Test
    void shouldLeaveCardinalityConversionsAlone() {
        // Given
        PlanNode scan = node(2, "Index Scan");
        PlanWarning cardinality = PlanWarning.of(PlanWarningParser.IMPLICIT_CONVERSION,
                "Cardinality Estimate: CONVERT(varchar(10),[o].[Code],0)", WarningSeverity.WARNING);
        PlanWarning other = PlanWarning.of("Filter Operator", "Seek Plan lookalike", WarningSeverity.WARNING);
        scan.addWarning(cardinality);
        scan.addWarning(other);

        // When
        adjuster.adjust(scan, statement("SELECT 1"));

        // Then
        assertThat(cardinality.getSeverity()).isEqualTo(WarningSeverity.WARNING);
        assertThat(cardinality.getMessage()).startsWith("Cardinality Estimate");
        assertThat(other.getSeverity()).isEqualTo(WarningSeverity.WARNING);
        assertThat(other.getMessage()).isEqualTo("Seek Plan lookalike");
    }
}
