package org.carball.showplan.analyzer.rules;

import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.showplan.PlanFixtures.node;
import static org.carball.showplan.PlanFixtures.statement;

public class ScanPredicateRuleTest {

    private ScanPredicateRule rule;

    @BeforeEach
    void setUp() {
        rule = new ScanPredicateRule(AnalyzerThresholds.defaults());
    }

    @Test
    void shouldPreferCaseExpressionOverImplicitConversion() {
        // Given
        PlanNode scan = scan("CASE WHEN [t].[Flag]=(1) THEN CONVERT_IMPLICIT(int,[t].[Code],0) ELSE (0) END=[@p]");

        // When
        String reason = NonSargablePredicates.detect(scan);

        // Then
        assertThat(reason).isEqualTo(NonSargablePredicates.CASE_EXPRESSION);
    }

    @Test
    void shouldClassifyNonSargablePredicates() {
        assertThat(NonSargablePredicates.detect(scan("CONVERT_IMPLICIT(nvarchar(20),[c].[Region],0)=[@region]")))
                .isEqualTo(NonSargablePredicates.IMPLICIT_CONVERSION);
        assertThat(NonSargablePredicates.detect(scan("isnull([c].[Region],N'')=[@region]")))
                .isEqualTo(NonSargablePredicates.ISNULL_COALESCE);
        assertThat(NonSargablePredicates.detect(scan("upper([c].[Name])=N'SMITH'")))
                .isEqualTo("Function call (UPPER) on column");
        assertThat(NonSargablePredicates.detect(scan("datepart(year,[o].[Created])=(2024)")))
                .isEqualTo("Function call (DATEPART) on column");
        assertThat(NonSargablePredicates.detect(scan("[c].[Name] like N'%smith'")))
                .isEqualTo(NonSargablePredicates.LEADING_WILDCARD);
        assertThat(NonSargablePredicates.detect(scan("[c].[Name] like N'smith%'"))).isNull();
        assertThat(NonSargablePredicates.detect(scan("[c].[Region]=N'West'"))).isNull();
    }

    @Test
    void shouldOnlyInspectRowstoreScans() {
        // Given
        PlanNode columnstore = node(1, "Columnstore Index Scan");
        columnstore.setPredicate("CONVERT_IMPLICIT(int,[t].[Code],0)=[@p]");
        PlanNode seek = node(2, "Index Seek");
        seek.setPredicate("CONVERT_IMPLICIT(int,[t].[Code],0)=[@p]");
        PlanNode constantScan = node(3, "Constant Scan");
        constantScan.setPredicate("upper([t].[Name])=N'X'");

        // Then
        assertThat(NonSargablePredicates.detect(columnstore)).isNull();
        assertThat(NonSargablePredicates.detect(seek)).isNull();
        assertThat(NonSargablePredicates.detect(constantScan)).isNull();
        assertThat(rule.evaluate(columnstore, statement("SELECT 1"))).isEmpty();
        assertThat(rule.evaluate(seek, statement("SELECT 1"))).isEmpty();
    }

    @Test
    void shouldReportNonSargablePredicateInsteadOfGenericScan() {
        // Given
        PlanNode scan = scan("CONVERT_IMPLICIT(nvarchar(20),[c].[Region],0)=[@region]");

        // When
        List<PlanWarning> warnings = rule.evaluate(scan, statement("SELECT 1"));

        // Then
        assertThat(warnings).hasSize(1);
        PlanWarning warning = warnings.get(0);
        assertThat(warning.getCategory()).isEqualTo(ScanPredicateRule.NON_SARGABLE);
        assertThat(warning.getSeverity()).isEqualTo(WarningSeverity.WARNING);
        assertThat(warning.getMessage())
                .startsWith("Implicit conversion (CONVERT_IMPLICIT) prevents an index seek.")
                .endsWith("Predicate: CONVERT_IMPLICIT(nvarchar(20),[c].[Region],0)=[@region]");
    }

    @Test
    void shouldReportScanWithResidualPredicate() {
        // When
        List<PlanWarning> warnings = rule.evaluate(scan("[c].[Region]=N'West'"), statement("SELECT 1"));

        // Then
        assertThat(warnings).extracting(PlanWarning::getCategory).containsExactly(ScanPredicateRule.SCAN_WITH_PREDICATE);
        assertThat(warnings.get(0).getMessage()).contains("Predicate: [c].[Region]=N'West'");
    }

    @Test
    void shouldIgnoreBitmapProbeOnlyPredicates() {
        // Given
        PlanNode scan = scan("PROBE([Opt_Bitmap1005],[Sales].[dbo].[Orders].[CustomerId] as [o].[CustomerId],N'[IN ROW]')");

        // Then
        assertThat(NonSargablePredicates.isProbeOnly(scan.getPredicate())).isTrue();
        assertThat(rule.evaluate(scan, statement("SELECT 1"))).isEmpty();
        assertThat(NonSargablePredicates.isProbeOnly("PROBE([Opt_Bitmap1005],[o].[Id]) AND [o].[Total]>(10)")).isFalse();
    }

    @Test
    void shouldTruncateLongPredicates() {
        // Given
        AnalyzerThresholds thresholds = AnalyzerThresholds.builder().predicateDisplayLength(20).build();
        ScanPredicateRule shortRule = new ScanPredicateRule(thresholds);
        PlanNode scan = scan("[Sales].[dbo].[Customers].[Region] as [c].[Region]=N'West'");

        // When
        List<PlanWarning> warnings = shortRule.evaluate(scan, statement("SELECT 1"));

        // Then
        assertThat(warnings.get(0).getMessage()).endsWith("Predicate: [Sales].[dbo].[Custo...");
    }

    @Test
    void shouldTreatNegativeDisplayLengthAsZero() {
        // Given
        AnalyzerThresholds thresholds = AnalyzerThresholds.builder().predicateDisplayLength(-1).build();
        ScanPredicateRule negativeRule = new ScanPredicateRule(thresholds);

        // When
        List<PlanWarning> warnings = negativeRule.evaluate(scan("[c].[Region]=N'West'"), statement("SELECT 1"));

        // Then
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).endsWith("Predicate: ...");
    }

    @Test
    void shouldIgnoreScansWithoutPredicate() {
        assertThat(rule.evaluate(node(1, "Table Scan"), statement("SELECT 1"))).isEmpty();
    }

    private static PlanNode scan(String predicate) {
        PlanNode scan = node(4, "Clustered Index Scan");
        scan.setPredicate(predicate);
        return scan;
    }
}
