package org.carball.showplan.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Numeric limits used by the plan analysis rules. Defaults are the values the
 * rules have always used; every one can be overridden from YAML, environment or CLI.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class AnalyzerThresholds {

    // Memory grants
    @Builder.Default
    @JsonProperty("excessive_grant_ratio")
    private double excessiveGrantRatio = 10;

    @Builder.Default
    @JsonProperty("large_grant_kb")
    private long largeGrantKb = 1_048_576;

    @Builder.Default
    @JsonProperty("critical_grant_kb")
    private long criticalGrantKb = 4_194_304;

    @Builder.Default
    @JsonProperty("grant_wait_critical_ms")
    private long grantWaitCriticalMs = 5_000;

    // Compilation
    @Builder.Default
    @JsonProperty("compile_cpu_warning_ms")
    private long compileCpuWarningMs = 1_000;

    @Builder.Default
    @JsonProperty("compile_cpu_critical_ms")
    private long compileCpuCriticalMs = 5_000;

    @Builder.Default
    @JsonProperty("udf_elapsed_critical_ms")
    private long udfElapsedCriticalMs = 1_000;

    // Cardinality estimates
    @Builder.Default
    @JsonProperty("estimate_mismatch_ratio")
    private double estimateMismatchRatio = 10;

    @Builder.Default
    @JsonProperty("estimate_mismatch_critical_factor")
    private double estimateMismatchCriticalFactor = 100;

    @Builder.Default
    @JsonProperty("zero_rows_critical_estimate")
    private double zeroRowsCriticalEstimate = 100;

    // Parallelism
    @Builder.Default
    @JsonProperty("skew_min_rows_per_thread")
    private long skewMinRowsPerThread = 1_000;

    @Builder.Default
    @JsonProperty("skew_two_thread_threshold")
    private double skewTwoThreadThreshold = 0.75;

    @Builder.Default
    @JsonProperty("skew_threshold")
    private double skewThreshold = 0.50;

    @Builder.Default
    @JsonProperty("parallelism_min_elapsed_ms")
    private long parallelismMinElapsedMs = 1_000;

    @Builder.Default
    @JsonProperty("parallelism_cpu_ratio")
    private double parallelismCpuRatio = 1.3;

    // Spills
    @Builder.Default
    @JsonProperty("spill_critical_fraction")
    private double spillCriticalFraction = 0.5;

    @Builder.Default
    @JsonProperty("spill_warning_fraction")
    private double spillWarningFraction = 0.1;

    @Builder.Default
    @JsonProperty("exchange_spill_warning_writes")
    private long exchangeSpillWarningWrites = 10_000;

    @Builder.Default
    @JsonProperty("exchange_spill_critical_writes")
    private long exchangeSpillCriticalWrites = 1_000_000;

    // Spools and loops
    @Builder.Default
    @JsonProperty("lazy_spool_min_rebinds")
    private double lazySpoolMinRebinds = 100;

    @Builder.Default
    @JsonProperty("lazy_spool_rewind_ratio")
    private double lazySpoolRewindRatio = 5;

    @Builder.Default
    @JsonProperty("nested_loops_warning_executions")
    private long nestedLoopsWarningExecutions = 100_000;

    @Builder.Default
    @JsonProperty("nested_loops_critical_executions")
    private long nestedLoopsCriticalExecutions = 1_000_000;

    @Builder.Default
    @JsonProperty("row_count_spool_warning_rewinds")
    private double rowCountSpoolWarningRewinds = 10_000;

    @Builder.Default
    @JsonProperty("row_count_spool_critical_rewinds")
    private double rowCountSpoolCriticalRewinds = 1_000_000;

    // Presentation
    @Builder.Default
    @JsonProperty("predicate_display_length")
    private int predicateDisplayLength = 200;

    public static AnalyzerThresholds defaults() {
        return AnalyzerThresholds.builder().build();
    }

    /**
     * Logs warnings for threshold combinations that would make rules misbehave.
     */
    public void validate() {
        if (compileCpuCriticalMs < compileCpuWarningMs) {
            log.warn("Compile CPU critical threshold ({}) should not be below the warning threshold ({})",
                    compileCpuCriticalMs, compileCpuWarningMs);
        }
        if (criticalGrantKb < largeGrantKb) {
            log.warn("Critical grant size ({} KB) should not be below the large grant size ({} KB)",
                    criticalGrantKb, largeGrantKb);
        }
        if (estimateMismatchRatio <= 1.0) {
            log.warn("Estimate mismatch ratio ({}) should be greater than 1.0", estimateMismatchRatio);
        }
        if (spillCriticalFraction < spillWarningFraction) {
            log.warn("Spill critical fraction ({}) should not be below the warning fraction ({})",
                    spillCriticalFraction, spillWarningFraction);
        }
        if (skewThreshold <= 0 || skewThreshold > 1 || skewTwoThreadThreshold <= 0 || skewTwoThreadThreshold > 1) {
            log.warn("Skew thresholds ({}, {}) should be fractions between 0 and 1",
                    skewTwoThreadThreshold, skewThreshold);
        }
        if (nestedLoopsCriticalExecutions < nestedLoopsWarningExecutions) {
            log.warn("Nested loops critical executions ({}) should not be below the warning level ({})",
                    nestedLoopsCriticalExecutions, nestedLoopsWarningExecutions);
        }
        if (predicateDisplayLength < 20) {
            log.warn("Predicate display length ({}) is too short to be useful", predicateDisplayLength);
        }
    }

    public String getConfigurationSummary() {
        return String.format(Locale.US, "Grant ratio: %.0fx | Large grant: %,d KB | Estimate ratio: %.0fx | "
                        + "Skew: %.2f/%.2f | Parallelism CPU ratio: %.1f | NL executions: %,d",
                excessiveGrantRatio, largeGrantKb, estimateMismatchRatio,
                skewTwoThreadThreshold, skewThreshold, parallelismCpuRatio, nestedLoopsWarningExecutions);
    }
}
