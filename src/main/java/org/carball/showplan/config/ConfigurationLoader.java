package org.carball.showplan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "SHOWPLAN_";
    public static final String CLI_PREFIX = "--thresholds.";

    private static final Map<String, BiConsumer<AnalyzerThresholds, String>> SETTERS = new LinkedHashMap<>();

    static {
        SETTERS.put("excessive-grant-ratio", (t, v) -> t.setExcessiveGrantRatio(Double.parseDouble(v)));
        SETTERS.put("large-grant-kb", (t, v) -> t.setLargeGrantKb(Long.parseLong(v)));
        SETTERS.put("critical-grant-kb", (t, v) -> t.setCriticalGrantKb(Long.parseLong(v)));
        SETTERS.put("grant-wait-critical-ms", (t, v) -> t.setGrantWaitCriticalMs(Long.parseLong(v)));
        SETTERS.put("compile-cpu-warning-ms", (t, v) -> t.setCompileCpuWarningMs(Long.parseLong(v)));
        SETTERS.put("compile-cpu-critical-ms", (t, v) -> t.setCompileCpuCriticalMs(Long.parseLong(v)));
        SETTERS.put("udf-elapsed-critical-ms", (t, v) -> t.setUdfElapsedCriticalMs(Long.parseLong(v)));
        SETTERS.put("estimate-mismatch-ratio", (t, v) -> t.setEstimateMismatchRatio(Double.parseDouble(v)));
        SETTERS.put("estimate-mismatch-critical-factor",
                (t, v) -> t.setEstimateMismatchCriticalFactor(Double.parseDouble(v)));
        SETTERS.put("zero-rows-critical-estimate", (t, v) -> t.setZeroRowsCriticalEstimate(Double.parseDouble(v)));
        SETTERS.put("skew-min-rows-per-thread", (t, v) -> t.setSkewMinRowsPerThread(Long.parseLong(v)));
        SETTERS.put("skew-two-thread-threshold", (t, v) -> t.setSkewTwoThreadThreshold(Double.parseDouble(v)));
        SETTERS.put("skew-threshold", (t, v) -> t.setSkewThreshold(Double.parseDouble(v)));
        SETTERS.put("parallelism-min-elapsed-ms", (t, v) -> t.setParallelismMinElapsedMs(Long.parseLong(v)));
        SETTERS.put("parallelism-cpu-ratio", (t, v) -> t.setParallelismCpuRatio(Double.parseDouble(v)));
        SETTERS.put("spill-critical-fraction", (t, v) -> t.setSpillCriticalFraction(Double.parseDouble(v)));
        SETTERS.put("spill-warning-fraction", (t, v) -> t.setSpillWarningFraction(Double.parseDouble(v)));
        SETTERS.put("exchange-spill-warning-writes", (t, v) -> t.setExchangeSpillWarningWrites(Long.parseLong(v)));
        SETTERS.put("exchange-spill-critical-writes", (t, v) -> t.setExchangeSpillCriticalWrites(Long.parseLong(v)));
        SETTERS.put("lazy-spool-min-rebinds", (t, v) -> t.setLazySpoolMinRebinds(Double.parseDouble(v)));
        SETTERS.put("lazy-spool-rewind-ratio", (t, v) -> t.setLazySpoolRewindRatio(Double.parseDouble(v)));
        SETTERS.put("nested-loops-warning-executions",
                (t, v) -> t.setNestedLoopsWarningExecutions(Long.parseLong(v)));
        SETTERS.put("nested-loops-critical-executions",
                (t, v) -> t.setNestedLoopsCriticalExecutions(Long.parseLong(v)));
        SETTERS.put("row-count-spool-warning-rewinds",
                (t, v) -> t.setRowCountSpoolWarningRewinds(Double.parseDouble(v)));
        SETTERS.put("row-count-spool-critical-rewinds",
                (t, v) -> t.setRowCountSpoolCriticalRewinds(Double.parseDouble(v)));
        SETTERS.put("predicate-display-length", (t, v) -> t.setPredicateDisplayLength(Integer.parseInt(v)));
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public AnalyzerThresholds loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public AnalyzerThresholds loadConfiguration(Path thresholdFile, String[] args) {
        return loadConfiguration(thresholdFile, args, System.getenv());
    }

    AnalyzerThresholds loadConfiguration(Path thresholdFile, String[] args, Map<String, String> env) {
        log.debug("Loading configuration");

        // Start with defaults, or the YAML file when one is given
        AnalyzerThresholds thresholds = thresholdFile != null
                ? loadThresholdFile(thresholdFile)
                : AnalyzerThresholds.defaults();

        applyEnvironmentVariables(thresholds, env);
        applyCLIArguments(thresholds, args);

        thresholds.validate();
        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    public AnalyzerThresholds loadThresholdFile(Path thresholdFile) {
        if (!Files.exists(thresholdFile)) {
            throw new IllegalArgumentException("Threshold file not found: " + thresholdFile);
        }
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            AnalyzerThresholds thresholds = mapper.readValue(thresholdFile.toFile(), AnalyzerThresholds.class);
            log.info("Loaded threshold configuration from: {}", thresholdFile);
            return thresholds != null ? thresholds : AnalyzerThresholds.defaults();
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read threshold file " + thresholdFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(AnalyzerThresholds thresholds, Map<String, String> env) {
        SETTERS.forEach((name, setter) -> {
            String variable = environmentName(name);
            if (env.containsKey(variable)) {
                apply(thresholds, setter, variable, env.get(variable));
            }
        });
    }

    private void applyCLIArguments(AnalyzerThresholds thresholds, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (!arg.startsWith(CLI_PREFIX)) {
                continue;
            }
            BiConsumer<AnalyzerThresholds, String> setter = SETTERS.get(arg.substring(CLI_PREFIX.length()));
            if (setter == null) {
                log.warn("Unknown threshold option: {}", arg);
                continue;
            }
            apply(thresholds, setter, arg, args[i + 1]);
        }
    }

    private void apply(AnalyzerThresholds thresholds, BiConsumer<AnalyzerThresholds, String> setter,
                       String source, String value) {
        try {
            setter.accept(thresholds, value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    static String environmentName(String optionName) {
        return ENV_PREFIX + optionName.replace('-', '_').toUpperCase(Locale.ROOT);
    }

    public static Set<String> thresholdOptionNames() {
        return Collections.unmodifiableSet(SETTERS.keySet());
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds <file>                           YAML file with threshold values (snake_case keys)
              --thresholds.excessive-grant-ratio <num>      Granted/used ratio for an excessive grant
              --thresholds.large-grant-kb <num>             Grant size (KB) reported as large
              --thresholds.critical-grant-kb <num>          Grant size (KB) reported as critical
              --thresholds.grant-wait-critical-ms <num>     Grant wait (ms) reported as critical
              --thresholds.compile-cpu-warning-ms <num>     Compile CPU (ms) reported as a warning
              --thresholds.compile-cpu-critical-ms <num>    Compile CPU (ms) reported as critical
              --thresholds.udf-elapsed-critical-ms <num>    UDF elapsed time (ms) reported as critical
              --thresholds.estimate-mismatch-ratio <num>    Actual/estimated row ratio for a mismatch
              --thresholds.estimate-mismatch-critical-factor <num>
              --thresholds.zero-rows-critical-estimate <num>
              --thresholds.skew-min-rows-per-thread <num>   Rows per thread before skew is considered
              --thresholds.skew-two-thread-threshold <num>  Busiest thread share with two threads
              --thresholds.skew-threshold <num>             Busiest thread share with more threads
              --thresholds.parallelism-min-elapsed-ms <num>
              --thresholds.parallelism-cpu-ratio <num>      CPU/elapsed ratio for ineffective parallelism
              --thresholds.spill-critical-fraction <num>    Spill share of statement time for critical
              --thresholds.spill-warning-fraction <num>     Spill share of statement time for a warning
              --thresholds.exchange-spill-warning-writes <num>
              --thresholds.exchange-spill-critical-writes <num>
              --thresholds.lazy-spool-min-rebinds <num>
              --thresholds.lazy-spool-rewind-ratio <num>
              --thresholds.nested-loops-warning-executions <num>
              --thresholds.nested-loops-critical-executions <num>
              --thresholds.row-count-spool-warning-rewinds <num>
              --thresholds.row-count-spool-critical-rewinds <num>
              --thresholds.predicate-display-length <num>   Predicate length shown in messages

            Environment Variables:
              SHOWPLAN_<NAME>                               e.g. SHOWPLAN_LARGE_GRANT_KB is the same
                                                            as --thresholds.large-grant-kb

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Threshold YAML file
              4. Built-in defaults
            """;
    }
}
