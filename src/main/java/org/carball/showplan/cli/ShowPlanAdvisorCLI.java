package org.carball.showplan.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.analyzer.PlanAdvisor;
import org.carball.showplan.config.AdvisorConfig;
import org.carball.showplan.config.ConfigurationLoader;
import org.carball.showplan.config.OutputFormat;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;
import org.carball.showplan.output.AnalysisReport;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

@Slf4j
public class ShowPlanAdvisorCLI {

    private static final String VERSION = "1.0.0";
    static final String ROOT_PACKAGE = "org.carball.showplan";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            SQL Server Execution Plan Advisor v%s            ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the advisor and returns the process exit code.
     */
    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            AdvisorConfig config = parseArgs(args);
            if (config.isVerbose()) {
                enableDebugLogging();
            }

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Plan file: " + config.getPlanFile());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            System.out.print("📊 Decoding and analyzing execution plan... ");
            PlanAdvisor advisor = new PlanAdvisor(config);
            ParsedPlan plan = advisor.analyzeFile(config.getPlanFile());
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            outputResults(plan, config);
            System.out.println("✓");

            printSummary(plan, config);
            System.out.println("\n✅ Analysis complete!");
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    static void enableDebugLogging() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(ROOT_PACKAGE).setLevel(Level.DEBUG);
            log.debug("Debug logging enabled for {}", ROOT_PACKAGE);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar showplan-advisor.jar <plan-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  plan-file           Execution plan saved from SSMS or Query Store (.sqlplan, .xml)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: plan-analysis.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --min-severity      Lowest severity to report: info|warning|critical (default: info)");
        System.out.println("  --thresholds        YAML file with custom analysis thresholds (optional)");
        System.out.println("  --verbose, -v       List each finding and enable debug logging");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Basic analysis");
        System.out.println("  java -jar showplan-advisor.jar slow-query.sqlplan");
        System.out.println();
        System.out.println("  # Markdown report with only warnings and critical findings");
        System.out.println("  java -jar showplan-advisor.jar slow-query.sqlplan -f markdown --min-severity warning");
        System.out.println();
        System.out.println("  # Custom thresholds");
        System.out.println("  java -jar showplan-advisor.jar slow-query.sqlplan --thresholds my-thresholds.yml");
        System.out.println();
        System.out.println(ConfigurationLoader.getThresholdHelp());
    }

    static AdvisorConfig parseArgs(String[] args) {
        AdvisorConfig config = new AdvisorConfig();
        config.setPlanFile(Paths.get(args[0]));

        Path thresholdFile = null;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith(ConfigurationLoader.CLI_PREFIX)) {
                // single threshold overrides are applied by the configuration loader
                requireValue(args, i, "Value not specified for " + arg);
                i++;
                continue;
            }
            switch (arg) {
                case "--output":
                case "-o":
                    requireValue(args, i, "Output file not specified");
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    requireValue(args, i, "Output format not specified");
                    config.setOutputFormat(OutputFormat.fromString(args[++i]));
                    break;

                case "--min-severity":
                    requireValue(args, i, "Minimum severity not specified");
                    config.setMinSeverity(WarningSeverity.fromName(args[++i]));
                    break;

                case "--thresholds":
                    requireValue(args, i, "Threshold file not specified");
                    thresholdFile = Paths.get(args[++i]);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        config.setThresholds(new ConfigurationLoader().loadConfiguration(thresholdFile, args));

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }

        validateConfig(config);
        return config;
    }

    private static void requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
    }

    private static void validateConfig(AdvisorConfig config) {
        if (!Files.exists(config.getPlanFile())) {
            throw new IllegalArgumentException("Plan file not found: " + config.getPlanFile());
        }
        if (Files.isDirectory(config.getPlanFile())) {
            throw new IllegalArgumentException("Plan file must be a file, not a directory");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void outputResults(ParsedPlan plan, AdvisorConfig config) throws IOException {
        AnalysisReport report = new AnalysisReport(plan, config.getMinSeverity());
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }
        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    private static void printSummary(ParsedPlan plan, AdvisorConfig config) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        if (!plan.hasStatements()) {
            System.out.println("\n💡 The plan contains no statements. Check that the file is a show-plan XML document.");
            return;
        }

        Map<WarningSeverity, Integer> counts = new EnumMap<>(WarningSeverity.class);
        for (PlanStatement statement : plan.allStatements()) {
            for (PlanWarning warning : statement.getAllWarnings()) {
                if (warning.getSeverity().isAtLeast(config.getMinSeverity())) {
                    counts.merge(warning.getSeverity(), 1, Integer::sum);
                }
            }
        }

        System.out.println("\nStatements analyzed: " + plan.allStatements().size());
        System.out.println("Missing index suggestions: " + plan.allMissingIndexes().size());
        System.out.println("\nFindings:");
        for (WarningSeverity severity : WarningSeverity.values()) {
            if (severity.isAtLeast(config.getMinSeverity())) {
                System.out.println("  " + severity.getMarker() + " " + severity.getDisplayName() + ": "
                        + counts.getOrDefault(severity, 0));
            }
        }

        if (config.isVerbose()) {
            int number = 1;
            for (PlanStatement statement : plan.allStatements()) {
                System.out.println("\nStatement " + number++ + ":");
                for (PlanWarning warning : statement.getAllWarnings()) {
                    if (warning.getSeverity().isAtLeast(config.getMinSeverity())) {
                        System.out.printf("  %s %-28s %s%n", warning.getSeverity().getMarker(),
                                warning.getCategory(), firstSentence(warning.getMessage()));
                    }
                }
            }
        }
    }

    private static String firstSentence(String message) {
        int end = message.indexOf(". ");
        return end > 0 ? message.substring(0, end + 1) : message;
    }
}
