package org.carball.showplan.parser;

import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.SpillDetail;
import org.carball.showplan.model.plan.SpillKind;
import org.carball.showplan.model.plan.WarningSeverity;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static org.carball.showplan.parser.ShowPlanElements.attr;
import static org.carball.showplan.parser.ShowPlanElements.boolAttr;
import static org.carball.showplan.parser.ShowPlanElements.child;
import static org.carball.showplan.parser.ShowPlanElements.children;
import static org.carball.showplan.parser.ShowPlanElements.longAttr;

/**
 * Reads the warnings SQL Server itself recorded in a {@code <Warnings>} element,
 * either on the query plan or on an individual operator.
 */
public final class PlanWarningParser {

    public static final String NO_JOIN_PREDICATE = "No Join Predicate";
    public static final String SPILL_TO_TEMPDB = "Spill to TempDb";
    public static final String SORT_SPILL = "Sort Spill";
    public static final String HASH_SPILL = "Hash Spill";
    public static final String EXCHANGE_SPILL = "Exchange Spill";
    public static final String IMPLICIT_CONVERSION = "Implicit Conversion";
    public static final String MISSING_STATISTICS = "Missing Statistics";

    private PlanWarningParser() {
    }

    /**
     * Warnings from the {@code <Warnings>} child of the given element, if it has one.
     */
    static List<PlanWarning> parseWarningsOf(Element parent) {
        Element warnings = child(parent, "Warnings");
        return warnings == null ? new ArrayList<>() : parse(warnings);
    }

    public static List<PlanWarning> parse(Element warningsEl) {
        List<PlanWarning> result = new ArrayList<>();

        if (boolAttr(warningsEl, "NoJoinPredicate")) {
            result.add(PlanWarning.of(NO_JOIN_PREDICATE,
                    "This join has no join predicate (possible cross join)", WarningSeverity.CRITICAL));
        }
        if (boolAttr(warningsEl, "SpatialGuess")) {
            result.add(PlanWarning.of("Spatial Guess",
                    "Spatial index selectivity was guessed", WarningSeverity.INFO));
        }
        if (boolAttr(warningsEl, "UnmatchedIndexes")) {
            result.add(PlanWarning.of("Unmatched Indexes",
                    "Indexes could not be matched due to parameterization", WarningSeverity.WARNING));
        }
        if (boolAttr(warningsEl, "FullUpdateForOnlineIndexBuild")) {
            result.add(PlanWarning.of("Full Update for Online Index Build",
                    "Full update required for online index build operation", WarningSeverity.INFO));
        }

        for (Element spill : children(warningsEl, "SpillToTempDb")) {
            result.add(spillToTempDb(spill));
        }
        for (Element spill : children(warningsEl, "SortSpillDetails")) {
            result.add(operatorSpill(SORT_SPILL, SpillKind.SORT, spill));
        }
        for (Element spill : children(warningsEl, "HashSpillDetails")) {
            result.add(operatorSpill(HASH_SPILL, SpillKind.HASH, spill));
        }
        for (Element spill : children(warningsEl, "ExchangeSpillDetails")) {
            long writes = longAttr(spill, "WritesToTempDb");
            result.add(PlanWarning.builder()
                    .category(EXCHANGE_SPILL)
                    .message("Exchange spill - Writes: " + number(writes))
                    .severity(WarningSeverity.WARNING)
                    .spillDetail(new SpillDetail(SpillKind.EXCHANGE, 0, 0, writes, 0))
                    .build());
        }

        if (child(warningsEl, "SpillOccurred") != null) {
            result.add(PlanWarning.of("Spill Occurred",
                    "Spill occurred during execution (from last query plan stats)", WarningSeverity.WARNING));
        }

        Element grantWarning = child(warningsEl, "MemoryGrantWarning");
        if (grantWarning != null) {
            result.add(PlanWarning.of("Memory Grant",
                    String.format(Locale.US, "%s: Requested %,d KB, Granted %,d KB, Used %,d KB",
                            attr(grantWarning, "GrantWarningKind", "Unknown"),
                            longAttr(grantWarning, "RequestedMemory"),
                            longAttr(grantWarning, "GrantedMemory"),
                            longAttr(grantWarning, "MaxUsedMemory")),
                    WarningSeverity.WARNING));
        }

        for (Element convert : children(warningsEl, "PlanAffectingConvert")) {
            String issue = attr(convert, "ConvertIssue", "Unknown");
            String expression = attr(convert, "Expression", "");
            WarningSeverity severity = issue.contains("Cardinality")
                    ? WarningSeverity.WARNING
                    : WarningSeverity.CRITICAL;
            result.add(PlanWarning.of(IMPLICIT_CONVERSION, issue + ": " + expression, severity));
        }

        Element noStats = child(warningsEl, "ColumnsWithNoStatistics");
        if (noStats != null) {
            result.add(PlanWarning.of(MISSING_STATISTICS,
                    "No statistics on: " + columnNames(noStats), WarningSeverity.WARNING));
        }
        Element staleStats = child(warningsEl, "ColumnsWithStaleStatistics");
        if (staleStats != null) {
            result.add(PlanWarning.of("Stale Statistics",
                    "Stale statistics on: " + columnNames(staleStats), WarningSeverity.WARNING));
        }

        for (Element wait : children(warningsEl, "Wait")) {
            result.add(PlanWarning.of("Wait",
                    attr(wait, "WaitType", "") + ": " + attr(wait, "WaitTime", "") + "ms",
                    WarningSeverity.INFO));
        }

        return result;
    }

    private static PlanWarning spillToTempDb(Element spill) {
        StringBuilder message = new StringBuilder("Spill level ")
                .append(attr(spill, "SpillLevel", "?"))
                .append(", ")
                .append(attr(spill, "SpilledThreadCount", "?"))
                .append(" thread(s)");

        long grantedKb = longAttr(spill, "GrantedMemoryKB");
        long usedKb = longAttr(spill, "UsedMemoryKB");
        long writes = longAttr(spill, "WritesToTempDb");
        long reads = longAttr(spill, "ReadsFromTempDb");
        if (grantedKb > 0 || writes > 0) {
            message.append(" - Granted: ").append(number(grantedKb))
                    .append(" KB, Used: ").append(number(usedKb)).append(" KB");
            if (writes > 0) {
                message.append(", Writes: ").append(number(writes));
            }
            if (reads > 0) {
                message.append(", Reads: ").append(number(reads));
            }
        }
        return PlanWarning.of(SPILL_TO_TEMPDB, message.toString(), WarningSeverity.WARNING);
    }

    private static PlanWarning operatorSpill(String category, SpillKind kind, Element spill) {
        SpillDetail detail = new SpillDetail(kind,
                longAttr(spill, "GrantedMemoryKb"),
                longAttr(spill, "UsedMemoryKb"),
                longAttr(spill, "WritesToTempDb"),
                longAttr(spill, "ReadsFromTempDb"));
        String message = String.format(Locale.US, "%s spill - Granted: %,d KB, Used: %,d KB, Writes: %,d, Reads: %,d",
                kind.getDisplayName(), detail.grantedMemoryKb(), detail.usedMemoryKb(),
                detail.writesToTempDb(), detail.readsFromTempDb());
        return PlanWarning.builder()
                .category(category)
                .message(message)
                .severity(WarningSeverity.WARNING)
                .spillDetail(detail)
                .build();
    }

    private static String columnNames(Element container) {
        return children(container, ShowPlanElements.COLUMN_REFERENCE).stream()
                .map(ref -> attr(ref, "Column", ""))
                .filter(name -> !name.isEmpty())
                .collect(Collectors.joining(", "));
    }

    private static String number(long value) {
        return String.format(Locale.US, "%,d", value);
    }
}
