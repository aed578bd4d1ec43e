package org.carball.showplan.analyzer.rules;

import org.carball.showplan.model.plan.PlanNode;

import java.util.Locale;

/**
 * Formatting and operator classification shared by the rules.
 */
final class RuleSupport {

    private RuleSupport() {
    }

    static String number(long value) {
        return String.format(Locale.US, "%,d", value);
    }

    static String number(double value) {
        return String.format(Locale.US, "%,.0f", value);
    }

    static String percent(double fraction) {
        return String.format(Locale.US, "%.0f%%", fraction * 100);
    }

    static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        int limit = Math.max(0, maxLength);
        return value.length() <= limit ? value : value.substring(0, limit) + "...";
    }

    static boolean isNullOrEmpty(String value) {
        return value == null || value.isEmpty();
    }

    static boolean containsIgnoreCase(String value, String fragment) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    /**
     * Rowstore scans: index, clustered index and table scans. Columnstore is
     * designed to be scanned; spools and constant scans are not real reads.
     */
    static boolean isRowstoreScan(PlanNode node) {
        return isScanOperator(node) && !node.physicalOpContains("Columnstore");
    }

    static boolean isScanOperator(PlanNode node) {
        return node.physicalOpContains("Scan")
                && !node.physicalOpContains("Spool")
                && !node.physicalOpContains("Constant");
    }

    /**
     * Skips down through Compute Scalar operators along the first child.
     */
    static PlanNode skipComputeScalars(PlanNode node) {
        PlanNode current = node;
        while (current.isPhysicalOp("Compute Scalar") && !current.getChildren().isEmpty()) {
            current = current.getChildren().get(0);
        }
        return current;
    }
}
