package org.carball.showplan.analyzer.rules;

import org.carball.showplan.model.plan.PlanNode;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies scan predicates that cannot be satisfied by an index seek.
 */
final class NonSargablePredicates {

    static final String CASE_EXPRESSION = "CASE expression in predicate";
    static final String IMPLICIT_CONVERSION = "Implicit conversion (CONVERT_IMPLICIT)";
    static final String ISNULL_COALESCE = "ISNULL/COALESCE wrapping column";
    static final String LEADING_WILDCARD = "Leading wildcard LIKE pattern";

    private static final Pattern FUNCTION_IN_PREDICATE = Pattern.compile(
            "\\b(CONVERT_IMPLICIT|CONVERT|CAST|isnull|coalesce|datepart|datediff|dateadd|year|month|day|upper|lower"
                    + "|ltrim|rtrim|trim|substring|left|right|charindex|replace|len|datalength|abs|floor|ceiling"
                    + "|round|reverse|stuff|format)\\s*\\(",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_WILDCARD_LIKE =
            Pattern.compile("\\blike\\b[^'\"]*?N?'%", Pattern.CASE_INSENSITIVE);

    private static final Pattern CASE_IN_PREDICATE =
            Pattern.compile("\\bCASE\\s+(WHEN\\b|$)", Pattern.CASE_INSENSITIVE);

    private static final Pattern ISNULL_OR_COALESCE =
            Pattern.compile("\\b(isnull|coalesce)\\s*\\(", Pattern.CASE_INSENSITIVE);

    private static final Pattern PROBE_CALL =
            Pattern.compile("PROBE\\s*\\([^()]*(?:\\([^()]*\\)[^()]*)*\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONNECTOR = Pattern.compile("\\b(AND|OR)\\b", Pattern.CASE_INSENSITIVE);

    private NonSargablePredicates() {
    }

    /**
     * @return the reason the predicate is not SARGable, or null when it is fine or
     *         the node is not a rowstore scan
     */
    static String detect(PlanNode node) {
        String predicate = node.getPredicate();
        if (RuleSupport.isNullOrEmpty(predicate) || !RuleSupport.isRowstoreScan(node)) {
            return null;
        }

        // CASE first: its branches often contain a CONVERT_IMPLICIT that is not the cause
        if (CASE_IN_PREDICATE.matcher(predicate).find()) {
            return CASE_EXPRESSION;
        }
        if (RuleSupport.containsIgnoreCase(predicate, "CONVERT_IMPLICIT")) {
            return IMPLICIT_CONVERSION;
        }
        if (ISNULL_OR_COALESCE.matcher(predicate).find()) {
            return ISNULL_COALESCE;
        }

        Matcher function = FUNCTION_IN_PREDICATE.matcher(predicate);
        if (function.find()) {
            String functionName = function.group(1).toUpperCase(Locale.ROOT);
            if (!"CONVERT_IMPLICIT".equals(functionName)) {
                return "Function call (" + functionName + ") on column";
            }
        }

        if (LEADING_WILDCARD_LIKE.matcher(predicate).find()) {
            return LEADING_WILDCARD;
        }
        return null;
    }

    static String advice(String reason) {
        return switch (reason) {
            case IMPLICIT_CONVERSION -> "Implicit conversion (CONVERT_IMPLICIT) prevents an index seek. "
                    + "Match the parameter or variable data type to the column data type.";
            case ISNULL_COALESCE -> "ISNULL/COALESCE wrapping a column prevents an index seek. Rewrite the "
                    + "predicate to avoid wrapping the column, e.g. use \"WHERE col = @val OR col IS NULL\" "
                    + "instead of \"WHERE ISNULL(col, '') = @val\".";
            case LEADING_WILDCARD -> "Leading wildcard LIKE (e.g. LIKE '%text') prevents an index seek - SQL "
                    + "Server must scan every row. If possible, use full-text indexing or reverse the search pattern.";
            case CASE_EXPRESSION -> "CASE expression in a predicate prevents an index seek. Rewrite using "
                    + "separate WHERE clauses combined with OR, or split into multiple queries.";
            default -> reason.startsWith("Function call")
                    ? reason + " prevents an index seek. Remove the function from the column side - apply it "
                            + "to the parameter instead, or create a computed column with the expression and index that."
                    : reason + " prevents an index seek, forcing a scan.";
        };
    }

    /**
     * True when the predicate holds nothing but PROBE() bitmap filters pushed down
     * from a hash join.
     */
    static boolean isProbeOnly(String predicate) {
        String stripped = PROBE_CALL.matcher(predicate).replaceAll("").trim();
        stripped = CONNECTOR.matcher(stripped).replaceAll("").trim();
        return stripped.isEmpty();
    }
}
