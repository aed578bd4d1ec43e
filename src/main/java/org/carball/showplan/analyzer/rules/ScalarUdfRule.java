package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One finding per scalar UDF referenced by the operator's expressions. Works on
 * estimated plans too.
 */
public class ScalarUdfRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        return node.getScalarUdfs().stream()
                .map(udf -> PlanWarning.of("Scalar UDF",
                        "Scalar " + (udf.clrFunction() ? "CLR" : "T-SQL") + " UDF: " + udf.functionName()
                                + ". Scalar UDFs run once per row and prevent parallelism. Rewrite as an inline "
                                + "table-valued function, or dump results to a #temp table and apply the UDF only "
                                + "to the final result set.",
                        WarningSeverity.WARNING))
                .collect(Collectors.toList());
    }
}
