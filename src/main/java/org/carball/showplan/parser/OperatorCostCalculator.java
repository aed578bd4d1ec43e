package org.carball.showplan.parser;

import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;

/**
 * Derives each operator's exclusive cost and its share of the statement cost
 * from the subtree costs reported in the plan.
 */
public final class OperatorCostCalculator {

    private OperatorCostCalculator() {
    }

    public static void computeCosts(ParsedPlan plan) {
        plan.allStatements().forEach(OperatorCostCalculator::computeCosts);
    }

    /**
     * Computes costs for the statement's tree and for the statements of its
     * UDF and procedure sub-plans.
     */
    public static void computeCosts(PlanStatement statement) {
        PlanNode root = statement.getRootNode();
        if (root != null) {
            double totalCost = statementTotalCost(statement);
            root.walk(node -> computeNodeCost(node, totalCost));
        }
        statement.getSubPlanStatements().forEach(OperatorCostCalculator::computeCosts);
    }

    /**
     * Statement cost when reported, else the root's subtree cost, never below 1
     * once both are missing.
     */
    static double statementTotalCost(PlanStatement statement) {
        double total = statement.getStatementSubTreeCost() > 0
                ? statement.getStatementSubTreeCost()
                : statement.getRootNode().getEstimatedTotalSubtreeCost();
        return total <= 0 ? 1 : total;
    }

    private static void computeNodeCost(PlanNode node, double totalCost) {
        double childrenCost = node.getChildren().stream()
                .mapToDouble(PlanNode::getEstimatedTotalSubtreeCost)
                .sum();
        double exclusive = Math.max(0, node.getEstimatedTotalSubtreeCost() - childrenCost);
        node.setEstimatedOperatorCost(exclusive);

        int percent = (int) Math.round(exclusive / totalCost * 100);
        node.setCostPercent(Math.min(100, Math.max(0, percent)));
    }
}
