package org.carball.showplan.parser;

import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.carball.showplan.PlanFixtures.node;
import static org.carball.showplan.PlanFixtures.resource;
import static org.carball.showplan.PlanFixtures.withChildren;

public class OperatorCostCalculatorTest {

    @Test
    void shouldSplitSubtreeCostIntoExclusiveCosts() {
        // When
        PlanStatement statement = ShowPlanParser.parse(resource("estimated-lookup.sqlplan")).allStatements().get(0);
        PlanNode root = statement.getRootNode();
        PlanNode join = root.child(0);

        // Then
        assertThat(root.getEstimatedOperatorCost()).isCloseTo(0.0, within(1e-9));
        assertThat(root.getCostPercent()).isZero();
        assertThat(join.getEstimatedOperatorCost()).isCloseTo(0.05, within(1e-9));
        assertThat(join.getCostPercent()).isEqualTo(10);
        assertThat(join.child(0).getCostPercent()).isEqualTo(40);
        assertThat(join.child(1).getCostPercent()).isEqualTo(50);
    }

    @Test
    void shouldKeepExclusiveCostsConsistentWithStatementCost() {
        for (String resource : new String[] {"estimated-lookup.sqlplan", "actual-parallel.sqlplan"}) {
            // Given
            ParsedPlan plan = ShowPlanParser.parse(resource(resource));

            for (PlanStatement statement : plan.allStatements()) {
                // When
                List<PlanNode> nodes = new ArrayList<>();
                statement.forEachNode(nodes::add);
                double total = nodes.stream().mapToDouble(PlanNode::getEstimatedOperatorCost).sum();

                // Then
                assertThat(total).isCloseTo(statement.getStatementSubTreeCost(), within(1e-6));
                assertThat(nodes).allSatisfy(node -> {
                    assertThat(node.getEstimatedOperatorCost()).isGreaterThanOrEqualTo(0);
                    assertThat(node.getCostPercent()).isBetween(0, 100);
                });
            }
        }
    }

    @Test
    void shouldClampNegativeExclusiveCostToZero() {
        // Given
        PlanNode parent = node(0, "Hash Match");
        parent.setEstimatedTotalSubtreeCost(1.0);
        PlanNode child = node(1, "Table Scan");
        child.setEstimatedTotalSubtreeCost(1.5);
        withChildren(parent, child);

        PlanStatement statement = new PlanStatement();
        statement.setStatementSubTreeCost(1.5);
        statement.setRootNode(parent);

        // When
        OperatorCostCalculator.computeCosts(statement);

        // Then
        assertThat(parent.getEstimatedOperatorCost()).isZero();
        assertThat(parent.getCostPercent()).isZero();
        assertThat(child.getCostPercent()).isEqualTo(100);
    }

    @Test
    void shouldUseRootCostWhenStatementCostIsMissing() {
        // Given
        PlanNode root = node(0, "Table Scan");
        root.setEstimatedTotalSubtreeCost(4.0);
        PlanStatement statement = new PlanStatement();
        statement.setRootNode(root);

        // When
        double total = OperatorCostCalculator.statementTotalCost(statement);

        // Then
        assertThat(total).isEqualTo(4.0);
    }

    @Test
    void shouldNeverDivideByZeroCost() {
        // Given
        PlanNode root = node(0, "Constant Scan");
        PlanStatement statement = new PlanStatement();
        statement.setRootNode(root);

        // When
        OperatorCostCalculator.computeCosts(statement);

        // Then
        assertThat(OperatorCostCalculator.statementTotalCost(statement)).isEqualTo(1.0);
        assertThat(root.getCostPercent()).isZero();
    }
}
