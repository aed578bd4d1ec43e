package org.carball.showplan.model.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * One operator of a statement's plan tree. Children are owned; the parent
 * link is a plain back-reference and is left out of equality, toString and JSON.
 */
@Data
public class PlanNode {

    // Identity
    private int nodeId;
    private String physicalOp = "";
    private String logicalOp = "";

    // Costs
    private double estimatedTotalSubtreeCost;
    private double estimatedOperatorCost;
    private int costPercent;
    private double estimateIo;
    private double estimateCpu;

    // Cardinality estimates
    private double estimateRows;
    private double estimateRebinds;
    private double estimateRewinds;
    private double estimatedRowsRead;
    private double estimateRowsWithoutRowGoal;
    private double tableCardinality;
    private int avgRowSize;

    // Execution shape
    private boolean parallel;
    private boolean partitioned;
    private String estimatedExecutionMode;
    private boolean adaptive;
    private double adaptiveThresholdRows;
    private String estimatedJoinType;
    private String actualJoinType;
    private int estimatedDop;

    // Object reference
    private String databaseName;
    private String schemaName;
    private String tableName;
    private String indexName;
    private String objectName;
    private String fullObjectName;
    private String storageType;

    // Predicates and column lists
    private String seekPredicates;
    private String predicate;
    private String buildResidual;
    private String probeResidual;
    private String residual;
    private String passThru;
    private String setPredicate;
    private String hashKeysBuild;
    private String hashKeysProbe;
    private String hashKeys;
    private String partitioningType;
    private String partitionColumns;
    private String orderBy;
    private String groupBy;
    private String outerReferences;
    private String innerSideJoinColumns;
    private String outerSideJoinColumns;
    private String segmentColumn;
    private String definedValues;
    private String outputColumns;
    private String actionColumn;
    private String topExpression;
    private int topRows;

    // Operator flags
    private boolean ordered;
    private String scanDirection;
    private boolean lookup;
    private boolean forcedIndex;
    private boolean forceScan;
    private boolean forceSeek;
    private boolean noExpandHint;
    private boolean dynamicSeek;
    private boolean percent;
    private boolean withTies;
    private boolean rowCount;
    private boolean sortDistinct;
    private boolean startupExpression;
    private boolean nestedLoopsOptimized;
    private boolean withOrderedPrefetch;
    private boolean withUnorderedPrefetch;
    private boolean manyToMany;
    private boolean bitmapCreator;
    private boolean remoting;
    private boolean localParallelism;
    private boolean spoolStack;
    private int primaryNodeId;
    private boolean dmlRequestSort;

    // Memory
    private double memoryFractionInput;
    private double memoryFractionOutput;
    private int partitionsAccessed;
    private long memoryGrantKb;
    private long desiredMemoryKb;
    private long maxUsedMemoryKb;

    // Runtime counters, aggregated across threads
    private boolean actualStats;
    private long actualRows;
    private long actualExecutions;
    private long actualRowsRead;
    private long actualRebinds;
    private long actualRewinds;
    private long actualElapsedMs;
    private long actualCpuMs;
    private long actualLogicalReads;
    private long actualPhysicalReads;
    private long actualScans;
    private long actualReadAheads;
    private long actualLobLogicalReads;
    private long actualLobPhysicalReads;
    private long actualLobReadAheads;
    private long actualSegmentReads;
    private long actualSegmentSkips;
    private String actualExecutionMode;
    private long udfCpuTimeMs;
    private long udfElapsedTimeMs;
    private List<ThreadCounters> threadCounters = new ArrayList<>();

    private List<ScalarUdfReference> scalarUdfs = new ArrayList<>();
    private String suggestedIndex;
    private List<PlanWarning> warnings = new ArrayList<>();

    private List<PlanNode> children = new ArrayList<>();

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private PlanNode parent;

    public void addChild(PlanNode child) {
        child.setParent(this);
        children.add(child);
    }

    public void addWarning(PlanWarning warning) {
        warnings.add(warning);
    }

    public boolean isPhysicalOp(String op) {
        return op.equals(physicalOp);
    }

    public boolean physicalOpContains(String fragment) {
        return physicalOp.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    public boolean hasActualStats() {
        return actualStats;
    }

    public boolean hasPredicate() {
        return predicate != null && !predicate.isEmpty();
    }

    public PlanNode child(int index) {
        return index < children.size() ? children.get(index) : null;
    }

    /**
     * Visits this node and its descendants in pre-order.
     */
    public void walk(Consumer<PlanNode> visitor) {
        visitor.accept(this);
        for (PlanNode child : children) {
            child.walk(visitor);
        }
    }

    public int countNodes() {
        int[] count = {0};
        walk(node -> count[0]++);
        return count[0];
    }

    public String describe() {
        StringBuilder sb = new StringBuilder(physicalOp).append(" (Node ").append(nodeId).append(")");
        if (objectName != null) {
            sb.append(" on ").append(objectName);
        }
        return sb.toString();
    }
}
