package org.carball.showplan.model.plan;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * One statement's plan: statement metadata, optional runtime figures and the
 * operator tree. The tree is rooted in a synthetic node carrying the statement type.
 */
@Data
public class PlanStatement {
    private String statementText = "";
    private String statementType = "";
    private double statementSubTreeCost;
    private double statementEstRows;
    private PlanNode rootNode;

    // Statement attributes
    private String optimizationLevel;
    private String earlyAbortReason;
    private String queryHash;
    private String queryPlanHash;
    private int cardinalityEstimationModelVersion;
    private int parameterizationType;
    private int parentObjectId;
    private boolean batchModeOnRowStoreUsed;
    private int queryStoreHintId;
    private String queryStoreHintText;
    private String queryStoreHintSource;

    // Query plan attributes
    private long cachedPlanSizeKb;
    private int degreeOfParallelism;
    private int effectiveDegreeOfParallelism;
    private String nonParallelPlanReason;
    private boolean retrievedFromCache;
    private long compileTimeMs;
    private long compileMemoryKb;
    private long compileCpuMs;
    private long maxQueryMemoryKb;
    private String dopFeedbackAdjusted;
    private String planGuideDb;
    private String planGuideName;
    private boolean usePlan;
    private String parameterizedText;

    private SetOptions setOptions;
    private MemoryGrantInfo memoryGrant;
    private QueryTimeStats queryTimeStats;
    private OptimizerHardwareInfo hardwareProperties;
    private ThreadStats threadStats;
    private CursorInfo cursor;

    private List<PlanParameter> parameters = new ArrayList<>();
    private List<MissingIndex> missingIndexes = new ArrayList<>();
    private List<WaitStat> waitStats = new ArrayList<>();
    private List<TraceFlag> traceFlags = new ArrayList<>();
    private List<CardinalityFeedbackEntry> cardinalityFeedback = new ArrayList<>();
    private List<StatisticsUsage> statisticsUsage = new ArrayList<>();
    private List<String> indexedViews = new ArrayList<>();

    private List<SubPlan> udfPlans = new ArrayList<>();
    private SubPlan storedProcPlan;

    private List<PlanWarning> planWarnings = new ArrayList<>();

    public void addWarning(PlanWarning warning) {
        planWarnings.add(warning);
    }

    public boolean hasRootNode() {
        return rootNode != null;
    }

    public long getElapsedTimeMs() {
        return queryTimeStats != null ? queryTimeStats.elapsedTimeMs() : 0;
    }

    public long getUdfCpuTimeMs() {
        return queryTimeStats != null ? queryTimeStats.udfCpuTimeMs() : 0;
    }

    public long getUdfElapsedTimeMs() {
        return queryTimeStats != null ? queryTimeStats.udfElapsedTimeMs() : 0;
    }

    public void forEachNode(Consumer<PlanNode> visitor) {
        if (rootNode != null) {
            rootNode.walk(visitor);
        }
    }

    public List<PlanStatement> getSubPlanStatements() {
        List<PlanStatement> nested = new ArrayList<>();
        for (SubPlan udf : udfPlans) {
            nested.addAll(udf.getStatements());
        }
        if (storedProcPlan != null) {
            nested.addAll(storedProcPlan.getStatements());
        }
        return nested;
    }

    /**
     * Statement warnings followed by every node warning, in tree order.
     */
    public List<PlanWarning> getAllWarnings() {
        List<PlanWarning> all = new ArrayList<>(planWarnings);
        forEachNode(node -> all.addAll(node.getWarnings()));
        return all;
    }
}
