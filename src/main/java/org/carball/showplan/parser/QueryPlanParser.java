package org.carball.showplan.parser;

import org.carball.showplan.model.plan.CardinalityFeedbackEntry;
import org.carball.showplan.model.plan.MemoryGrantInfo;
import org.carball.showplan.model.plan.MissingIndex;
import org.carball.showplan.model.plan.OptimizerHardwareInfo;
import org.carball.showplan.model.plan.PlanParameter;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.QueryTimeStats;
import org.carball.showplan.model.plan.SetOptions;
import org.carball.showplan.model.plan.StatisticsUsage;
import org.carball.showplan.model.plan.ThreadStats;
import org.carball.showplan.model.plan.TraceFlag;
import org.carball.showplan.model.plan.WaitStat;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.carball.showplan.parser.ShowPlanElements.attr;
import static org.carball.showplan.parser.ShowPlanElements.boolAttr;
import static org.carball.showplan.parser.ShowPlanElements.child;
import static org.carball.showplan.parser.ShowPlanElements.children;
import static org.carball.showplan.parser.ShowPlanElements.doubleAttr;
import static org.carball.showplan.parser.ShowPlanElements.intAttr;
import static org.carball.showplan.parser.ShowPlanElements.joinNonEmpty;
import static org.carball.showplan.parser.ShowPlanElements.longAttr;
import static org.carball.showplan.parser.ShowPlanElements.unbracketed;

/**
 * Reads statement attributes and the metadata elements of a {@code <QueryPlan>}.
 */
final class QueryPlanParser {

    private QueryPlanParser() {
    }

    static void readStatementAttributes(PlanStatement statement, Element stmt) {
        statement.setOptimizationLevel(attr(stmt, "StatementOptmLevel"));
        statement.setEarlyAbortReason(attr(stmt, "StatementOptmEarlyAbortReason"));
        statement.setParameterizationType(intAttr(stmt, "StatementParameterizationType"));
        statement.setParentObjectId(intAttr(stmt, "ParentObjectId"));
        statement.setBatchModeOnRowStoreUsed(boolAttr(stmt, "BatchModeOnRowStoreUsed"));
        statement.setQueryHash(attr(stmt, "QueryHash"));
        statement.setQueryPlanHash(attr(stmt, "QueryPlanHash"));
        statement.setCardinalityEstimationModelVersion(intAttr(stmt, "CardinalityEstimationModelVersion"));
        statement.setQueryStoreHintId(intAttr(stmt, "QueryStoreStatementHintId"));
        statement.setQueryStoreHintText(attr(stmt, "QueryStoreStatementHintText"));
        statement.setQueryStoreHintSource(attr(stmt, "QueryStoreStatementHintSource"));
    }

    static void readQueryPlan(PlanStatement statement, Element stmt, Element queryPlan) {
        Element setOptions = child(stmt, "StatementSetOptions");
        if (setOptions != null) {
            statement.setSetOptions(new SetOptions(
                    boolAttr(setOptions, "ANSI_NULLS"),
                    boolAttr(setOptions, "ANSI_PADDING"),
                    boolAttr(setOptions, "ANSI_WARNINGS"),
                    boolAttr(setOptions, "ARITHABORT"),
                    boolAttr(setOptions, "CONCAT_NULL_YIELDS_NULL"),
                    boolAttr(setOptions, "NUMERIC_ROUNDABORT"),
                    boolAttr(setOptions, "QUOTED_IDENTIFIER")));
        }

        statement.setMemoryGrant(memoryGrant(child(queryPlan, "MemoryGrantInfo")));

        statement.setCachedPlanSizeKb(longAttr(queryPlan, "CachedPlanSize"));
        statement.setDegreeOfParallelism(intAttr(queryPlan, "DegreeOfParallelism"));
        statement.setEffectiveDegreeOfParallelism(intAttr(queryPlan, "EffectiveDegreeOfParallelism"));
        statement.setNonParallelPlanReason(attr(queryPlan, "NonParallelPlanReason"));
        statement.setRetrievedFromCache(boolAttr(queryPlan, "RetrievedFromCache"));
        statement.setCompileTimeMs(longAttr(queryPlan, "CompileTime"));
        statement.setCompileMemoryKb(longAttr(queryPlan, "CompileMemory"));
        statement.setCompileCpuMs(longAttr(queryPlan, "CompileCPU"));
        statement.setMaxQueryMemoryKb(longAttr(queryPlan, "MaxQueryMemory"));
        statement.setDopFeedbackAdjusted(attr(queryPlan, "IsDOPFeedbackAdjusted"));
        statement.setPlanGuideDb(attr(queryPlan, "PlanGuideDB"));
        statement.setPlanGuideName(attr(queryPlan, "PlanGuideName"));
        statement.setUsePlan(boolAttr(queryPlan, "UsePlan"));
        if (statement.getCardinalityEstimationModelVersion() == 0) {
            statement.setCardinalityEstimationModelVersion(intAttr(queryPlan, "CardinalityEstimationModelVersion"));
        }

        Element parameterizedText = child(queryPlan, "ParameterizedText");
        if (parameterizedText != null) {
            statement.setParameterizedText(parameterizedText.getTextContent());
        }

        statement.setMissingIndexes(missingIndexes(child(queryPlan, "MissingIndexes")));

        Element warnings = child(queryPlan, "Warnings");
        if (warnings != null) {
            statement.getPlanWarnings().addAll(PlanWarningParser.parse(warnings));
        }

        Element hardware = child(queryPlan, "OptimizerHardwareDependentProperties");
        if (hardware != null) {
            statement.setHardwareProperties(new OptimizerHardwareInfo(
                    longAttr(hardware, "EstimatedAvailableMemoryGrant"),
                    longAttr(hardware, "EstimatedPagesCached"),
                    intAttr(hardware, "EstimatedAvailableDegreeOfParallelism"),
                    longAttr(hardware, "MaxCompileMemory")));
        }

        for (Element stats : children(child(queryPlan, "OptimizerStatsUsage"), "StatisticsInfo")) {
            statement.getStatisticsUsage().add(new StatisticsUsage(
                    unbracketed(stats, "Statistics"),
                    unbracketed(stats, "Database"),
                    unbracketed(stats, "Schema"),
                    unbracketed(stats, "Table"),
                    longAttr(stats, "ModificationCount"),
                    doubleAttr(stats, "SamplingPercent"),
                    attr(stats, "LastUpdate")));
        }

        Element threadStat = child(queryPlan, "ThreadStat");
        if (threadStat != null) {
            statement.setThreadStats(new ThreadStats(
                    intAttr(threadStat, "Branches"),
                    intAttr(threadStat, "UsedThreads")));
        }

        for (Element parameter : children(child(queryPlan, "ParameterList"), ShowPlanElements.COLUMN_REFERENCE)) {
            statement.getParameters().add(new PlanParameter(
                    attr(parameter, "Column", ""),
                    attr(parameter, "ParameterDataType", ""),
                    attr(parameter, "ParameterCompiledValue"),
                    attr(parameter, "ParameterRuntimeValue")));
        }

        for (Element wait : children(child(queryPlan, "WaitStats"), "Wait")) {
            statement.getWaitStats().add(new WaitStat(
                    attr(wait, "WaitType", ""),
                    longAttr(wait, "WaitTimeMs"),
                    longAttr(wait, "WaitCount")));
        }

        Element timeStats = child(queryPlan, "QueryTimeStats");
        if (timeStats != null) {
            statement.setQueryTimeStats(new QueryTimeStats(
                    longAttr(timeStats, "CpuTime"),
                    longAttr(timeStats, "ElapsedTime"),
                    longAttr(timeStats, "UdfCpuTime"),
                    longAttr(timeStats, "UdfElapsedTime")));
        }

        for (Element traceFlags : children(queryPlan, "TraceFlags")) {
            boolean compileTime = boolAttr(traceFlags, "IsCompileTime");
            for (Element flag : children(traceFlags, "TraceFlag")) {
                statement.getTraceFlags().add(new TraceFlag(
                        intAttr(flag, "Value"), attr(flag, "Scope", ""), compileTime));
            }
        }

        for (Element object : children(child(queryPlan, "IndexedViewInfo"), "Object")) {
            String name = joinNonEmpty(".",
                    unbracketed(object, "Database"),
                    unbracketed(object, "Schema"),
                    unbracketed(object, "Table"),
                    unbracketed(object, "Index"));
            if (!name.isEmpty()) {
                statement.getIndexedViews().add(name);
            }
        }

        for (Element entry : children(child(queryPlan, "CardinalityFeedback"), "Entry")) {
            statement.getCardinalityFeedback().add(new CardinalityFeedbackEntry(
                    longAttr(entry, "Key"), longAttr(entry, "Value")));
        }
    }

    private static MemoryGrantInfo memoryGrant(Element grant) {
        if (grant == null) {
            return null;
        }
        MemoryGrantInfo info = new MemoryGrantInfo();
        info.setSerialRequiredMemoryKb(longAttr(grant, "SerialRequiredMemory"));
        info.setSerialDesiredMemoryKb(longAttr(grant, "SerialDesiredMemory"));
        info.setRequiredMemoryKb(longAttr(grant, "RequiredMemory"));
        info.setDesiredMemoryKb(longAttr(grant, "DesiredMemory"));
        info.setRequestedMemoryKb(longAttr(grant, "RequestedMemory"));
        info.setGrantedMemoryKb(longAttr(grant, "GrantedMemory"));
        info.setMaxUsedMemoryKb(longAttr(grant, "MaxUsedMemory"));
        info.setGrantWaitTimeMs(longAttr(grant, "GrantWaitTime"));
        info.setLastRequestedMemoryKb(longAttr(grant, "LastRequestedMemory"));
        info.setFeedbackAdjusted(attr(grant, "IsMemoryGrantFeedbackAdjusted"));
        return info;
    }

    static List<MissingIndex> missingIndexes(Element missingIndexes) {
        List<MissingIndex> result = new ArrayList<>();
        for (Element group : children(missingIndexes, "MissingIndexGroup")) {
            double impact = doubleAttr(group, "Impact");
            for (Element index : children(group, "MissingIndex")) {
                MissingIndex missing = new MissingIndex();
                missing.setDatabase(nullToEmpty(unbracketed(index, "Database")));
                missing.setSchema(nullToEmpty(unbracketed(index, "Schema")));
                missing.setTable(nullToEmpty(unbracketed(index, "Table")));
                missing.setImpact(impact);

                for (Element columnGroup : children(index, "ColumnGroup")) {
                    List<String> columns = children(columnGroup, "Column").stream()
                            .map(column -> nullToEmpty(unbracketed(column, "Name")))
                            .filter(name -> !name.isEmpty())
                            .collect(Collectors.toList());
                    switch (attr(columnGroup, "Usage", "")) {
                        case "EQUALITY" -> missing.setEqualityColumns(columns);
                        case "INEQUALITY" -> missing.setInequalityColumns(columns);
                        case "INCLUDE" -> missing.setIncludeColumns(columns);
                        default -> { }
                    }
                }

                missing.setCreateStatement(createStatement(missing));
                result.add(missing);
            }
        }
        return result;
    }

    private static String createStatement(MissingIndex missing) {
        List<String> keys = missing.getKeyColumns();
        if (keys.isEmpty()) {
            return null;
        }
        String name = "IX_" + missing.getTable() + "_" + String.join("_", keys.subList(0, Math.min(3, keys.size())));
        StringBuilder sql = new StringBuilder("CREATE NONCLUSTERED INDEX [").append(name).append("]\n")
                .append("ON ").append(missing.getSchema()).append(".").append(missing.getTable())
                .append(" (").append(String.join(", ", keys)).append(")");
        if (!missing.getIncludeColumns().isEmpty()) {
            sql.append("\nINCLUDE (").append(String.join(", ", missing.getIncludeColumns())).append(")");
        }
        return sql.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
