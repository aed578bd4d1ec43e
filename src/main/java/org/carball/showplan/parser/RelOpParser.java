package org.carball.showplan.parser;

import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.ScalarUdfReference;
import org.carball.showplan.model.plan.ThreadCounters;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.carball.showplan.parser.ShowPlanElements.COLUMN_REFERENCE;
import static org.carball.showplan.parser.ShowPlanElements.REL_OP;
import static org.carball.showplan.parser.ShowPlanElements.SCALAR_OPERATOR;
import static org.carball.showplan.parser.ShowPlanElements.attr;
import static org.carball.showplan.parser.ShowPlanElements.boolAttr;
import static org.carball.showplan.parser.ShowPlanElements.child;
import static org.carball.showplan.parser.ShowPlanElements.children;
import static org.carball.showplan.parser.ShowPlanElements.columnList;
import static org.carball.showplan.parser.ShowPlanElements.descendants;
import static org.carball.showplan.parser.ShowPlanElements.doubleAttr;
import static org.carball.showplan.parser.ShowPlanElements.formatColumnRef;
import static org.carball.showplan.parser.ShowPlanElements.intAttr;
import static org.carball.showplan.parser.ShowPlanElements.is;
import static org.carball.showplan.parser.ShowPlanElements.isNullOrEmpty;
import static org.carball.showplan.parser.ShowPlanElements.joinNonEmpty;
import static org.carball.showplan.parser.ShowPlanElements.localName;
import static org.carball.showplan.parser.ShowPlanElements.longAttr;
import static org.carball.showplan.parser.ShowPlanElements.scalarString;
import static org.carball.showplan.parser.ShowPlanElements.scopedDescendants;
import static org.carball.showplan.parser.ShowPlanElements.stripBrackets;
import static org.carball.showplan.parser.ShowPlanElements.unbracketed;

/**
 * Builds the operator tree below a {@code <RelOp>} element.
 */
final class RelOpParser {

    // RelOp children that describe the operator rather than being its payload
    private static final Set<String> NON_OPERATOR_CHILDREN = Set.of(
            "OutputList", "RunTimeInformation", "Warnings", "MemoryFractions",
            "RunTimePartitionSummary", "MemoryGrant", "InternalInfo");

    private RelOpParser() {
    }

    static PlanNode parse(Element relOp) {
        PlanNode node = new PlanNode();
        readRelOpAttributes(node, relOp);

        Element operator = operatorElement(relOp);
        if (operator != null) {
            readObjectReference(node, operator);
            readPredicates(node, operator);
            readColumnLists(node, operator);
            readOperatorFlags(node, operator);
            readScalarUdfs(node, operator);
            if ("Eager Spool".equals(node.getLogicalOp())) {
                node.setSuggestedIndex(suggestSpoolIndex(relOp, operator));
            }
        }

        node.setOutputColumns(outputColumns(relOp));
        node.setWarnings(PlanWarningParser.parseWarningsOf(relOp));
        readMemory(node, relOp);
        readRuntimeCounters(node, child(relOp, "RunTimeInformation"));

        for (Element childRelOp : childRelOps(operator)) {
            node.addChild(parse(childRelOp));
        }
        return node;
    }

    /**
     * The first child that is the operator-specific payload (IndexScan, Hash, NestedLoops...).
     */
    static Element operatorElement(Element relOp) {
        for (Element child : children(relOp)) {
            if (!NON_OPERATOR_CHILDREN.contains(localName(child))) {
                return child;
            }
        }
        return null;
    }

    /**
     * Direct RelOp children of the operator element, then RelOps one level further
     * down under its other children, in document order.
     */
    private static List<Element> childRelOps(Element operator) {
        List<Element> result = new ArrayList<>();
        if (operator == null) {
            return result;
        }
        result.addAll(children(operator, REL_OP));
        for (Element child : children(operator)) {
            if (!is(child, REL_OP)) {
                result.addAll(children(child, REL_OP));
            }
        }
        return result;
    }

    private static void readRelOpAttributes(PlanNode node, Element relOp) {
        node.setNodeId(intAttr(relOp, "NodeId"));
        node.setPhysicalOp(attr(relOp, "PhysicalOp", ""));
        node.setLogicalOp(attr(relOp, "LogicalOp", ""));
        node.setEstimatedTotalSubtreeCost(doubleAttr(relOp, "EstimatedTotalSubtreeCost"));
        node.setEstimateRows(doubleAttr(relOp, "EstimateRows"));
        node.setEstimateIo(doubleAttr(relOp, "EstimateIO"));
        node.setEstimateCpu(doubleAttr(relOp, "EstimateCPU"));
        node.setEstimateRebinds(doubleAttr(relOp, "EstimateRebinds"));
        node.setEstimateRewinds(doubleAttr(relOp, "EstimateRewinds"));
        node.setAvgRowSize(intAttr(relOp, "AvgRowSize"));
        node.setParallel(boolAttr(relOp, "Parallel"));
        node.setPartitioned(boolAttr(relOp, "Partitioned"));
        node.setEstimatedExecutionMode(attr(relOp, "EstimatedExecutionMode"));
        node.setAdaptive(boolAttr(relOp, "IsAdaptive"));
        node.setAdaptiveThresholdRows(doubleAttr(relOp, "AdaptiveThresholdRows"));
        node.setEstimatedJoinType(attr(relOp, "EstimatedJoinType"));
        node.setEstimatedDop(intAttr(relOp, "EstimatedAvailableDegreeOfParallelism"));
        node.setTableCardinality(doubleAttr(relOp, "TableCardinality"));
        node.setEstimateRowsWithoutRowGoal(doubleAttr(relOp, "EstimateRowsWithoutRowGoal"));

        double rowsRead = doubleAttr(relOp, "EstimatedRowsRead");
        node.setEstimatedRowsRead(rowsRead != 0 ? rowsRead : node.getEstimateRowsWithoutRowGoal());
    }

    private static void readObjectReference(PlanNode node, Element operator) {
        List<Element> objects = scopedDescendants(operator, "Object");
        if (objects.isEmpty()) {
            return;
        }
        Element object = objects.get(0);
        String database = unbracketed(object, "Database");
        String schema = unbracketed(object, "Schema");
        String table = unbracketed(object, "Table");
        String index = unbracketed(object, "Index");

        node.setDatabaseName(database);
        node.setSchemaName(schema);
        node.setTableName(table);
        node.setIndexName(index);
        node.setStorageType(attr(object, "Storage"));

        String shortName = joinNonEmpty(".", schema, table);
        node.setObjectName(shortName.isEmpty() ? null : shortName);

        String fullName = joinNonEmpty(".", database, schema, table);
        if (!isNullOrEmpty(index)) {
            fullName += "." + index;
        }
        node.setFullObjectName(fullName.isEmpty() ? null : fullName);
    }

    private static void readPredicates(PlanNode node, Element operator) {
        List<Element> seeks = new ArrayList<>(scopedDescendants(operator, "SeekPredicateNew"));
        seeks.addAll(scopedDescendants(operator, "SeekPredicate"));
        List<String> seekParts = new ArrayList<>();
        for (Element seek : seeks) {
            for (Element scalar : descendants(seek, SCALAR_OPERATOR)) {
                String text = attr(scalar, "ScalarString");
                if (!isNullOrEmpty(text)) {
                    seekParts.add(text);
                }
            }
        }
        if (!seekParts.isEmpty()) {
            node.setSeekPredicates(String.join(" AND ", seekParts));
        }

        node.setPredicate(scalarString(child(operator, "Predicate")));
        node.setBuildResidual(scalarString(child(operator, "BuildResidual")));
        node.setProbeResidual(scalarString(child(operator, "ProbeResidual")));
        node.setResidual(scalarString(child(operator, "Residual")));
        node.setPassThru(scalarString(child(operator, "PassThru")));
        node.setSetPredicate(scalarString(child(operator, "SetPredicate")));
        node.setTopExpression(scalarString(child(operator, "TopExpression")));
    }

    private static void readColumnLists(PlanNode node, Element operator) {
        node.setHashKeysProbe(columnList(operator, "HashKeysProbe"));
        node.setHashKeysBuild(columnList(operator, "HashKeysBuild"));
        node.setHashKeys(columnList(operator, "HashKeys"));
        node.setOuterReferences(columnList(operator, "OuterReferences"));
        node.setInnerSideJoinColumns(columnList(operator, "InnerSideJoinColumns"));
        node.setOuterSideJoinColumns(columnList(operator, "OuterSideJoinColumns"));
        node.setGroupBy(columnList(operator, "GroupBy"));
        node.setPartitionColumns(columnList(operator, "PartitionColumns"));
        node.setPartitioningType(attr(operator, "PartitioningType"));

        Element segment = child(operator, "SegmentColumn", COLUMN_REFERENCE);
        if (segment != null) {
            node.setSegmentColumn(formatColumnRef(segment));
        }
        Element action = child(operator, "ActionColumn", COLUMN_REFERENCE);
        if (action != null) {
            node.setActionColumn(formatColumnRef(action));
        }

        Element orderBy = child(operator, "OrderBy");
        if (orderBy != null) {
            String columns = children(orderBy, "OrderByColumn").stream()
                    .map(RelOpParser::orderByColumn)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.joining(", "));
            node.setOrderBy(columns.isEmpty() ? null : columns);
        }

        Element definedValues = child(operator, "DefinedValues");
        if (definedValues != null) {
            List<String> parts = new ArrayList<>();
            for (Element defined : children(definedValues, "DefinedValue")) {
                Element columnRef = child(defined, COLUMN_REFERENCE);
                String column = columnRef != null ? formatColumnRef(columnRef) : "";
                String expression = attr(child(defined, SCALAR_OPERATOR), "ScalarString", "");
                if (!column.isEmpty() && !expression.isEmpty()) {
                    parts.add(column + " = " + expression);
                } else if (!expression.isEmpty()) {
                    parts.add(expression);
                } else if (!column.isEmpty()) {
                    parts.add(column);
                }
            }
            if (!parts.isEmpty()) {
                node.setDefinedValues(String.join("; ", parts));
            }
        }
    }

    private static String orderByColumn(Element orderByColumn) {
        boolean ascending = !"false".equals(attr(orderByColumn, "Ascending"));
        Element columnRef = child(orderByColumn, COLUMN_REFERENCE);
        String name = columnRef != null ? formatColumnRef(columnRef) : "";
        return name.isEmpty() ? "" : name + (ascending ? " ASC" : " DESC");
    }

    private static void readOperatorFlags(PlanNode node, Element operator) {
        node.setOrdered(boolAttr(operator, "Ordered"));
        node.setScanDirection(attr(operator, "ScanDirection"));
        node.setForcedIndex(boolAttr(operator, "ForcedIndex"));
        node.setForceScan(boolAttr(operator, "ForceScan"));
        node.setForceSeek(boolAttr(operator, "ForceSeek"));
        node.setNoExpandHint(boolAttr(operator, "NoExpandHint"));
        node.setLookup(boolAttr(operator, "Lookup"));
        node.setDynamicSeek(boolAttr(operator, "DynamicSeek"));
        node.setPercent(boolAttr(operator, "IsPercent"));
        node.setWithTies(boolAttr(operator, "WithTies"));
        node.setRowCount(boolAttr(operator, "RowCount"));
        node.setTopRows(intAttr(operator, "Rows"));
        node.setSortDistinct(boolAttr(operator, "Distinct"));
        node.setStartupExpression(boolAttr(operator, "StartupExpression"));
        node.setNestedLoopsOptimized(boolAttr(operator, "Optimized"));
        node.setWithOrderedPrefetch(boolAttr(operator, "WithOrderedPrefetch"));
        node.setWithUnorderedPrefetch(boolAttr(operator, "WithUnorderedPrefetch"));
        node.setManyToMany(boolAttr(operator, "ManyToMany"));
        node.setBitmapCreator(boolAttr(operator, "BitmapCreator"));
        node.setRemoting(boolAttr(operator, "Remoting"));
        node.setLocalParallelism(boolAttr(operator, "LocalParallelism"));
        node.setSpoolStack(boolAttr(operator, "Stack"));
        node.setPrimaryNodeId(intAttr(operator, "PrimaryNodeId"));
        node.setDmlRequestSort(boolAttr(operator, "DMLRequestSort"));
        node.setActualJoinType(attr(operator, "ActualJoinType"));
    }

    private static void readScalarUdfs(PlanNode node, Element operator) {
        for (Element udf : scopedDescendants(operator, "UserDefinedFunction")) {
            String name = unbracketed(udf, "FunctionName");
            if (!isNullOrEmpty(name)) {
                node.getScalarUdfs().add(new ScalarUdfReference(name, boolAttr(udf, "IsClrFunction")));
            }
        }
    }

    /**
     * CREATE INDEX that would replace an eager index spool: key columns from the
     * spool's seek ranges, included columns from its output list.
     */
    private static String suggestSpoolIndex(Element relOp, Element operator) {
        Element seek = child(operator, "SeekPredicateNew");
        if (seek == null) {
            seek = child(operator, "SeekPredicate");
        }
        if (seek == null) {
            return null;
        }

        List<String> keyColumns = new ArrayList<>();
        String schema = null;
        String table = null;
        for (Element range : descendants(seek, "RangeColumns")) {
            for (Element column : children(range, COLUMN_REFERENCE)) {
                String name = attr(column, "Column");
                if (!isNullOrEmpty(name)) {
                    keyColumns.add(name);
                }
                if (schema == null) {
                    schema = unbracketed(column, "Schema");
                }
                if (table == null) {
                    table = unbracketed(column, "Table");
                }
            }
        }
        if (keyColumns.isEmpty() || isNullOrEmpty(table)) {
            return null;
        }

        List<String> includeColumns = children(child(relOp, "OutputList"), COLUMN_REFERENCE).stream()
                .map(column -> attr(column, "Column"))
                .filter(name -> !isNullOrEmpty(name) && !keyColumns.contains(name))
                .collect(Collectors.toList());

        String target = isNullOrEmpty(schema) ? table : schema + "." + table;
        StringBuilder sql = new StringBuilder("CREATE INDEX [")
                .append(String.join("_", keyColumns))
                .append("] ON ").append(target)
                .append(" (").append(String.join(", ", keyColumns)).append(")");
        if (!includeColumns.isEmpty()) {
            sql.append(" INCLUDE (").append(String.join(", ", includeColumns)).append(")");
        }
        return sql.append(";").toString();
    }

    private static String outputColumns(Element relOp) {
        Element outputList = child(relOp, "OutputList");
        if (outputList == null) {
            return null;
        }
        String joined = children(outputList, COLUMN_REFERENCE).stream()
                .map(ShowPlanElements::formatColumnRef)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? null : stripBrackets(joined);
    }

    private static void readMemory(PlanNode node, Element relOp) {
        Element fractions = child(relOp, "MemoryFractions");
        if (fractions != null) {
            node.setMemoryFractionInput(doubleAttr(fractions, "Input"));
            node.setMemoryFractionOutput(doubleAttr(fractions, "Output"));
        }

        Element accessed = child(relOp, "RunTimePartitionSummary", "PartitionsAccessed");
        if (accessed != null) {
            node.setPartitionsAccessed(intAttr(accessed, "PartitionCount"));
        }

        Element grant = child(relOp, "MemoryGrant");
        if (grant != null) {
            node.setMemoryGrantKb(longAttr(grant, "GrantedMemory"));
            node.setDesiredMemoryKb(longAttr(grant, "DesiredMemory"));
            node.setMaxUsedMemoryKb(longAttr(grant, "MaxUsedMemory"));
        }
    }

    /**
     * Aggregates per-thread runtime counters. Additive counters are summed; elapsed
     * times are the maximum across threads since parallel threads overlap.
     */
    static void readRuntimeCounters(PlanNode node, Element runtime) {
        if (runtime == null) {
            return;
        }
        node.setActualStats(true);

        long rows = 0, executions = 0, rowsRead = 0, rebinds = 0, rewinds = 0;
        long cpu = 0, logicalReads = 0, physicalReads = 0, scans = 0, readAheads = 0;
        long lobLogicalReads = 0, lobPhysicalReads = 0, lobReadAheads = 0;
        long segmentReads = 0, segmentSkips = 0, udfCpu = 0;
        long maxElapsed = 0, maxUdfElapsed = 0;
        String executionMode = null;

        for (Element thread : children(runtime, "RunTimeCountersPerThread")) {
            ThreadCounters counters = new ThreadCounters(
                    intAttr(thread, "Thread"),
                    longAttr(thread, "ActualRows"),
                    longAttr(thread, "ActualExecutions"),
                    longAttr(thread, "ActualElapsedms"),
                    longAttr(thread, "ActualCPUms"),
                    longAttr(thread, "ActualRowsRead"),
                    longAttr(thread, "ActualLogicalReads"),
                    longAttr(thread, "ActualPhysicalReads"),
                    longAttr(thread, "ActualScans"),
                    longAttr(thread, "ActualReadAheads"));
            node.getThreadCounters().add(counters);

            rows += counters.actualRows();
            executions += counters.actualExecutions();
            rowsRead += counters.actualRowsRead();
            cpu += counters.actualCpuMs();
            logicalReads += counters.actualLogicalReads();
            physicalReads += counters.actualPhysicalReads();
            scans += counters.actualScans();
            readAheads += counters.actualReadAheads();
            maxElapsed = Math.max(maxElapsed, counters.actualElapsedMs());

            rebinds += longAttr(thread, "ActualRebinds");
            rewinds += longAttr(thread, "ActualRewinds");
            lobLogicalReads += longAttr(thread, "ActualLobLogicalReads");
            lobPhysicalReads += longAttr(thread, "ActualLobPhysicalReads");
            lobReadAheads += longAttr(thread, "ActualLobReadAheads");
            segmentReads += longAttr(thread, "ActualSegmentReads");
            segmentSkips += longAttr(thread, "ActualSegmentSkips");
            udfCpu += longAttr(thread, "UdfCpuTime");
            maxUdfElapsed = Math.max(maxUdfElapsed, longAttr(thread, "UdfElapsedTime"));
            if (executionMode == null) {
                executionMode = attr(thread, "ActualExecutionMode");
            }
        }

        node.setActualRows(rows);
        node.setActualExecutions(executions);
        node.setActualRowsRead(rowsRead);
        node.setActualRebinds(rebinds);
        node.setActualRewinds(rewinds);
        node.setActualElapsedMs(maxElapsed);
        node.setActualCpuMs(cpu);
        node.setActualLogicalReads(logicalReads);
        node.setActualPhysicalReads(physicalReads);
        node.setActualScans(scans);
        node.setActualReadAheads(readAheads);
        node.setActualLobLogicalReads(lobLogicalReads);
        node.setActualLobPhysicalReads(lobPhysicalReads);
        node.setActualLobReadAheads(lobReadAheads);
        node.setActualSegmentReads(segmentReads);
        node.setActualSegmentSkips(segmentSkips);
        node.setUdfCpuTimeMs(udfCpu);
        node.setUdfElapsedTimeMs(maxUdfElapsed);
        node.setActualExecutionMode(executionMode);
    }
}
