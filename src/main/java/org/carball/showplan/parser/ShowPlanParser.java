package org.carball.showplan.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.model.plan.CursorInfo;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanBatch;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.SubPlan;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.carball.showplan.parser.ShowPlanElements.attr;
import static org.carball.showplan.parser.ShowPlanElements.boolAttr;
import static org.carball.showplan.parser.ShowPlanElements.child;
import static org.carball.showplan.parser.ShowPlanElements.children;
import static org.carball.showplan.parser.ShowPlanElements.descendants;
import static org.carball.showplan.parser.ShowPlanElements.doubleAttr;
import static org.carball.showplan.parser.ShowPlanElements.isNullOrEmpty;

/**
 * Decodes SQL Server show-plan XML into a {@link ParsedPlan}.
 *
 * <p>Decoding never throws on content. A document that cannot be read at all
 * yields a plan holding only the raw text, and individual attributes that do not
 * parse fall back to zero, false or null.
 */
@Slf4j
public final class ShowPlanParser {

    private ShowPlanParser() {
    }

    public static ParsedPlan parseFile(Path planFile) throws IOException {
        if (!Files.exists(planFile)) {
            throw new IOException("Plan file not found: " + planFile);
        }
        byte[] bytes = Files.readAllBytes(planFile);
        return parse(decode(bytes));
    }

    public static ParsedPlan parse(String xml) {
        ParsedPlan plan = new ParsedPlan(xml);
        if (xml == null || xml.isBlank()) {
            log.debug("Empty show-plan document");
            return plan;
        }

        Document document;
        try {
            document = newDocumentBuilder().parse(new InputSource(new StringReader(stripByteOrderMark(xml))));
        } catch (SAXException | IOException | ParserConfigurationException e) {
            log.debug("Unreadable show-plan document: {}", e.getMessage());
            return plan;
        }

        Element root = document.getDocumentElement();
        if (root == null) {
            return plan;
        }
        plan.setBuildVersion(attr(root, "Version"));
        plan.setBuild(attr(root, "Build"));
        plan.setClusteredMode(boolAttr(root, "ClusteredMode"));

        for (Element batchElement : descendants(root, "Batch")) {
            PlanBatch batch = new PlanBatch();
            for (Element statement : children(child(batchElement, "Statements"))) {
                batch.getStatements().addAll(expand(RawStatement.of(statement)));
            }
            if (!batch.getStatements().isEmpty()) {
                plan.getBatches().add(batch);
            }
        }

        // Envelope without batches: pick up any simple statements directly
        if (plan.getBatches().isEmpty()) {
            PlanBatch batch = new PlanBatch();
            for (Element statement : descendants(root, "StmtSimple")) {
                batch.getStatements().add(parseStatement(statement));
            }
            if (!batch.getStatements().isEmpty()) {
                plan.getBatches().add(batch);
            }
        }

        OperatorCostCalculator.computeCosts(plan);
        log.debug("Decoded show-plan with {} batch(es), {} statement(s)",
                plan.getBatches().size(), plan.allStatements().size());
        return plan;
    }

    /**
     * Expands one statement element into the flat list of statements it contains.
     * Conditionals contribute their condition, then and else branches in order;
     * cursors contribute one statement per operation that has a query plan.
     */
    static List<PlanStatement> expand(RawStatement raw) {
        List<PlanStatement> results = new ArrayList<>();
        Element element = raw.element();

        switch (raw.kind()) {
            case CONDITIONAL -> {
                for (Element condition : children(child(element, "Condition"))) {
                    results.addAll(expand(RawStatement.of(condition)));
                }
                for (Element then : children(child(element, "Then", "Statements"))) {
                    results.addAll(expand(RawStatement.of(then)));
                }
                for (Element otherwise : children(child(element, "Else", "Statements"))) {
                    results.addAll(expand(RawStatement.of(otherwise)));
                }
            }
            case CURSOR -> results.addAll(expandCursor(element));
            case SIMPLE -> results.add(parseStatement(element));
        }
        return results;
    }

    private static List<PlanStatement> expandCursor(Element cursorStatement) {
        List<PlanStatement> results = new ArrayList<>();
        Element cursorPlan = child(cursorStatement, "CursorPlan");
        if (cursorPlan == null) {
            return results;
        }

        String cursorName = attr(cursorPlan, "CursorName");
        for (Element operation : children(cursorPlan, "Operation")) {
            Element queryPlan = child(operation, "QueryPlan");
            Element relOp = child(queryPlan, ShowPlanElements.REL_OP);
            if (relOp == null) {
                continue;
            }
            String operationType = attr(operation, "OperationType", "CursorOp");

            PlanStatement statement = new PlanStatement();
            statement.setStatementText(attr(cursorStatement, "StatementText", ""));
            statement.setStatementType(attr(cursorStatement, "StatementType", "SELECT"));
            statement.setStatementSubTreeCost(doubleAttr(cursorStatement, "StatementSubTreeCost"));
            QueryPlanParser.readStatementAttributes(statement, cursorStatement);
            QueryPlanParser.readQueryPlan(statement, cursorStatement, queryPlan);

            PlanNode operatorRoot = RelOpParser.parse(relOp);
            if (statement.getStatementSubTreeCost() <= 0) {
                statement.setStatementSubTreeCost(operatorRoot.getEstimatedTotalSubtreeCost());
            }
            statement.setRootNode(statementRoot(statement, operatorRoot));

            if (statement.getStatementText().isEmpty()) {
                statement.setStatementText("Cursor: " + cursorName + " (" + operationType + ")");
            }
            statement.setCursor(new CursorInfo(
                    cursorName,
                    attr(cursorPlan, "CursorActualType"),
                    attr(cursorPlan, "CursorRequestedType"),
                    attr(cursorPlan, "CursorConcurrency"),
                    boolAttr(cursorPlan, "ForwardOnly"),
                    operationType));
            results.add(statement);
        }
        return results;
    }

    static PlanStatement parseStatement(Element stmt) {
        PlanStatement statement = new PlanStatement();
        statement.setStatementText(attr(stmt, "StatementText", ""));
        statement.setStatementType(attr(stmt, "StatementType", ""));
        statement.setStatementSubTreeCost(doubleAttr(stmt, "StatementSubTreeCost"));
        statement.setStatementEstRows(doubleAttr(stmt, "StatementEstRows"));

        Element queryPlan = child(stmt, "QueryPlan");
        if (queryPlan == null) {
            return statement;
        }

        QueryPlanParser.readStatementAttributes(statement, stmt);
        QueryPlanParser.readQueryPlan(statement, stmt, queryPlan);

        Element relOp = child(queryPlan, ShowPlanElements.REL_OP);
        if (relOp != null) {
            statement.setRootNode(statementRoot(statement, RelOpParser.parse(relOp)));
        }

        for (Element udf : children(stmt, "UDF")) {
            statement.getUdfPlans().add(subPlan(udf));
        }
        Element storedProc = child(stmt, "StoredProc");
        if (storedProc != null) {
            statement.setStoredProcPlan(subPlan(storedProc));
        }
        return statement;
    }

    /**
     * Synthetic root standing for the statement itself, with the plan's top operator as its only child.
     */
    private static PlanNode statementRoot(PlanStatement statement, PlanNode operatorRoot) {
        String type = isNullOrEmpty(statement.getStatementType())
                ? "QUERY"
                : statement.getStatementType().toUpperCase(Locale.ROOT);
        PlanNode root = new PlanNode();
        root.setNodeId(-1);
        root.setPhysicalOp(type);
        root.setLogicalOp(type);
        root.setEstimatedTotalSubtreeCost(statement.getStatementSubTreeCost());
        root.setEstimateRows(statement.getStatementEstRows());
        root.addChild(operatorRoot);
        return root;
    }

    private static SubPlan subPlan(Element element) {
        SubPlan subPlan = new SubPlan();
        subPlan.setName(attr(element, "ProcName", ""));
        subPlan.setNativelyCompiled(boolAttr(element, "IsNativelyCompiled"));
        for (Element statement : children(child(element, "Statements"))) {
            subPlan.getStatements().addAll(expand(RawStatement.of(statement)));
        }
        return subPlan;
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new DefaultHandler());
        return builder;
    }

    /**
     * Decodes file bytes, honouring a UTF-16 or UTF-8 byte order mark. Plan files
     * saved by SSMS are usually UTF-16 LE.
     */
    static String decode(byte[] bytes) {
        Charset charset = StandardCharsets.UTF_8;
        int offset = 0;
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
            charset = StandardCharsets.UTF_16LE;
            offset = 2;
        } else if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            charset = StandardCharsets.UTF_16BE;
            offset = 2;
        } else if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB
                && (bytes[2] & 0xFF) == 0xBF) {
            offset = 3;
        }
        return new String(bytes, offset, bytes.length - offset, charset);
    }

    private static String stripByteOrderMark(String xml) {
        return xml.charAt(0) == '\uFEFF' ? xml.substring(1) : xml;
    }
}
