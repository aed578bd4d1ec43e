package org.carball.showplan.model.plan;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoded show-plan document. A plan that could not be read has the raw text and no batches.
 */
@Data
public class ParsedPlan {
    private String rawXml;
    private String buildVersion;
    private String build;
    private boolean clusteredMode;
    private List<PlanBatch> batches = new ArrayList<>();

    public ParsedPlan() {
    }

    public ParsedPlan(String rawXml) {
        this.rawXml = rawXml;
    }

    public boolean hasStatements() {
        return batches.stream().anyMatch(batch -> !batch.getStatements().isEmpty());
    }

    public List<PlanStatement> allStatements() {
        List<PlanStatement> statements = new ArrayList<>();
        for (PlanBatch batch : batches) {
            statements.addAll(batch.getStatements());
        }
        return statements;
    }

    public List<MissingIndex> allMissingIndexes() {
        List<MissingIndex> indexes = new ArrayList<>();
        for (PlanStatement statement : allStatements()) {
            indexes.addAll(statement.getMissingIndexes());
        }
        return indexes;
    }
}
