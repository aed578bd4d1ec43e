package org.carball.showplan.model.plan;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * An index the optimizer reported as missing, with a ready-to-run CREATE statement
 * when at least one key column is known.
 */
@Data
public class MissingIndex {
    private String database = "";
    private String schema = "";
    private String table = "";
    private double impact;
    private List<String> equalityColumns = new ArrayList<>();
    private List<String> inequalityColumns = new ArrayList<>();
    private List<String> includeColumns = new ArrayList<>();
    private String createStatement;

    public List<String> getKeyColumns() {
        List<String> keys = new ArrayList<>(equalityColumns);
        keys.addAll(inequalityColumns);
        return keys;
    }
}
