package org.carball.showplan.model.plan;

public enum SpillKind {
    SORT("Sort"),
    HASH("Hash"),
    EXCHANGE("Exchange");

    private final String displayName;

    SpillKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
