package org.carball.showplan.model.plan;

/**
 * Severity of a plan finding. Declaration order is severity order.
 */
public enum WarningSeverity {
    INFO("Info", "🔵"),
    WARNING("Warning", "🟡"),
    CRITICAL("Critical", "🔴");

    private final String displayName;
    private final String marker;

    WarningSeverity(String displayName, String marker) {
        this.displayName = displayName;
        this.marker = marker;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getMarker() {
        return marker;
    }

    public boolean isAtLeast(WarningSeverity other) {
        return compareTo(other) >= 0;
    }

    public static WarningSeverity fromName(String name) {
        for (WarningSeverity severity : values()) {
            if (severity.name().equalsIgnoreCase(name) || severity.displayName.equalsIgnoreCase(name)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + name + ". Use info, warning or critical");
    }
}
