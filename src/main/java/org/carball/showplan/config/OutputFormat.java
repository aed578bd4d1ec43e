package org.carball.showplan.config;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH;

    public static OutputFormat fromString(String value) {
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
        }
    }
}
