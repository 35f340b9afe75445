package com.raditha.cannibal.cli;

/**
 * File formats the CLI can export results to.
 */
public enum ExportFormat {
    CSV,
    JSON,
    /**
     * Both CSV and JSON.
     */
    BOTH;

    /**
     * Convert a string value to ExportFormat.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding format
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static ExportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ExportFormat value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "csv" -> CSV;
            case "json" -> JSON;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException(
                    "Export format must be 'csv', 'json', or 'both', got: " + value);
        };
    }

    public boolean includesCsv() {
        return this == CSV || this == BOTH;
    }

    public boolean includesJson() {
        return this == JSON || this == BOTH;
    }
}
