package com.raditha.cannibal.ingestion;

import java.util.List;

/**
 * Raised when ranking data does not have the shape the analysis needs:
 * missing required columns or unreadable values. Never recovered from; the
 * run produces no partial result.
 */
public class SchemaException extends RuntimeException {

    private final List<String> missingColumns;

    public SchemaException(String message) {
        super(message);
        this.missingColumns = List.of();
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
        this.missingColumns = List.of();
    }

    private SchemaException(String message, List<String> missingColumns) {
        super(message);
        this.missingColumns = List.copyOf(missingColumns);
    }

    /**
     * Build the exception reported when header columns are absent.
     */
    public static SchemaException missingColumns(List<String> missing) {
        return new SchemaException("Missing required columns: " + String.join(", ", missing), missing);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
