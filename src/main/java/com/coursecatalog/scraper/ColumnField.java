package com.coursecatalog.scraper;

/**
 * A named column of the plain-text listing.
 * Holds the label exactly as it is printed in the header line and the key used internally.
 */
public class ColumnField {
    public final String fieldName;
    public final String label;

    public ColumnField(String fieldName, String label) {
        this.fieldName = fieldName;
        this.label = label;
    }

    @Override
    public String toString() {
        return fieldName + "(" + label + ")";
    }
}
