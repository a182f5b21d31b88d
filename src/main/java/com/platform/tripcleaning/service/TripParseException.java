package com.platform.tripcleaning.service;

/**
 * A raw row carried a value that cannot be converted to its typed field.
 */
public class TripParseException extends Exception {

    private final long rowNumber;
    private final String field;

    public TripParseException(long rowNumber, String field, String message) {
        super("Row " + rowNumber + ", field '" + field + "': " + message);
        this.rowNumber = rowNumber;
        this.field = field;
    }

    public long getRowNumber() { return rowNumber; }

    public String getField() { return field; }
}
