package com.example.inventory.service.table;

/**
 * The input could be read but its layout is unusable, e.g. no header row or a required column is missing.
 */
public class TableFormatException extends IllegalArgumentException {

    public TableFormatException(String message) {
        super(message);
    }
}
