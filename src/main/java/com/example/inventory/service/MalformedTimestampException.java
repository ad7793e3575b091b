package com.example.inventory.service;

import lombok.Getter;

/**
 * A last-hardware-scan value that is present but does not match the configured format.
 */
@Getter
public class MalformedTimestampException extends IllegalArgumentException {

    private final String workstationName;
    private final String rawValue;
    private final int sourceRow;

    public MalformedTimestampException(String workstationName, String rawValue, int sourceRow, String pattern,
                                       Throwable cause) {
        super(buildMessage(workstationName, rawValue, sourceRow, pattern), cause);
        this.workstationName = workstationName;
        this.rawValue = rawValue;
        this.sourceRow = sourceRow;
    }

    private static String buildMessage(String workstationName, String rawValue, int sourceRow, String pattern) {
        String location = sourceRow > 0 ? " (row " + sourceRow + ")" : "";
        return "Malformed last hardware scan '" + rawValue + "' for workstation '" + workstationName + "'"
                + location + ", expected format " + pattern;
    }
}
