package com.example.inventory.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One hardware scan observation as delivered by the inventory source.
 * Only {@code workstationName} is required for grouping; everything else passes through.
 */
public record ScanRecord(
        String workstationName,
        String lastHardwareScan,
        String lastLoggedUserId,
        String primaryUserId,
        String ipAddress,
        String subnet,
        Map<String, String> otherFields,
        int sourceRow
) {
    public ScanRecord {
        otherFields = otherFields == null || otherFields.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(otherFields));
    }

    public ScanRecord(String workstationName,
                      String lastHardwareScan,
                      String lastLoggedUserId,
                      String primaryUserId,
                      String ipAddress,
                      String subnet) {
        this(workstationName, lastHardwareScan, lastLoggedUserId, primaryUserId, ipAddress, subnet, Map.of(), 0);
    }

    public boolean hasWorkstationName() {
        return workstationName != null && !workstationName.isBlank();
    }
}
