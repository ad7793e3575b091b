package com.example.inventory.service;

/**
 * Latest known state of one workstation.
 */
public record CanonicalRecord(
        String workstationName,
        String lastHardwareScan,
        String lastLoggedUserId,
        String primaryUserId,
        String ipAddress,
        String subnet
) {
    public static CanonicalRecord from(ScanRecord record) {
        return new CanonicalRecord(
                record.workstationName(),
                record.lastHardwareScan(),
                record.lastLoggedUserId(),
                record.primaryUserId(),
                record.ipAddress(),
                record.subnet()
        );
    }
}
