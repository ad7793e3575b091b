package com.example.inventory.service;

/**
 * Named columns of an inventory export, in output order.
 */
public enum InventoryField {
    WORKSTATION_NAME("Workstation Name"),
    LAST_HARDWARE_SCAN("Last Hardware Scan"),
    LAST_LOGGED_USER_ID("Last Logged User ID"),
    PRIMARY_USER_ID("Primary User ID"),
    IP_ADDRESS("IP Address"),
    SUBNET("Subnet");

    private final String header;

    InventoryField(String header) {
        this.header = header;
    }

    public String header() {
        return header;
    }

    public String read(CanonicalRecord record) {
        return switch (this) {
            case WORKSTATION_NAME -> record.workstationName();
            case LAST_HARDWARE_SCAN -> record.lastHardwareScan();
            case LAST_LOGGED_USER_ID -> record.lastLoggedUserId();
            case PRIMARY_USER_ID -> record.primaryUserId();
            case IP_ADDRESS -> record.ipAddress();
            case SUBNET -> record.subnet();
        };
    }
}
