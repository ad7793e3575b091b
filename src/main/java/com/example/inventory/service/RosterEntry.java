package com.example.inventory.service;

public record RosterEntry(
        String pcName,
        int sourceRow
) {
    public RosterEntry(String pcName) {
        this(pcName, 0);
    }
}
