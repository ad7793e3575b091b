package com.example.inventory.service;

import java.util.List;

public record SelectionResult(
        List<CanonicalRecord> records,
        int inputRecords,
        int blankNameRecords
) {
    public SelectionResult {
        records = List.copyOf(records);
    }
}
