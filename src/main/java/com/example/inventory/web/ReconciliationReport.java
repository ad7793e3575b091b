package com.example.inventory.web;

import com.example.inventory.service.CanonicalRecord;
import com.example.inventory.service.RosterEntry;

import java.util.List;

public record ReconciliationReport(
        int scanRecords,
        int blankNameRecords,
        int latestRecords,
        int ambiguousReferenceKeys,
        List<CanonicalRecord> matched,
        List<RosterEntry> unmatched
) {
}
