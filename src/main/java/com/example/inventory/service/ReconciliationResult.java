package com.example.inventory.service;

import java.util.List;

public record ReconciliationResult(
        List<CanonicalRecord> matched,
        List<RosterEntry> unmatched,
        int ambiguousReferenceKeys
) {
    public ReconciliationResult {
        matched = List.copyOf(matched);
        unmatched = List.copyOf(unmatched);
    }

    public int rosterSize() {
        return matched.size() + unmatched.size();
    }
}
