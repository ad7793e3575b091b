package com.example.inventory.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a roster of workstation names into the reference rows it was found in and the names
 * that have no reference row. Names are compared after {@link WorkstationNameNormalizer}.
 */
@Slf4j
@Service
public class RosterReconciler {

    public ReconciliationResult reconcile(List<CanonicalRecord> reference, List<RosterEntry> roster) {
        ReferenceIndex index = indexByNormalizedName(reference == null ? List.of() : reference);
        List<RosterEntry> entries = roster == null ? List.of() : roster;

        List<CanonicalRecord> matched = new ArrayList<>();
        List<RosterEntry> unmatched = new ArrayList<>();
        for (RosterEntry entry : entries) {
            CanonicalRecord hit = index.recordsByKey().get(WorkstationNameNormalizer.normalize(entry.pcName()));
            if (hit != null) {
                matched.add(hit);
            } else {
                unmatched.add(entry);
            }
        }

        log.info("Reconciled {} roster names against {} reference records: {} matched, {} unmatched",
                entries.size(), index.recordsByKey().size(), matched.size(), unmatched.size());
        return new ReconciliationResult(matched, unmatched, index.collisions());
    }

    private ReferenceIndex indexByNormalizedName(List<CanonicalRecord> reference) {
        Map<String, CanonicalRecord> byKey = new HashMap<>(Math.max(16, reference.size() * 2));
        int collisions = 0;
        for (CanonicalRecord record : reference) {
            String key = WorkstationNameNormalizer.normalize(record.workstationName());
            if (key.isEmpty()) {
                continue;
            }
            CanonicalRecord first = byKey.putIfAbsent(key, record);
            if (first != null) {
                collisions++;
                log.warn("Reference records '{}' and '{}' share the key '{}', keeping the first",
                        first.workstationName(), record.workstationName(), key);
            }
        }
        return new ReferenceIndex(byKey, collisions);
    }

    private record ReferenceIndex(Map<String, CanonicalRecord> recordsByKey, int collisions) {
    }
}
