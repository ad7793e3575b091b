package com.example.inventory.service;

/**
 * How the latest-record selector builds its group key from a workstation name.
 */
public enum GroupingKeyPolicy {
    /** Name exactly as received: "PC01" and "pc01" are two workstations. */
    RAW,
    /** Name after {@link WorkstationNameNormalizer#normalize(String)}. */
    NORMALIZED;

    String keyOf(String workstationName) {
        return this == NORMALIZED ? WorkstationNameNormalizer.normalize(workstationName) : workstationName;
    }
}
