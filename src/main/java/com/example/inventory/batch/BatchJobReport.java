package com.example.inventory.batch;

import java.nio.file.Path;
import java.util.List;

public record BatchJobReport(
        RunMode mode,
        int scanRecords,
        int blankNameRecords,
        int latestRecords,
        int rosterNames,
        int matched,
        int unmatched,
        List<Path> writtenFiles
) {
    public BatchJobReport {
        writtenFiles = List.copyOf(writtenFiles);
    }
}
