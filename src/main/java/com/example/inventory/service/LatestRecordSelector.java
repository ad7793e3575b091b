package com.example.inventory.service;

import com.example.inventory.config.InventoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a scan history to one record per workstation: the one with the latest hardware scan.
 * <p>
 * Records without a scan time lose to any record that has one. Among equal times the record
 * seen first in the input wins. A present but unparseable scan time fails the whole call.
 */
@Slf4j
@Service
public class LatestRecordSelector {

    private final DateTimeFormatter timestampFormat;
    private final String timestampPattern;
    private final GroupingKeyPolicy defaultPolicy;

    public LatestRecordSelector(InventoryProperties properties) {
        this.timestampFormat = properties.timestampFormatter();
        this.timestampPattern = properties.getTimestampPattern();
        this.defaultPolicy = properties.getSelection().getGroupingKey();
    }

    public SelectionResult selectLatest(List<ScanRecord> records) {
        return selectLatest(records, defaultPolicy);
    }

    public SelectionResult selectLatest(List<ScanRecord> records, GroupingKeyPolicy policy) {
        if (records == null || records.isEmpty()) {
            return new SelectionResult(List.of(), 0, 0);
        }
        GroupingKeyPolicy keyPolicy = policy == null ? defaultPolicy : policy;

        Map<String, Candidate> latestByKey = new LinkedHashMap<>();
        int blankNames = 0;
        for (ScanRecord record : records) {
            if (record == null || !record.hasWorkstationName()) {
                blankNames++;
                continue;
            }
            LocalDateTime scannedAt = parseScanTime(record);
            String key = keyPolicy.keyOf(record.workstationName());
            Candidate current = latestByKey.get(key);
            if (current == null || isLater(scannedAt, current.scannedAt())) {
                latestByKey.put(key, new Candidate(record, scannedAt));
            }
        }

        if (blankNames > 0) {
            log.warn("Skipped {} of {} scan records with a blank workstation name", blankNames, records.size());
        }

        List<CanonicalRecord> latest = new ArrayList<>(latestByKey.size());
        for (Candidate candidate : latestByKey.values()) {
            latest.add(CanonicalRecord.from(candidate.record()));
        }
        log.info("Selected {} latest records from {} scan records (grouping {})",
                latest.size(), records.size(), keyPolicy);
        return new SelectionResult(latest, records.size(), blankNames);
    }

    LocalDateTime parseScanTime(ScanRecord record) {
        String raw = record.lastHardwareScan();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(raw.trim(), timestampFormat);
        } catch (DateTimeParseException e) {
            throw new MalformedTimestampException(record.workstationName(), raw, record.sourceRow(),
                    timestampPattern, e);
        }
    }

    // strictly later, so the first record keeps a tie
    private static boolean isLater(LocalDateTime candidate, LocalDateTime current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }

    private record Candidate(ScanRecord record, LocalDateTime scannedAt) {
    }
}
