package com.example.inventory.service;

import com.example.inventory.config.ColumnConfig;
import com.example.inventory.service.table.OutputFormat;
import com.example.inventory.service.table.TableView;
import com.example.inventory.service.table.TableWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryExportService {
    public static final String LATEST_VIEW = "latest_records";
    public static final String MATCHED_VIEW = "matched_records";
    public static final String UNMATCHED_VIEW = "unmatched_names";

    private final TableWriter tableWriter;

    public TableView latestView(List<CanonicalRecord> records) {
        return recordView(LATEST_VIEW, records);
    }

    public TableView matchedView(List<CanonicalRecord> records) {
        return recordView(MATCHED_VIEW, records);
    }

    public TableView unmatchedView(List<RosterEntry> entries) {
        List<List<String>> rows = new ArrayList<>(entries.size());
        for (RosterEntry entry : entries) {
            rows.add(List.of(nullToEmpty(entry.pcName())));
        }
        return new TableView(UNMATCHED_VIEW, List.of(ColumnConfig.DEFAULT_ROSTER_HEADER), rows);
    }

    public byte[] export(TableView view, OutputFormat format) {
        return tableWriter.toBytes(view, format);
    }

    public Path export(TableView view, OutputFormat format, Path outputDir) {
        Path target = outputDir.resolve(format.fileName(view.name()));
        try {
            Files.createDirectories(outputDir);
            try (OutputStream out = Files.newOutputStream(target)) {
                tableWriter.write(view, format, out);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} rows to {}", view.rows().size(), target);
        return target;
    }

    private TableView recordView(String name, List<CanonicalRecord> records) {
        List<String> headers = new ArrayList<>();
        for (InventoryField field : InventoryField.values()) {
            headers.add(field.header());
        }
        List<List<String>> rows = new ArrayList<>(records.size());
        for (CanonicalRecord record : records) {
            List<String> row = new ArrayList<>(headers.size());
            for (InventoryField field : InventoryField.values()) {
                row.add(nullToEmpty(field.read(record)));
            }
            rows.add(row);
        }
        return new TableView(name, headers, rows);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
