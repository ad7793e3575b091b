package com.example.inventory.service;

import com.example.inventory.config.ColumnConfig;
import com.example.inventory.service.table.HeaderNames;
import com.example.inventory.service.table.Table;
import com.example.inventory.service.table.TableFormatException;
import com.example.inventory.service.table.TableReader;
import com.example.inventory.service.table.TableRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns inventory exports and rosters into {@link ScanRecord}s and {@link RosterEntry}s.
 * Columns are located by header alias, see {@link ColumnConfig}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryImportService {

    private final TableReader tableReader;
    private final ColumnConfig columnConfig;

    public List<ScanRecord> readInventory(MultipartFile file) {
        requireContent(file, "Inventory");
        try (InputStream input = file.getInputStream()) {
            return readInventory(input, file.getOriginalFilename());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read inventory upload: " + e.getMessage(), e);
        }
    }

    public List<ScanRecord> readInventory(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return readInventory(input, path.getFileName().toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read inventory file " + path + ": " + e.getMessage(), e);
        }
    }

    public List<ScanRecord> readInventory(InputStream input, String fileName) {
        Table table = tableReader.read(input, fileName, columnConfig.aliases(InventoryField.WORKSTATION_NAME));
        List<ScanRecord> records = toScanRecords(table);
        log.info("Read {} scan records from {}", records.size(), table.sourceName());
        return records;
    }

    public List<RosterEntry> readRoster(MultipartFile file) {
        requireContent(file, "Roster");
        try (InputStream input = file.getInputStream()) {
            return readRoster(input, file.getOriginalFilename());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read roster upload: " + e.getMessage(), e);
        }
    }

    public List<RosterEntry> readRoster(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return readRoster(input, path.getFileName().toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read roster file " + path + ": " + e.getMessage(), e);
        }
    }

    public List<RosterEntry> readRoster(InputStream input, String fileName) {
        Table table = tableReader.read(input, fileName, columnConfig.roster());
        List<RosterEntry> entries = toRosterEntries(table);
        log.info("Read {} roster names from {}", entries.size(), table.sourceName());
        return entries;
    }

    List<ScanRecord> toScanRecords(Table table) {
        Map<InventoryField, Integer> columns = resolveInventoryColumns(table);
        if (!columns.containsKey(InventoryField.WORKSTATION_NAME)) {
            throw new TableFormatException("Missing column " + InventoryField.WORKSTATION_NAME.header()
                    + " in " + table.sourceName());
        }
        Set<Integer> mapped = new HashSet<>(columns.values());

        List<ScanRecord> records = new ArrayList<>(table.rows().size());
        for (TableRow row : table.rows()) {
            Map<String, String> other = new LinkedHashMap<>();
            for (int c = 0; c < table.columnCount(); c++) {
                if (!mapped.contains(c)) {
                    other.putIfAbsent(table.headers().get(c), row.value(c));
                }
            }
            records.add(new ScanRecord(
                    valueOf(row, columns, InventoryField.WORKSTATION_NAME),
                    valueOf(row, columns, InventoryField.LAST_HARDWARE_SCAN),
                    valueOf(row, columns, InventoryField.LAST_LOGGED_USER_ID),
                    valueOf(row, columns, InventoryField.PRIMARY_USER_ID),
                    valueOf(row, columns, InventoryField.IP_ADDRESS),
                    valueOf(row, columns, InventoryField.SUBNET),
                    other,
                    row.rowNo()
            ));
        }
        return records;
    }

    List<RosterEntry> toRosterEntries(Table table) {
        int column = findColumn(table, columnConfig.roster(), Set.of());
        if (column < 0) {
            throw new TableFormatException("Missing column " + ColumnConfig.DEFAULT_ROSTER_HEADER
                    + " in " + table.sourceName());
        }
        List<RosterEntry> entries = new ArrayList<>(table.rows().size());
        for (TableRow row : table.rows()) {
            entries.add(new RosterEntry(row.value(column), row.rowNo()));
        }
        return entries;
    }

    private Map<InventoryField, Integer> resolveInventoryColumns(Table table) {
        Map<InventoryField, Integer> columns = new EnumMap<>(InventoryField.class);
        Set<Integer> used = new HashSet<>();
        for (InventoryField field : InventoryField.values()) {
            int column = findColumn(table, columnConfig.aliases(field), used);
            if (column >= 0) {
                columns.put(field, column);
                used.add(column);
            } else {
                log.debug("No {} column in {}", field.header(), table.sourceName());
            }
        }
        return columns;
    }

    // aliases are tried in configured order so the canonical header wins over looser ones
    private static int findColumn(Table table, List<String> aliases, Set<Integer> taken) {
        List<String> normalizedHeaders = new ArrayList<>(table.columnCount());
        for (String header : table.headers()) {
            normalizedHeaders.add(HeaderNames.normalize(header));
        }
        for (String alias : HeaderNames.normalizeAll(aliases)) {
            for (int c = 0; c < normalizedHeaders.size(); c++) {
                if (!taken.contains(c) && alias.equals(normalizedHeaders.get(c))) {
                    return c;
                }
            }
        }
        return -1;
    }

    private static String valueOf(TableRow row, Map<InventoryField, Integer> columns, InventoryField field) {
        Integer column = columns.get(field);
        return column == null ? "" : row.value(column);
    }

    private static void requireContent(MultipartFile file, String label) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException(label + " file must not be empty");
        }
    }
}
