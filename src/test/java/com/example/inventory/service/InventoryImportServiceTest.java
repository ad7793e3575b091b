package com.example.inventory.service;

import com.example.inventory.WorkbookFixtures;
import com.example.inventory.config.ColumnConfig;
import com.example.inventory.config.InventoryProperties;
import com.example.inventory.service.table.TableFormatException;
import com.example.inventory.service.table.TableReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InventoryImportServiceTest {

    private final InventoryImportService importService = new InventoryImportService(
            new TableReader(new InventoryProperties()),
            ColumnConfig.load(new ClassPathResource("column-config.json"), new ObjectMapper()));

    @Test
    void mapsAliasedColumnsToScanRecords() {
        byte[] bytes = WorkbookFixtures.singleSheet(
                List.of("Computer Name", "Last HW Scan", "Last Logged On User", "Primary User", "IP Addresses",
                        "IP Subnet", "Location"),
                List.of(Arrays.asList("LAB-01", LocalDateTime.of(2024, 1, 6, 8, 0), "u2", "p2", "10.0.0.12",
                        "10.0.0.0", "Room 4")));

        List<ScanRecord> records = importService.readInventory(new ByteArrayInputStream(bytes), "scans.xlsx");

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.workstationName()).isEqualTo("LAB-01");
            assertThat(record.lastHardwareScan()).isEqualTo("1/6/2024 8:00");
            assertThat(record.lastLoggedUserId()).isEqualTo("u2");
            assertThat(record.primaryUserId()).isEqualTo("p2");
            assertThat(record.ipAddress()).isEqualTo("10.0.0.12");
            assertThat(record.subnet()).isEqualTo("10.0.0.0");
            assertThat(record.otherFields()).containsExactly(Map.entry("Location", "Room 4"));
            assertThat(record.sourceRow()).isEqualTo(2);
        });
    }

    @Test
    void canonicalHeaderWinsOverLooserAlias() {
        byte[] bytes = WorkbookFixtures.csv("Name,Workstation Name", "laptop,PC1");

        List<ScanRecord> records = importService.readInventory(new ByteArrayInputStream(bytes), "scans.csv");

        assertThat(records.get(0).workstationName()).isEqualTo("PC1");
        assertThat(records.get(0).otherFields()).containsEntry("Name", "laptop");
    }

    @Test
    void optionalColumnsMayBeMissing() {
        byte[] bytes = WorkbookFixtures.csv("Workstation Name", "PC1", "PC2");

        List<ScanRecord> records = importService.readInventory(new ByteArrayInputStream(bytes), "scans.csv");

        assertThat(records).extracting(ScanRecord::workstationName).containsExactly("PC1", "PC2");
        assertThat(records).allSatisfy(record -> assertThat(record.lastHardwareScan()).isEmpty());
    }

    @Test
    void malformedScanTimeReportsItsCsvLine() {
        byte[] bytes = WorkbookFixtures.csv(
                "Workstation Name,Last Hardware Scan,Notes",
                "PC1,1/5/2024 8:00,\"spare",
                "charger\"",
                "",
                "PC2,2/30/2024 8:00,");

        List<ScanRecord> records = importService.readInventory(new ByteArrayInputStream(bytes), "scans.csv");

        assertThat(records).extracting(ScanRecord::sourceRow).containsExactly(2, 5);
        assertThatThrownBy(() -> new LatestRecordSelector(new InventoryProperties()).selectLatest(records))
                .isInstanceOf(MalformedTimestampException.class)
                .hasMessageContaining("row 5");
    }

    @Test
    void inventoryWithoutNameColumnIsRejected() {
        byte[] bytes = WorkbookFixtures.csv("Host,IP", "PC1,10.0.0.1");

        assertThatThrownBy(() -> importService.readInventory(new ByteArrayInputStream(bytes), "scans.csv"))
                .isInstanceOf(TableFormatException.class);
    }

    @Test
    void readsRosterNamesAsSupplied() {
        byte[] bytes = WorkbookFixtures.singleSheet(List.of("PC Name", "Owner"),
                List.of(List.of(" Lab-01 ", "ann"), Arrays.asList(null, "bob"), List.of("LAB-03", "cy")));

        List<RosterEntry> roster = importService.readRoster(new ByteArrayInputStream(bytes), "roster.xlsx");

        // cell text is trimmed on read; blank names stay in the roster
        assertThat(roster).extracting(RosterEntry::pcName).containsExactly("Lab-01", "", "LAB-03");
        assertThat(roster).extracting(RosterEntry::sourceRow).containsExactly(2, 3, 4);
    }

    @Test
    void readsFromPathAndUpload(@TempDir Path dir) throws Exception {
        Path roster = dir.resolve("roster.csv");
        Files.write(roster, WorkbookFixtures.csv("Computer Name", "PC9"));

        assertThat(importService.readRoster(roster)).extracting(RosterEntry::pcName).containsExactly("PC9");

        MockMultipartFile upload = new MockMultipartFile("roster", "roster.csv", "text/csv",
                WorkbookFixtures.csv("PC", "PC7"));
        assertThat(importService.readRoster(upload)).extracting(RosterEntry::pcName).containsExactly("PC7");
    }

    @Test
    void emptyUploadIsRejected() {
        MockMultipartFile empty = new MockMultipartFile("file", "scans.xlsx", null, new byte[0]);

        assertThatThrownBy(() -> importService.readInventory(empty))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Inventory");
    }

    @Test
    void missingFileIsAnIoFailure(@TempDir Path dir) {
        assertThatThrownBy(() -> importService.readInventory(dir.resolve("absent.xlsx")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("absent.xlsx");
    }
}
