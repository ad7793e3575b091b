package com.example.inventory.service;

import com.example.inventory.service.table.OutputFormat;
import com.example.inventory.service.table.TableView;
import com.example.inventory.service.table.TableWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InventoryExportServiceTest {

    private final InventoryExportService exportService = new InventoryExportService(new TableWriter());

    @Test
    void latestViewHasCanonicalColumns() {
        TableView view = exportService.latestView(List.of(
                new CanonicalRecord("LAB-01", "1/6/2024 08:00", "u2", "p2", "10.0.0.12", null)));

        assertThat(view.name()).isEqualTo(InventoryExportService.LATEST_VIEW);
        assertThat(view.headers()).containsExactly("Workstation Name", "Last Hardware Scan", "Last Logged User ID",
                "Primary User ID", "IP Address", "Subnet");
        assertThat(view.rows()).containsExactly(List.of("LAB-01", "1/6/2024 08:00", "u2", "p2", "10.0.0.12", ""));
    }

    @Test
    void unmatchedViewListsRosterNames() {
        TableView view = exportService.unmatchedView(List.of(new RosterEntry("LAB-03"), new RosterEntry(null)));

        assertThat(view.headers()).containsExactly("PC Name");
        assertThat(view.rows()).containsExactly(List.of("LAB-03"), List.of(""));
    }

    @Test
    void writesViewIntoOutputDirectory(@TempDir Path dir) throws Exception {
        Path outputDir = dir.resolve("out/nested");
        TableView view = exportService.matchedView(List.of(new CanonicalRecord("PC1", "", "", "", "", "")));

        Path written = exportService.export(view, OutputFormat.CSV, outputDir);

        assertThat(written).isEqualTo(outputDir.resolve("matched_records.csv"));
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).isEqualTo(
                "Workstation Name,Last Hardware Scan,Last Logged User ID,Primary User ID,IP Address,Subnet\r\n"
                        + "PC1,,,,,\r\n");
    }
}
