package com.example.inventory.batch;

import com.example.inventory.service.InventoryExportService;
import com.example.inventory.service.InventoryImportService;
import com.example.inventory.service.LatestRecordSelector;
import com.example.inventory.service.ReconciliationResult;
import com.example.inventory.service.RosterEntry;
import com.example.inventory.service.RosterReconciler;
import com.example.inventory.service.ScanRecord;
import com.example.inventory.service.SelectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * File-to-file pipeline: inventory export -> latest-state table -> (roster) -> matched / unmatched.
 * The inventory is always deduplicated first; the roster is reconciled against that table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryBatchJob {

    private final InventoryImportService importService;
    private final LatestRecordSelector selector;
    private final RosterReconciler reconciler;
    private final InventoryExportService exportService;

    public BatchJobReport run(BatchJobConfig config) {
        log.info("Starting {} run: inventory={}, roster={}, output={} ({})", config.mode(),
                config.inventoryFile(), config.rosterFile(), config.outputDir(), config.outputFormat());

        List<ScanRecord> records = importService.readInventory(config.inventoryFile());
        SelectionResult selection = selector.selectLatest(records, config.groupingKey());

        List<Path> written = new ArrayList<>();
        if (config.mode().writesLatest()) {
            written.add(exportService.export(exportService.latestView(selection.records()),
                    config.outputFormat(), config.outputDir()));
        }

        int rosterNames = 0;
        int matched = 0;
        int unmatched = 0;
        if (config.mode().reconciles()) {
            List<RosterEntry> roster = importService.readRoster(config.rosterFile());
            ReconciliationResult result = reconciler.reconcile(selection.records(), roster);
            written.add(exportService.export(exportService.matchedView(result.matched()),
                    config.outputFormat(), config.outputDir()));
            written.add(exportService.export(exportService.unmatchedView(result.unmatched()),
                    config.outputFormat(), config.outputDir()));
            rosterNames = roster.size();
            matched = result.matched().size();
            unmatched = result.unmatched().size();
        }

        BatchJobReport report = new BatchJobReport(config.mode(), selection.inputRecords(),
                selection.blankNameRecords(), selection.records().size(), rosterNames, matched, unmatched, written);
        log.info("Finished {} run: {} scan records, {} latest, {} matched, {} unmatched",
                report.mode(), report.scanRecords(), report.latestRecords(), report.matched(), report.unmatched());
        return report;
    }
}
