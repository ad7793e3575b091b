package com.example.inventory.web;

import com.example.inventory.service.InventoryExportService;
import com.example.inventory.service.InventoryImportService;
import com.example.inventory.service.LatestRecordSelector;
import com.example.inventory.service.ReconciliationResult;
import com.example.inventory.service.RosterReconciler;
import com.example.inventory.service.SelectionResult;
import com.example.inventory.service.table.OutputFormat;
import com.example.inventory.service.table.TableView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.Locale;
import java.util.Map;

/**
 * Stateless upload endpoints: every request carries its own inventory (and roster) files.
 */
@Slf4j
@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryImportService importService;
    private final LatestRecordSelector selector;
    private final RosterReconciler reconciler;
    private final InventoryExportService exportService;

    @PostMapping("/latest")
    public SelectionResult latest(@RequestParam("file") MultipartFile file) {
        return selector.selectLatest(importService.readInventory(file));
    }

    @PostMapping("/reconcile")
    public ReconciliationReport reconcile(@RequestParam("inventory") MultipartFile inventory,
                                          @RequestParam("roster") MultipartFile roster) {
        SelectionResult selection = selector.selectLatest(importService.readInventory(inventory));
        ReconciliationResult result = reconciler.reconcile(selection.records(), importService.readRoster(roster));
        return new ReconciliationReport(
                selection.inputRecords(),
                selection.blankNameRecords(),
                selection.records().size(),
                result.ambiguousReferenceKeys(),
                result.matched(),
                result.unmatched()
        );
    }

    @PostMapping("/latest/export")
    public ResponseEntity<byte[]> exportLatest(@RequestParam("file") MultipartFile file,
                                               @RequestParam(value = "format", defaultValue = "csv") String format) {
        SelectionResult selection = selector.selectLatest(importService.readInventory(file));
        return download(exportService.latestView(selection.records()), OutputFormat.fromName(format));
    }

    @PostMapping("/reconcile/export")
    public ResponseEntity<byte[]> exportReconciliation(@RequestParam("inventory") MultipartFile inventory,
                                                       @RequestParam("roster") MultipartFile roster,
                                                       @RequestParam(value = "view", defaultValue = "matched") String view,
                                                       @RequestParam(value = "format", defaultValue = "csv") String format) {
        OutputFormat outputFormat = OutputFormat.fromName(format);
        String viewName = view.trim().toLowerCase(Locale.ROOT);
        if (!viewName.equals("matched") && !viewName.equals("unmatched")) {
            throw new IllegalArgumentException("Unknown view: " + view + " (use matched or unmatched)");
        }
        SelectionResult selection = selector.selectLatest(importService.readInventory(inventory));
        ReconciliationResult result = reconciler.reconcile(selection.records(), importService.readRoster(roster));
        TableView table = viewName.equals("matched")
                ? exportService.matchedView(result.matched())
                : exportService.unmatchedView(result.unmatched());
        return download(table, outputFormat);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private ResponseEntity<byte[]> download(TableView view, OutputFormat format) {
        byte[] bytes = exportService.export(view, format);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(format.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + format.fileName(view.name()) + "\"")
                .body(bytes);
    }
}
