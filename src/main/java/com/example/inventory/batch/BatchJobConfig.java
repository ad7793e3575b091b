package com.example.inventory.batch;

import com.example.inventory.config.InventoryProperties;
import com.example.inventory.service.GroupingKeyPolicy;
import com.example.inventory.service.table.OutputFormat;

import java.nio.file.Path;

/**
 * Everything one batch run needs. {@code rosterFile} is only required when the mode reconciles.
 */
public record BatchJobConfig(
        RunMode mode,
        Path inventoryFile,
        Path rosterFile,
        Path outputDir,
        OutputFormat outputFormat,
        GroupingKeyPolicy groupingKey
) {
    public BatchJobConfig {
        if (mode == null) {
            throw new IllegalArgumentException("Run mode is required");
        }
        if (inventoryFile == null) {
            throw new IllegalArgumentException("Inventory file is required");
        }
        if (mode.reconciles() && rosterFile == null) {
            throw new IllegalArgumentException("Roster file is required for mode " + mode);
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("Output directory is required");
        }
        if (outputFormat == null) {
            outputFormat = OutputFormat.CSV;
        }
        if (groupingKey == null) {
            groupingKey = GroupingKeyPolicy.RAW;
        }
    }

    public static BatchJobConfig from(InventoryProperties properties) {
        InventoryProperties.Batch batch = properties.getBatch();
        return new BatchJobConfig(
                batch.getMode(),
                toPath(batch.getInventoryFile()),
                toPath(batch.getRosterFile()),
                toPath(batch.getOutputDir()),
                batch.getOutputFormat(),
                properties.getSelection().getGroupingKey()
        );
    }

    private static Path toPath(String value) {
        return value == null || value.isBlank() ? null : Path.of(value.trim());
    }
}
