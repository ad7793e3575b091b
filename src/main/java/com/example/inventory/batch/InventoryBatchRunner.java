package com.example.inventory.batch;

import com.example.inventory.config.InventoryProperties;
import com.example.inventory.service.MalformedTimestampException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one batch job at startup when {@code inventory.batch.mode} is set.
 * A failure propagates, so the application exits with a non-zero status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "inventory.batch.mode")
public class InventoryBatchRunner implements ApplicationRunner {

    private final InventoryBatchJob batchJob;
    private final InventoryProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        BatchJobConfig config = BatchJobConfig.from(properties);
        try {
            BatchJobReport report = batchJob.run(config);
            for (Path file : report.writtenFiles()) {
                log.info("Output: {}", file.toAbsolutePath());
            }
            if (report.blankNameRecords() > 0) {
                log.warn("{} scan records had no workstation name and were left out", report.blankNameRecords());
            }
        } catch (MalformedTimestampException e) {
            log.error("Batch run aborted: workstation '{}' row {} has scan time '{}'",
                    e.getWorkstationName(), e.getSourceRow(), e.getRawValue());
            throw e;
        }
    }
}
