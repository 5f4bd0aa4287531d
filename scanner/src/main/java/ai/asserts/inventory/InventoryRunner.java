/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import ai.asserts.inventory.config.ScanConfig;
import ai.asserts.inventory.error.InventoryScanException;
import ai.asserts.inventory.model.AccountInventory;
import ai.asserts.inventory.report.InventorySummary;
import ai.asserts.inventory.report.InventoryWriter;
import ai.asserts.inventory.report.SummaryReducer;
import ai.asserts.inventory.report.SummaryReporter;
import ai.asserts.inventory.scan.AccountOrchestrator;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one scan: inventory, then the output file, then the summary. On SIGINT the scan is cancelled and the partial
 * inventory is still written before the JVM exits.
 */
@Component
@Slf4j
public class InventoryRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final long SHUTDOWN_WAIT_SECONDS = 60;
    private final ScanConfigProvider scanConfigProvider;
    private final AccountOrchestrator accountOrchestrator;
    private final InventoryWriter inventoryWriter;
    private final SummaryReducer summaryReducer;
    private final SummaryReporter summaryReporter;
    private final ScanCancellation scanCancellation;
    private final LoggingSystem loggingSystem;
    private final CountDownLatch scanFinished = new CountDownLatch(1);
    private volatile int exitCode = 0;

    public InventoryRunner(ScanConfigProvider scanConfigProvider, AccountOrchestrator accountOrchestrator,
                           InventoryWriter inventoryWriter, SummaryReducer summaryReducer,
                           SummaryReporter summaryReporter, ScanCancellation scanCancellation,
                           LoggingSystem loggingSystem) {
        this.scanConfigProvider = scanConfigProvider;
        this.accountOrchestrator = accountOrchestrator;
        this.inventoryWriter = inventoryWriter;
        this.summaryReducer = summaryReducer;
        this.summaryReporter = summaryReporter;
        this.scanCancellation = scanCancellation;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public void run(ApplicationArguments args) {
        ScanConfig scanConfig = scanConfigProvider.getScanConfig();
        if (scanConfig.isVerbose()) {
            loggingSystem.setLogLevel("ai.asserts.inventory", LogLevel.DEBUG);
        }
        Thread shutdownHook = new Thread(this::onShutdown, "inventory-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            exitCode = runScan(scanConfig);
        } finally {
            scanFinished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    @VisibleForTesting
    int runScan(ScanConfig scanConfig) {
        try {
            AccountInventory inventory = accountOrchestrator.scan(scanConfig);
            Path output = inventoryWriter.write(inventory, scanConfig);
            InventorySummary summary = summaryReducer.reduce(inventory);
            summaryReporter.report(inventory, summary, output);
            return 0;
        } catch (InventoryScanException e) {
            log.error("Scan aborted [{}]: {}", e.getErrorType(), e.getMessage());
            return 2;
        } catch (IOException e) {
            log.error("Failed to write the inventory", e);
            return 3;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void onShutdown() {
        if (scanFinished.getCount() == 0) {
            return;
        }
        scanCancellation.cancel();
        try {
            if (!scanFinished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.error("Partial inventory was not written within {} seconds", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void removeShutdownHook(Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, shutdown hook already running");
        }
    }
}
