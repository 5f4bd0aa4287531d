/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import ai.asserts.inventory.config.ScanConfig;
import ai.asserts.inventory.error.InventoryScanException;
import ai.asserts.inventory.error.ScanErrorType;
import ai.asserts.inventory.model.AccountInventory;
import ai.asserts.inventory.report.InventorySummary;
import ai.asserts.inventory.report.InventoryWriter;
import ai.asserts.inventory.report.SummaryReducer;
import ai.asserts.inventory.report.SummaryReporter;
import ai.asserts.inventory.scan.AccountOrchestrator;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.logging.LoggingSystem;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class InventoryRunnerTest extends EasyMockSupport {
    private AccountOrchestrator accountOrchestrator;
    private InventoryWriter inventoryWriter;
    private SummaryReducer summaryReducer;
    private SummaryReporter summaryReporter;
    private InventoryRunner inventoryRunner;
    private final ScanConfig scanConfig = ScanConfig.builder().build();
    private final AccountInventory inventory = AccountInventory.builder()
            .globalResources(Collections.emptyMap())
            .build();

    @BeforeEach
    public void setup() {
        accountOrchestrator = mock(AccountOrchestrator.class);
        inventoryWriter = mock(InventoryWriter.class);
        summaryReducer = mock(SummaryReducer.class);
        summaryReporter = mock(SummaryReporter.class);
        inventoryRunner = new InventoryRunner(mock(ScanConfigProvider.class), accountOrchestrator, inventoryWriter,
                summaryReducer, summaryReporter, new ScanCancellation(), mock(LoggingSystem.class));
    }

    @Test
    public void runScan() throws Exception {
        Path output = Paths.get("inventory.json");
        InventorySummary summary = InventorySummary.builder()
                .types(Collections.emptyMap())
                .build();
        expect(accountOrchestrator.scan(scanConfig)).andReturn(inventory);
        expect(inventoryWriter.write(inventory, scanConfig)).andReturn(output);
        expect(summaryReducer.reduce(inventory)).andReturn(summary);
        expect(summaryReporter.report(inventory, summary, output)).andReturn("summary");
        replayAll();

        assertEquals(0, inventoryRunner.runScan(scanConfig));
        verifyAll();
    }

    @Test
    public void runScan_credentialFailure() {
        expect(accountOrchestrator.scan(scanConfig)).andThrow(new InventoryScanException(ScanErrorType.CREDENTIALS,
                "Unable to load credentials", null));
        replayAll();

        assertEquals(2, inventoryRunner.runScan(scanConfig));
        verifyAll();
    }

    @Test
    public void runScan_writeFailure() throws Exception {
        expect(accountOrchestrator.scan(scanConfig)).andReturn(inventory);
        expect(inventoryWriter.write(inventory, scanConfig)).andThrow(new IOException("disk full"));
        replayAll();

        assertEquals(3, inventoryRunner.runScan(scanConfig));
        verifyAll();
    }
}
