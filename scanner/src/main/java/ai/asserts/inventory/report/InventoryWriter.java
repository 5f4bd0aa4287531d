/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.report;

import ai.asserts.inventory.ObjectMapperFactory;
import ai.asserts.inventory.config.ScanConfig;
import ai.asserts.inventory.model.AccountInventory;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import static org.springframework.util.StringUtils.hasLength;

@Component
@Slf4j
public class InventoryWriter {
    private static final DateTimeFormatter FILE_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private final ObjectMapperFactory objectMapperFactory;

    public InventoryWriter(ObjectMapperFactory objectMapperFactory) {
        this.objectMapperFactory = objectMapperFactory;
    }

    /**
     * Writes the inventory as JSON to the configured output path, or to a timestamped file in the working directory.
     *
     * @return the path written to
     */
    public Path write(AccountInventory inventory, ScanConfig scanConfig) throws IOException {
        Path output = hasLength(scanConfig.getOutputPath()) ?
                Paths.get(scanConfig.getOutputPath()) : Paths.get(defaultFileName(LocalDateTime.now()));
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ObjectWriter writer = scanConfig.isPrettyPrint() ?
                objectMapperFactory.getJsonMapper().writerWithDefaultPrettyPrinter() :
                objectMapperFactory.getJsonMapper().writer();
        try (OutputStream outputStream = Files.newOutputStream(output)) {
            writer.writeValue(outputStream, inventory);
        }
        log.info("Inventory written to {}", output.toAbsolutePath());
        return output;
    }

    @VisibleForTesting
    static String defaultFileName(LocalDateTime time) {
        return "aws_resource_hierarchy_" + FILE_NAME_FORMAT.format(time) + ".json";
    }
}
