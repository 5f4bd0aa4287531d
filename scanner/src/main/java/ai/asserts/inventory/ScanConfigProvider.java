/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import ai.asserts.inventory.config.ScanConfig;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.TreeSet;

import static org.springframework.util.StringUtils.hasLength;

/**
 * Builds the {@link ScanConfig} for this invocation. The optional YAML file provides the base configuration, the
 * <code>inventory.*</code> properties (command line arguments or environment) override it.
 */
@Component
@Slf4j
public class ScanConfigProvider {
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private final ObjectMapperFactory objectMapperFactory;
    private final ResourceLoader resourceLoader = new FileSystemResourceLoader();
    private final ScanConfig scanConfig;

    public ScanConfigProvider(ObjectMapperFactory objectMapperFactory,
                              @Value("${inventory.config-file:aws_inventory_config.yml}") String scanConfigFile,
                              @Value("${inventory.regions:}") String regions,
                              @Value("${inventory.exclude:}") String exclude,
                              @Value("${inventory.output:}") String outputPath,
                              @Value("${inventory.verbose:}") String verbose) {
        this.objectMapperFactory = objectMapperFactory;
        ScanConfig config = load(scanConfigFile);
        if (hasLength(regions)) {
            config.setRegions(new TreeSet<>(LIST_SPLITTER.splitToList(regions)));
        }
        if (hasLength(exclude)) {
            config.setExclude(new TreeSet<>(LIST_SPLITTER.splitToList(exclude)));
        }
        if (hasLength(outputPath)) {
            config.setOutputPath(outputPath);
        }
        if (hasLength(verbose)) {
            config.setVerbose(Boolean.parseBoolean(verbose));
        }
        config.validateConfig();
        this.scanConfig = config;
        log.info("Scan configuration {}", scanConfig);
    }

    public ScanConfig getScanConfig() {
        return scanConfig;
    }

    @VisibleForTesting
    ScanConfig load(String scanConfigFile) {
        Resource resource = resourceLoader.getResource(scanConfigFile);
        if (!resource.exists()) {
            log.info("Scan config file {} not found, using defaults", scanConfigFile);
            return new ScanConfig();
        }
        try (InputStream inputStream = resource.getInputStream()) {
            log.info("Loading scan configuration from {}", scanConfigFile);
            ScanConfig config = objectMapperFactory.getObjectMapper().readValue(inputStream, ScanConfig.class);
            return config != null ? config : new ScanConfig();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read scan config file " + scanConfigFile, e);
        }
    }
}
