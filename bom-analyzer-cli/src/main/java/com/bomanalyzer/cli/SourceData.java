package com.bomanalyzer.cli;

import com.bomanalyzer.core.catalogue.CatalogueBuilder;
import com.bomanalyzer.core.config.AnalyzerConfig;
import com.bomanalyzer.core.config.ConfigLoader;
import com.bomanalyzer.core.ingest.BomCsvReader;
import com.bomanalyzer.core.ingest.BomReadResult;
import com.bomanalyzer.core.model.Catalogue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Source file contents shared by the commands: the read result and the catalogue built from it.
 */
record SourceData(BomReadResult readResult, Catalogue catalogue) {

    private static final Logger log = LoggerFactory.getLogger(SourceData.class);

    /**
     * Reads a BOM export with the configured layout and builds its catalogue.
     *
     * @param csvFile export to read
     * @param config configuration supplying delimiter and column names
     * @return read result and catalogue
     * @throws IOException if the file cannot be read or lacks a required column
     */
    static SourceData load(Path csvFile, AnalyzerConfig config) throws IOException {
        if (!Files.isRegularFile(csvFile)) {
            throw new IOException("Source file not found: " + csvFile);
        }

        BomCsvReader reader = new BomCsvReader(
            config.input().columns().toBomColumns(),
            config.input().separator());
        BomReadResult readResult = reader.read(csvFile);
        log.info("Read {} rows from {} ({} rejected)",
            readResult.rows().size(), csvFile, readResult.rejectedRows().size());

        Catalogue catalogue = new CatalogueBuilder().addAll(readResult.rows()).build();
        return new SourceData(readResult, catalogue);
    }

    /**
     * Resolves the configuration: an explicit path is always loaded, the default file only when
     * it exists in the working directory.
     *
     * @param configPath path from the command line, or null
     * @return configuration to use
     */
    static AnalyzerConfig loadConfig(Path configPath) {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path defaultPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.exists(defaultPath)) {
            return ConfigLoader.load(defaultPath);
        }
        log.debug("No {} found, using default configuration", defaultPath);
        return AnalyzerConfig.defaults();
    }
}
