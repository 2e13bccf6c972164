package com.dbmodel.converter.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dbmodel.converter.cli.model.ConvertOptions;
import com.dbmodel.converter.cli.model.ValidatedConvertOptions;
import com.dbmodel.converter.codegen.ConversionResult;

/**
 * Responsible only for printing CLI output of a conversion.
 * No validation, no execution.
 */
public class ConversionResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConversionResultsPrinter.class);

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("MySQL Workbench to pgModeler converter");
        log.info("=================================================");
        log.info("Source Model: {}", v.getSourcePath());
        log.info("Output Model: {}", v.getOutputPath());
        log.info("Trigger Config: {}", o.getTriggers() != null ? o.getTriggers().toAbsolutePath() : "None");
        log.info("Merge Files: {}", v.getMergePaths().isEmpty() ? "None" : v.getMergePaths());
        log.info("citext Conversion: {}", o.isNoCitext() ? "disabled" : "enabled");
        log.info("Foreign Key Indexes: {}", o.isNoForeignKeyIndexes() ? "skipped" : "kept");
        log.info("Owner: {}", o.getOwner());
        log.info("=================================================");
    }

    public void printResults(ConversionResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Tables Converted: {}", result.getTablesConverted());
        log.info("Columns Converted: {}", result.getColumnsConverted());
        log.info("Relationships Created: {}", result.getRelationshipsCreated());
        log.info("Indexes Created: {}", result.getIndexesCreated());
        log.info("Domains Created: {}", result.getDomainsCreated());
        log.info("Enumerations Created: {}", result.getEnumsCreated());
        log.info("Triggers Created: {}", result.getTriggersCreated());
        if (result.getMergedObjects() > 0) {
            log.info("Merged Objects: {}", result.getMergedObjects());
        }
        if (result.getWarningCount() > 0) {
            log.warn("Warnings: {} (see log above)", result.getWarningCount());
        }
        log.info("=================================================");
    }
}
