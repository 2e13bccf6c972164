package com.dbmodel.converter.codegen;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Result of a conversion run.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int tablesConverted;
    private int columnsConverted;
    private int relationshipsCreated;
    private int indexesCreated;
    private int domainsCreated;
    private int enumsCreated;
    private int triggersCreated;
    private int mergedObjects;
    private int warningCount;

    public static ConversionResult failure(String errorMessage) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
