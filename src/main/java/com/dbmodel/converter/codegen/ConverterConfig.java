package com.dbmodel.converter.codegen;

import com.dbmodel.converter.mapping.TriggerConfig;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for one conversion run.
 */
@Data
@Builder
public class ConverterConfig {

    public static final String OUTPUT_EXTENSION = ".dbm";

    /**
     * Workbench archive to convert.
     */
    private Path sourcePath;

    /**
     * Trigger name to function signature lookup; null when no configuration was given.
     */
    private TriggerConfig triggerConfig;

    /**
     * Destination documents whose functions and aggregates are spliced into the result.
     */
    @Singular
    private List<Path> mergePaths;

    /**
     * Convert varchar/char columns to citext with a length check constraint.
     */
    @Builder.Default
    private boolean citextEnabled = true;

    /**
     * Drop non-unique indexes made only of foreign key columns.
     */
    private boolean skipForeignKeyIndexes;

    /**
     * Prefix index names with their table name when they do not already contain it.
     */
    @Builder.Default
    private boolean prefixIndexNames = true;

    @Builder.Default
    private String owner = "postgres";

    @Builder.Default
    private String schema = "public";

    @Builder.Default
    private String formatVersion = "0.9.2";

    @Builder.Default
    private double positionScaleX = 1.8;

    @Builder.Default
    private double positionScaleY = 1.2;

    /**
     * Output file: the source path with its extension replaced by {@code .dbm}.
     */
    public Path getOutputPath() {
        String fileName = sourcePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return sourcePath.resolveSibling(base + OUTPUT_EXTENSION);
    }

    /**
     * Qualifies an object name with the destination schema.
     */
    public String qualify(String name) {
        return schema + "." + name;
    }
}
