package com.dbmodel.converter.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.dbmodel.converter.mapping.TriggerConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Path sourcePath;
    Path outputPath;
    TriggerConfig triggerConfig;
    List<Path> mergePaths;
}
