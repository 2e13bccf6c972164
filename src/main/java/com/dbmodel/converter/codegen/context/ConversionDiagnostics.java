package com.dbmodel.converter.codegen.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Degraded conditions met during one conversion run. Conversion continued with a
 * best-effort substitute for each of them.
 *
 * Pure structure only: callers do the logging.
 */
@Getter
public class ConversionDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }
}
