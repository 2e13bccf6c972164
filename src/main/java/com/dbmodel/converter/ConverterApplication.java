package com.dbmodel.converter;

import com.dbmodel.converter.cli.ConvertCommand;
import picocli.CommandLine;

/**
 * Main entry point for the MySQL Workbench to pgModeler converter.
 * Reads a {@code .mwb} model and writes a {@code .dbm} model next to it.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand()).execute(args);
        System.exit(exitCode);
    }
}
