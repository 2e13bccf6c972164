package com.dbmodel.converter.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the converter. No validation, no execution logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Parameters(index = "0", paramLabel = "MWB", description = "The MySQL Workbench model to convert")
	private Path source;

	@Option(names = { "--triggers" }, paramLabel = "FILE",
			description = "Trigger definition file mapping trigger names to function signatures")
	private Path triggers;

	@Option(names = { "--merge" }, paramLabel = "FILE",
			description = "Merge functions and aggregates from this dbm into the result (repeatable)")
	private List<Path> merge = new ArrayList<>();

	@Option(names = { "--nocitext" }, description = "Do not convert char/varchar columns to citext")
	private boolean noCitext;

	@Option(names = { "--nofkidx" }, description = "Do not create indexes made only of foreign key columns")
	private boolean noForeignKeyIndexes;

	@Option(names = { "--no-index-prefix" }, description = "Do not prefix index names with their table name")
	private boolean noIndexPrefix;

	@Option(names = { "--owner" }, defaultValue = "postgres", description = "Owner role of the generated objects (default: postgres)")
	private String owner;

}
