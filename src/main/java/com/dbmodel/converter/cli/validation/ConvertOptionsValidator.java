package com.dbmodel.converter.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dbmodel.converter.cli.exception.OptionsValidationException;
import com.dbmodel.converter.cli.model.ConvertOptions;
import com.dbmodel.converter.cli.model.ValidatedConvertOptions;
import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.mapping.TriggerConfig;
import com.dbmodel.converter.mapping.TriggerConfigParser;

public class ConvertOptionsValidator {

	private static final Logger log = LoggerFactory.getLogger(ConvertOptionsValidator.class);

	private final TriggerConfigParser triggerConfigParser = new TriggerConfigParser();

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		Path source = o.getSource() == null ? null : o.getSource().toAbsolutePath().normalize();
		if (source == null) {
			errors.add("Source model is required.");
		} else if (!Files.isRegularFile(source)) {
			errors.add("Source model does not exist or is not a file: " + source);
		} else if (source.getFileName().toString().endsWith(ConverterConfig.OUTPUT_EXTENSION)) {
			errors.add("Source model already has the output extension " + ConverterConfig.OUTPUT_EXTENSION + ": " + source);
		}

		TriggerConfig triggerConfig = null;
		if (o.getTriggers() != null) {
			triggerConfig = loadTriggerConfig(o.getTriggers(), errors);
		}

		List<Path> mergePaths = new ArrayList<>();
		for (Path p : o.getMerge()) {
			if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
				errors.add("Merge file does not exist or is not readable: " + p);
			} else {
				mergePaths.add(p.toAbsolutePath().normalize());
			}
		}

		if (o.getOwner() == null || o.getOwner().isBlank()) {
			errors.add("Owner must not be blank (--owner).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path outputPath = ConverterConfig.builder().sourcePath(source).build().getOutputPath();
		return new ValidatedConvertOptions(source, outputPath, triggerConfig, List.copyOf(mergePaths));
	}

	private TriggerConfig loadTriggerConfig(Path path, List<String> errors) {
		if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
			errors.add("Couldn't open trigger config file: " + path);
			return null;
		}
		try {
			TriggerConfig config = triggerConfigParser.parse(path);
			// Malformed lines are reported but do not invalidate the file
			config.getErrors().forEach(e -> log.warn("Trigger config {}: {}", path, e));
			return config;
		} catch (IOException e) {
			errors.add("Couldn't read trigger config file " + path + ": " + e.getMessage());
			return null;
		}
	}
}
