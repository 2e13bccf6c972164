package com.dbmodel.converter.cli;

import com.dbmodel.converter.cli.exception.OptionsValidationException;
import com.dbmodel.converter.cli.model.ConvertOptions;
import com.dbmodel.converter.cli.model.ValidatedConvertOptions;
import com.dbmodel.converter.cli.output.ConversionResultsPrinter;
import com.dbmodel.converter.cli.validation.ConvertOptionsValidator;
import com.dbmodel.converter.codegen.ConversionResult;
import com.dbmodel.converter.codegen.ConversionService;
import com.dbmodel.converter.codegen.ConverterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command converting a MySQL Workbench model into a pgModeler model.
 */
@Command(
        name = "mwb2dbm",
        mixinStandardHelpOptions = true,
        version = "mwb2dbm 1.0.0",
        description = "Converts a MySQL Workbench (.mwb) model into a pgModeler (.dbm) model written next to it."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConversionResultsPrinter printer = new ConversionResultsPrinter();

    @Override
    public Integer call() {
        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        ConverterConfig config = toConfig(validated);
        ConversionResult result = new ConversionService(config).convert();

        if (!result.isSuccess()) {
            log.error("Conversion failed: {}", result.getErrorMessage());
            return 1;
        }

        printer.printResults(result);
        return 0;
    }

    ConverterConfig toConfig(ValidatedConvertOptions validated) {
        return ConverterConfig.builder()
                .sourcePath(validated.getSourcePath())
                .triggerConfig(validated.getTriggerConfig())
                .mergePaths(validated.getMergePaths())
                .citextEnabled(!options.isNoCitext())
                .skipForeignKeyIndexes(options.isNoForeignKeyIndexes())
                .prefixIndexNames(!options.isNoIndexPrefix())
                .owner(options.getOwner())
                .build();
    }
}
