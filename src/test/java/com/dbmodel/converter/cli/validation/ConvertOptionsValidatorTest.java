package com.dbmodel.converter.cli.validation;

import com.dbmodel.converter.cli.exception.OptionsValidationException;
import com.dbmodel.converter.cli.model.ConvertOptions;
import com.dbmodel.converter.cli.model.ValidatedConvertOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ConvertOptionsValidatorTest {

    @TempDir
    Path dir;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();

    private static ConvertOptions options(String... args) {
        ConvertOptions options = new ConvertOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }

    private Path file(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, content);
        return path;
    }

    @Test
    void testValidOptions() throws IOException {
        Path source = file("shop.mwb", "zip");
        Path triggers = file("triggers.ini", "[Triggers]\norders_bi = public.orders_before_insert()\n");
        Path merge = file("functions.dbm", "<dbmodel/>");

        ValidatedConvertOptions validated = validator.validate(options(
                source.toString(), "--triggers", triggers.toString(), "--merge", merge.toString()));

        assertThat(validated.getSourcePath()).isEqualTo(source.toAbsolutePath().normalize());
        assertThat(validated.getOutputPath()).isEqualTo(dir.resolve("shop.dbm").toAbsolutePath().normalize());
        assertThat(validated.getTriggerConfig().getFunctionForTrigger("orders_bi"))
                .contains("public.orders_before_insert()");
        assertThat(validated.getMergePaths()).containsExactly(merge.toAbsolutePath().normalize());
    }

    @Test
    void testWithoutOptionalFiles() throws IOException {
        Path source = file("shop.mwb", "zip");

        ValidatedConvertOptions validated = validator.validate(options(source.toString()));

        assertThat(validated.getTriggerConfig()).isNull();
        assertThat(validated.getMergePaths()).isEmpty();
    }

    @Test
    void testMissingSource() {
        ConvertOptions options = options(dir.resolve("missing.mwb").toString());

        Throwable thrown = catchThrowable(() -> validator.validate(options));

        assertThat(thrown).isInstanceOf(OptionsValidationException.class);
        assertThat(((OptionsValidationException) thrown).getErrors()).hasSize(1);
        assertThat(((OptionsValidationException) thrown).getErrors().get(0)).contains("does not exist");
    }

    @Test
    void testSourceWithOutputExtension() throws IOException {
        Path source = file("shop.dbm", "<dbmodel/>");

        assertThatThrownBy(() -> validator.validate(options(source.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("output extension");
    }

    @Test
    void testAllErrorsAreCollected() {
        ConvertOptions options = options(
                dir.resolve("missing.mwb").toString(),
                "--triggers", dir.resolve("missing.ini").toString(),
                "--merge", dir.resolve("missing.dbm").toString(),
                "--owner", " ");

        Throwable thrown = catchThrowable(() -> validator.validate(options));

        assertThat(thrown).isInstanceOf(OptionsValidationException.class);
        assertThat(((OptionsValidationException) thrown).getErrors()).hasSize(4)
                .anySatisfy(error -> assertThat(error).startsWith("Couldn't open trigger config file: "))
                .anySatisfy(error -> assertThat(error).startsWith("Merge file does not exist"))
                .anySatisfy(error -> assertThat(error).startsWith("Owner must not be blank"));
    }

    @Test
    void testMalformedTriggerLinesDoNotFailValidation() throws IOException {
        Path source = file("shop.mwb", "zip");
        Path triggers = file("triggers.ini", "[Triggers]\nnot an entry\norders_bi = public.f()\n");

        ValidatedConvertOptions validated = validator.validate(options(source.toString(), "--triggers", triggers.toString()));

        assertThat(validated.getTriggerConfig().getErrors()).hasSize(1);
        assertThat(validated.getTriggerConfig().size()).isEqualTo(1);
    }
}
