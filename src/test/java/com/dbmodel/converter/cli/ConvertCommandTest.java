package com.dbmodel.converter.cli;

import com.dbmodel.converter.cli.model.ValidatedConvertOptions;
import com.dbmodel.converter.codegen.ConverterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.dbmodel.converter.WorkbenchFixtures.sampleDocument;
import static com.dbmodel.converter.WorkbenchFixtures.writeArchive;
import static org.assertj.core.api.Assertions.*;

class ConvertCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testConvertsArchive() throws IOException {
        Path archive = writeArchive(tempDir, "shop.mwb", sampleDocument());

        int exitCode = new CommandLine(new ConvertCommand()).execute(archive.toString(), "--nofkidx");

        assertThat(exitCode).isZero();
        String output = Files.readString(tempDir.resolve("shop.dbm"));
        assertThat(output).contains("<dbmodel").contains("name=\"customer_name_idx\"")
                .doesNotContain("name=\"fk_orders_customer_idx\"");
    }

    @Test
    void testInvalidOptionsExitWithOne() {
        int exitCode = new CommandLine(new ConvertCommand()).execute(tempDir.resolve("missing.mwb").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testConversionFailureExitsWithOne() throws IOException {
        Path archive = writeArchive(tempDir, "shop.mwb", sampleDocument().replace("grt_format=\"2.0\"", "grt_format=\"3.0\""));

        int exitCode = new CommandLine(new ConvertCommand()).execute(archive.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.exists(tempDir.resolve("shop.dbm"))).isFalse();
    }

    @Test
    void testOptionsMapToConfig() {
        ConvertCommand command = new ConvertCommand();
        new CommandLine(command).parseArgs("model.mwb", "--nocitext", "--no-index-prefix", "--owner", "app");
        Path source = tempDir.resolve("model.mwb");

        ConverterConfig config = command.toConfig(new ValidatedConvertOptions(
                source, tempDir.resolve("model.dbm"), null, List.of()));

        assertThat(config.getSourcePath()).isEqualTo(source);
        assertThat(config.isCitextEnabled()).isFalse();
        assertThat(config.isPrefixIndexNames()).isFalse();
        assertThat(config.isSkipForeignKeyIndexes()).isFalse();
        assertThat(config.getOwner()).isEqualTo("app");
        assertThat(config.getSchema()).isEqualTo("public");
        assertThat(config.getTriggerConfig()).isNull();
    }
}
