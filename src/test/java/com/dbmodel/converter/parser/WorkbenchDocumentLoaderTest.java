package com.dbmodel.converter.parser;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.dbmodel.converter.WorkbenchFixtures.parse;
import static com.dbmodel.converter.WorkbenchFixtures.sampleDocument;
import static com.dbmodel.converter.WorkbenchFixtures.writeArchive;
import static org.assertj.core.api.Assertions.*;

class WorkbenchDocumentLoaderTest {

    private final WorkbenchDocumentLoader loader = new WorkbenchDocumentLoader();

    private static ConversionError errorOf(Throwable thrown) {
        assertThat(thrown).isInstanceOf(ConversionException.class);
        return ((ConversionException) thrown).getError();
    }

    @Test
    void testLoadPhysicalModel(@TempDir Path dir) throws IOException {
        Path archive = writeArchive(dir, "shop.mwb", sampleDocument());

        Element model = loader.loadPhysicalModel(archive);

        assertThat(model.getAttribute("struct-name")).isEqualTo("workbench.physical.Model");
        assertThat(model.getAttribute("id")).isEqualTo("model-1");
    }

    @Test
    void testMissingInnerDocument(@TempDir Path dir) throws IOException {
        Path archive = writeArchive(dir, "shop.mwb", "@db/data.db", "sqlite");

        assertThat(errorOf(catchThrowable(() -> loader.loadPhysicalModel(archive))))
                .isEqualTo(ConversionError.ARCHIVE_ENTRY_NOT_FOUND);
    }

    @Test
    void testNotAnArchive(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("shop.mwb");
        Files.writeString(file, sampleDocument());

        assertThat(errorOf(catchThrowable(() -> loader.loadPhysicalModel(file))))
                .isEqualTo(ConversionError.INVALID_FILE_FORMAT);
    }

    @Test
    void testMalformedXml(@TempDir Path dir) throws IOException {
        Path archive = writeArchive(dir, "shop.mwb", "<data grt_format=\"2.0\"");

        assertThat(errorOf(catchThrowable(() -> loader.loadPhysicalModel(archive))))
                .isEqualTo(ConversionError.INVALID_DOCUMENT);
    }

    @Test
    void testUnsupportedFormatVersion() {
        String xml = sampleDocument().replace("grt_format=\"2.0\"", "grt_format=\"1.0\"");

        Throwable thrown = catchThrowable(() -> loader.locatePhysicalModel(parse(xml)));

        assertThat(errorOf(thrown)).isEqualTo(ConversionError.INVALID_FILE_FORMAT);
        assertThat(thrown).hasMessageContaining("grt_format");
    }

    @Test
    void testUnsupportedDocumentType() {
        String xml = sampleDocument().replace("document_type=\"MySQL Workbench Model\"", "document_type=\"Other\"");

        Throwable thrown = catchThrowable(() -> loader.locatePhysicalModel(parse(xml)));

        assertThat(errorOf(thrown)).isEqualTo(ConversionError.INVALID_FILE_FORMAT);
        assertThat(thrown).hasMessageContaining("document_type");
    }

    @Test
    void testRootMustHoldDocument() {
        String xml = "<data grt_format=\"2.0\" document_type=\"MySQL Workbench Model\">"
                + "<value type=\"object\" struct-name=\"workbench.Other\" id=\"x\"/></data>";

        assertThat(errorOf(catchThrowable(() -> loader.locatePhysicalModel(parse(xml)))))
                .isEqualTo(ConversionError.INVALID_FILE_FORMAT);
    }

    @Test
    void testDocumentWithoutPhysicalModel() {
        String xml = "<data grt_format=\"2.0\" document_type=\"MySQL Workbench Model\">"
                + "<value type=\"object\" struct-name=\"workbench.Document\" id=\"doc\">"
                + "<value type=\"list\" content-type=\"object\" key=\"physicalModels\"/>"
                + "</value></data>";

        assertThat(errorOf(catchThrowable(() -> loader.locatePhysicalModel(parse(xml)))))
                .isEqualTo(ConversionError.INVALID_DOCUMENT);
    }
}
