package com.dbmodel.converter.parser;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads a named entry out of a workbench project archive.
 */
public class WorkbenchArchiveReader {

    public byte[] extract(Path archive, String innerName) throws IOException {
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            ZipEntry entry = zip.getEntry(innerName);
            if (entry == null) {
                throw new ConversionException(ConversionError.ARCHIVE_ENTRY_NOT_FOUND,
                        innerName + " not found in " + archive);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return in.readAllBytes();
            }
        } catch (ZipException e) {
            throw new ConversionException(ConversionError.INVALID_FILE_FORMAT,
                    archive + " is not a workbench archive: " + e.getMessage(), e);
        }
    }
}
