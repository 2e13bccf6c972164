package com.dbmodel.converter.exception;

/**
 * Fatal conditions that abort a conversion run.
 */
public enum ConversionError {
    ARCHIVE_ENTRY_NOT_FOUND,
    INVALID_FILE_FORMAT,
    INVALID_DOCUMENT,

    // Generic attribute decoding
    KEY_NOT_FOUND,
    DUPLICATE_KEY,
    UNSUPPORTED_ATTRIBUTE_TYPE,
    ATTRIBUTE_TYPE_MISMATCH,
    MALFORMED_ATTRIBUTE,

    // Type catalog
    UNRECOGNIZED_NATIVE_TYPE,
    DUPLICATE_TYPE_ID,
    TYPE_NOT_FOUND,

    // Schema graph
    INVALID_COLUMN_TYPE,
    COLUMN_NOT_FOUND,
    DUPLICATE_FOREIGN_KEY_MEMBER,
    INVALID_INDEX,
    TABLE_NOT_FOUND,

    // Synthesis
    INVALID_NUMERIC_SPEC,
    INVALID_DEFAULT_VALUE,
    MULTIPLE_AUTO_INCREMENT,
    MALFORMED_ENUM,
    UNSUPPORTED_FOREIGN_KEY,
    IDENTIFIER_TOO_LONG
}
