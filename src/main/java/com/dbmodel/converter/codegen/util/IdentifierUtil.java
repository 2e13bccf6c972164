package com.dbmodel.converter.codegen.util;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;

/**
 * Naming rules for destination identifiers.
 */
public class IdentifierUtil {

    /** PostgreSQL NAMEDATALEN - 1. */
    public static final int MAX_NAME_LENGTH = 63;

    public static final String INDEX_SUFFIX = "_idx";

    private IdentifierUtil() {
        // Utility class
    }

    /**
     * Index name unique across the schema: prefixed with the table name when requested and
     * not already contained, then truncated to {@link #MAX_NAME_LENGTH} keeping the
     * {@code _idx} suffix. Overlong names without that suffix are rejected.
     */
    public static String indexName(String tableName, String indexName, boolean prefixWithTable) {
        String prefix = prefixWithTable && !indexName.contains(tableName) ? tableName + "_" : "";
        return fitIndexName(prefix + indexName);
    }

    public static String fitIndexName(String name) {
        if (name.length() <= MAX_NAME_LENGTH) {
            return name;
        }
        if (!name.endsWith(INDEX_SUFFIX)) {
            throw new ConversionException(ConversionError.IDENTIFIER_TOO_LONG,
                    "Index name longer than " + MAX_NAME_LENGTH + " characters: " + name);
        }
        return name.substring(0, MAX_NAME_LENGTH - INDEX_SUFFIX.length()) + INDEX_SUFFIX;
    }

    /**
     * Enumeration type name for a column; {@code ordinal} disambiguates repeated names.
     */
    public static String enumTypeName(String columnName, int ordinal) {
        return ordinal <= 0 ? "enum_" + columnName : "enum_" + ordinal + "_" + columnName;
    }

    public static String timestampFunctionName(String columnName) {
        return "update_" + columnName + "_on_update";
    }

    public static String timestampTriggerName(String tableName, String columnName) {
        return tableName + "_t_update_" + columnName;
    }

    public static String constraintName(String tableName, String columnName, String suffix) {
        return tableName + "_" + columnName + "_" + suffix;
    }
}
