package com.dbmodel.converter.codegen.mapper;

import lombok.Builder;
import lombok.Value;

/**
 * Destination type chosen for a source column category.
 */
@Value
@Builder(toBuilder = true)
public class MappedType {
    String name;

    /**
     * Forced length, or null to keep the column's own length.
     */
    Integer forcedLength;

    boolean withTimezone;

    /**
     * The column needs a synthesized enumeration type; {@code name} is not usable as is.
     */
    boolean enumeration;

    /**
     * The source category is unknown and {@code name} is a fallback.
     */
    boolean fallback;
}
