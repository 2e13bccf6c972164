package com.dbmodel.converter.codegen.mapper;

import com.dbmodel.converter.model.type.DataType;

import java.util.Locale;
import java.util.Set;

import lombok.experimental.UtilityClass;

@UtilityClass
public class WorkbenchToPostgresTypeMapper {

    public static final Set<String> INTEGER_TYPES = Set.of("smallint", "integer", "bigint");

    /** User type names that turn a TINYINT into a boolean. */
    public static final Set<String> BOOLEAN_ALIASES = Set.of("UBOOL", "BOOLEAN", "BOOL");

    public static final String FALLBACK_TYPE = "smallint";

    /**
     * Map a resolved source type to its destination type.
     */
    public MappedType map(DataType type) {
        String category = type.getCategory();
        return switch (category) {
            case "SMALLINT", "JSON", "DECIMAL", "VARCHAR", "BIGINT", "DATE", "CHAR" ->
                    named(category.toLowerCase(Locale.ROOT));
            case "INT" -> named("integer");
            case "TINYINT" -> named(isBooleanAlias(type) ? "boolean" : "smallint");
            case "FLOAT" -> named("real");
            case "DOUBLE" -> named("double precision");
            case "TIMESTAMP", "DATETIME", "TIMESTAMP_F", "DATETIME_F" ->
                    MappedType.builder().name("timestamp with time zone").withTimezone(true).build();
            case "TIME" -> MappedType.builder().name("time with time zone").withTimezone(true).build();
            case "TINYTEXT" -> MappedType.builder().name("varchar").forcedLength(255).build();
            case "TEXT" -> MappedType.builder().name("varchar").forcedLength(65535).build();
            case "MEDIUMTEXT", "LONGTEXT" -> named("text");
            case "ENUM" -> MappedType.builder().name(null).enumeration(true).build();
            default -> MappedType.builder().name(FALLBACK_TYPE).fallback(true).build();
        };
    }

    public boolean isIntegerType(String destinationType) {
        return INTEGER_TYPES.contains(destinationType);
    }

    private boolean isBooleanAlias(DataType type) {
        return type.getKind() == DataType.Kind.USER
                && type.getSymbolicName().map(BOOLEAN_ALIASES::contains).orElse(false);
    }

    private MappedType named(String name) {
        return MappedType.builder().name(name).build();
    }
}
