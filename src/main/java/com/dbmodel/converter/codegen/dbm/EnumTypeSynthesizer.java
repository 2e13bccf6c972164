package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.codegen.util.IdentifierUtil;
import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.model.Column;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Materializes ENUM columns as named enumeration types.
 */
public class EnumTypeSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(EnumTypeSynthesizer.class);

    /**
     * Appends the enumeration type for {@code column} and returns its unqualified name.
     */
    public String synthesize(SynthesisContext ctx, String tableName, Column column) {
        String name = uniqueName(ctx, column.getName());
        List<String> values = parseValues(tableName, column);

        ConverterConfig config = ctx.getConfig();
        Element userType = DbmElements.append(ctx.getRoot(), "usertype",
                "name", name,
                "configuration", "enumeration");
        DbmElements.appendOwnership(userType, config.getSchema(), config.getOwner());
        DbmElements.append(userType, "enumeration", "values", String.join(",", values));

        log.debug("Created enumeration {} with values {}", name, values);
        return name;
    }

    String uniqueName(SynthesisContext ctx, String columnName) {
        String name = IdentifierUtil.enumTypeName(columnName, 0);
        int ordinal = ctx.getEnumNames().size() + 1;
        while (ctx.getEnumNames().contains(name)) {
            name = IdentifierUtil.enumTypeName(columnName, ordinal++);
        }
        ctx.getEnumNames().add(name);
        return name;
    }

    /**
     * Parses {@code ('a','b','c')}.
     */
    static List<String> parseValues(String tableName, Column column) {
        String params = column.getDatatypeExplicitParams() == null ? "" : column.getDatatypeExplicitParams().trim();
        if (!params.startsWith("(") || !params.endsWith(")") || params.length() < 2) {
            throw malformed(tableName, column, params);
        }

        List<String> values = new ArrayList<>();
        for (String element : params.substring(1, params.length() - 1).split(",", -1)) {
            String e = element.trim();
            if (e.length() < 2 || !e.startsWith("'") || !e.endsWith("'")) {
                throw malformed(tableName, column, params);
            }
            values.add(e.substring(1, e.length() - 1).trim());
        }
        return values;
    }

    private static ConversionException malformed(String tableName, Column column, String params) {
        return new ConversionException(ConversionError.MALFORMED_ENUM,
                "Column " + tableName + "." + column.getName() + " has malformed enum values: " + params);
    }
}
