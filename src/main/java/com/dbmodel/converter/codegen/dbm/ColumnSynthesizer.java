package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.codegen.mapper.MappedType;
import com.dbmodel.converter.codegen.mapper.WorkbenchToPostgresTypeMapper;
import com.dbmodel.converter.codegen.util.IdentifierUtil;
import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.model.Column;
import com.dbmodel.converter.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Emits one destination {@code column} element for a non foreign key source column.
 *
 * Steps, in order: base type, not-null and identity, default value, length/precision/scale,
 * flags, then the citext rewrite. Check constraints produced on the way are collected in
 * {@code constraints}; the caller appends them after the table's columns.
 */
public class ColumnSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(ColumnSynthesizer.class);

    static final String UNSIGNED = "UNSIGNED";
    static final String ON_UPDATE_DEFAULT = "CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP";
    static final String CURRENT_TIMESTAMP = "CURRENT_TIMESTAMP";
    static final Set<String> VERBATIM_DEFAULTS = Set.of("TRUE", "FALSE", CURRENT_TIMESTAMP);

    private final DomainSynthesizer domainSynthesizer;
    private final EnumTypeSynthesizer enumTypeSynthesizer;
    private final TimestampTriggerSynthesizer timestampTriggerSynthesizer;

    public ColumnSynthesizer(DomainSynthesizer domainSynthesizer,
                             EnumTypeSynthesizer enumTypeSynthesizer,
                             TimestampTriggerSynthesizer timestampTriggerSynthesizer) {
        this.domainSynthesizer = domainSynthesizer;
        this.enumTypeSynthesizer = enumTypeSynthesizer;
        this.timestampTriggerSynthesizer = timestampTriggerSynthesizer;
    }

    public Element synthesize(SynthesisContext ctx, Table table, Column column,
                              Element tableElement, List<Element> constraints) {
        ConverterConfig config = ctx.getConfig();
        String tableName = table.getName();
        String columnName = column.getName();

        Element columnElement = DbmElements.append(tableElement, "column", "name", columnName);

        // Insertion order is the attribute order of the type element
        Map<String, String> typeAttrs = new LinkedHashMap<>();
        typeAttrs.put("length", "0");

        String type = resolveBaseType(ctx, table, column, typeAttrs);

        if (column.isNotNull()) {
            columnElement.setAttribute("not-null", "true");
        }

        if (column.isAutoIncrement() && WorkbenchToPostgresTypeMapper.isIntegerType(type)) {
            columnElement.setAttribute("identity-type", "ALWAYS");
            table.findNextAutoInc().ifPresent(start -> columnElement.setAttribute("start", start));
        }

        applyDefaultValue(ctx, table, column, type, columnElement);

        List<String> flags = new ArrayList<>(column.getFlags());
        type = applyNumericSpec(ctx, table, column, type, flags, typeAttrs);
        type = applyFlags(ctx, table, column, type, flags, constraints);

        if (config.isCitextEnabled() && ("varchar".equals(type) || "char".equals(type))) {
            String operator = "char".equals(type) ? "=" : "<=";
            constraints.add(checkConstraint(ctx, tableName,
                    IdentifierUtil.constraintName(tableName, columnName, "len"),
                    "length(" + columnName + ") " + operator + " " + typeAttrs.get("length")));
            type = "citext";
            typeAttrs.remove("length");
        }

        Element typeElement = DbmElements.append(columnElement, "type", "name", type);
        typeAttrs.forEach(typeElement::setAttribute);

        if (column.hasComment()) {
            DbmElements.appendText(columnElement, "comment", column.getComment());
        }

        ctx.countColumn();
        return columnElement;
    }

    private String resolveBaseType(SynthesisContext ctx, Table table, Column column, Map<String, String> typeAttrs) {
        MappedType mapped = WorkbenchToPostgresTypeMapper.map(column.getType());

        if (mapped.isEnumeration()) {
            String enumName = enumTypeSynthesizer.synthesize(ctx, table.getName(), column);
            return ctx.getConfig().qualify(enumName);
        }
        if (mapped.isFallback()) {
            degraded(ctx, "Unknown type " + column.getType().getCategory() + " for column "
                    + qualified(table, column) + ", using " + mapped.getName());
        }
        if (mapped.isWithTimezone()) {
            typeAttrs.put("with-timezone", "true");
        }
        if (mapped.getForcedLength() != null) {
            typeAttrs.put("length", String.valueOf(mapped.getForcedLength()));
        }
        return mapped.getName();
    }

    private void applyDefaultValue(SynthesisContext ctx, Table table, Column column,
                                   String type, Element columnElement) {
        if (!column.hasDefaultValue()) {
            if (column.isDefaultValueIsNull()) {
                degraded(ctx, "Unsupported NULL default value on column " + qualified(table, column));
            }
            return;
        }
        if (column.isDefaultValueIsNull()) {
            throw new ConversionException(ConversionError.INVALID_DEFAULT_VALUE,
                    "Column " + qualified(table, column) + " has default value " + column.getDefaultValue()
                            + " but is also flagged as defaulting to NULL");
        }

        String value = column.getDefaultValue();
        if ("1".equals(value) || "0".equals(value)) {
            if ("boolean".equals(type)) {
                value = "1".equals(value) ? "TRUE" : "FALSE";
            }
        } else if (ON_UPDATE_DEFAULT.equals(value)) {
            value = CURRENT_TIMESTAMP;
            timestampTriggerSynthesizer.synthesize(ctx, table.getName(), column.getName());
        } else if (!VERBATIM_DEFAULTS.contains(value) && !isQuotedLiteral(value)) {
            degraded(ctx, "Unknown default value " + value + " on column " + qualified(table, column));
        }
        columnElement.setAttribute("default-value", value);
    }

    private String applyNumericSpec(SynthesisContext ctx, Table table, Column column, String type,
                                    List<String> flags, Map<String, String> typeAttrs) {
        long length = column.getLength();
        long precision = column.getPrecision();
        long scale = column.getScale();

        if (length > 0) {
            if (precision >= 0 || scale >= 0 || !"0".equals(typeAttrs.get("length"))) {
                throw invalidNumericSpec(table, column);
            }
            typeAttrs.put("length", String.valueOf(length));
        } else if (precision > 0) {
            if (length >= 0) {
                throw invalidNumericSpec(table, column);
            }
            if (scale < 0) {
                // No fixed-precision integers in the destination: constrain through a domain
                boolean unsigned = flags.remove(UNSIGNED);
                String domain = domainSynthesizer.ensurePrecisionDomain(ctx, type, precision, unsigned);
                return ctx.getConfig().qualify(domain);
            }
            if (!"0".equals(typeAttrs.get("length"))) {
                throw invalidNumericSpec(table, column);
            }
            typeAttrs.put("length", String.valueOf(precision));
            typeAttrs.put("precision", String.valueOf(scale));
        } else if (scale > 0) {
            throw invalidNumericSpec(table, column);
        }
        return type;
    }

    private String applyFlags(SynthesisContext ctx, Table table, Column column, String type,
                              List<String> flags, List<Element> constraints) {
        String result = type;
        for (String flag : flags) {
            if (!UNSIGNED.equals(flag)) {
                degraded(ctx, "Unsupported flag " + flag + " on column " + qualified(table, column));
                continue;
            }

            if (WorkbenchToPostgresTypeMapper.isIntegerType(result)) {
                if (column.isAutoIncrement()) {
                    String message = "Unsupported domain in identity column " + qualified(table, column);
                    log.info(message);
                    ctx.getDiagnostics().info(message);
                } else {
                    result = ctx.getConfig().qualify(domainSynthesizer.unsignedDomainFor(result));
                }
            } else {
                constraints.add(checkConstraint(ctx, table.getName(),
                        IdentifierUtil.constraintName(table.getName(), column.getName(), "ge0"),
                        column.getName() + " >= 0"));
            }
        }
        return result;
    }

    private Element checkConstraint(SynthesisContext ctx, String tableName, String name, String expression) {
        Element constraint = DbmElements.create(ctx.getDocument(), "constraint",
                "name", name,
                "type", "ck-constr",
                "table", ctx.getConfig().qualify(tableName));
        DbmElements.appendText(constraint, "expression", expression);
        return constraint;
    }

    private void degraded(SynthesisContext ctx, String message) {
        log.warn(message);
        ctx.getDiagnostics().warn(message);
    }

    private static ConversionException invalidNumericSpec(Table table, Column column) {
        return new ConversionException(ConversionError.INVALID_NUMERIC_SPEC,
                "Column " + qualified(table, column) + " has contradictory length=" + column.getLength()
                        + " precision=" + column.getPrecision() + " scale=" + column.getScale());
    }

    private static boolean isQuotedLiteral(String value) {
        return value.length() >= 2 && value.startsWith("'") && value.endsWith("'");
    }

    private static String qualified(Table table, Column column) {
        return table.getName() + "." + column.getName();
    }
}
