package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.codegen.mapper.WorkbenchToPostgresTypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Creates the check-constrained domains standing in for unsigned integers and for
 * integers with a display precision. Domains are memoized by name per run.
 */
public class DomainSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(DomainSynthesizer.class);

    static final String UNSIGNED_PREFIX = "u";

    /**
     * Emits {@code usmallint}, {@code uinteger} and {@code ubigint}.
     */
    public void addUnsignedDomains(SynthesisContext ctx) {
        for (String base : List.of("smallint", "integer", "bigint")) {
            String name = UNSIGNED_PREFIX + base;
            ctx.getDomainNames().add(name);
            appendDomain(ctx, name, base, "ge0", "VALUE >= 0");
        }
    }

    /**
     * Name of the unsigned domain for an integer type, e.g. {@code uinteger}.
     */
    public String unsignedDomainFor(String integerType) {
        if (!WorkbenchToPostgresTypeMapper.isIntegerType(integerType)) {
            throw new IllegalArgumentException("Not an integer type: " + integerType);
        }
        return UNSIGNED_PREFIX + integerType;
    }

    /**
     * Returns the domain limiting {@code baseType} to {@code precision} digits, creating it
     * on first use. The check is {@code minVal <= VALUE <= maxVal}, with {@code maxVal}
     * {@code precision} nines and {@code minVal} 0 or {@code -maxVal}.
     */
    public String ensurePrecisionDomain(SynthesisContext ctx, String baseType, long precision, boolean unsigned) {
        String name = (unsigned ? UNSIGNED_PREFIX : "") + baseType + precision;
        if (ctx.getDomainNames().add(name)) {
            String maxVal = "9".repeat((int) precision);
            String minVal = unsigned ? "0" : "-" + maxVal;
            appendDomain(ctx, name, baseType, "range" + precision,
                    "VALUE >= " + minVal + " AND VALUE <= " + maxVal);
            log.debug("Created domain {} for {}({})", name, baseType, precision);
        }
        return name;
    }

    private void appendDomain(SynthesisContext ctx, String name, String baseType,
                              String constraintName, String expression) {
        ConverterConfig config = ctx.getConfig();
        Element domain = DbmElements.append(ctx.getRoot(), "domain",
                "name", name,
                "not-null", "false");
        DbmElements.appendOwnership(domain, config.getSchema(), config.getOwner());
        DbmElements.append(domain, "type", "name", baseType, "length", "0");
        Element constraint = DbmElements.append(domain, "constraint",
                "name", constraintName,
                "type", "check");
        DbmElements.appendText(constraint, "expression", expression);
    }
}
