package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.codegen.util.IdentifierUtil;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Emulates {@code ON UPDATE CURRENT_TIMESTAMP} with a trigger function per column name,
 * shared across tables, and one {@code BEFORE UPDATE} trigger per table column.
 */
public class TimestampTriggerSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(TimestampTriggerSynthesizer.class);

    static final String FUNCTION_TEMPLATE = "update-timestamp-function.ftl";

    private final Configuration freemarkerConfig;

    public TimestampTriggerSynthesizer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Registers the function for {@code columnName} if not yet known and a trigger on
     * {@code tableName} calling it. Both are held in the context until all tables exist.
     */
    public void synthesize(SynthesisContext ctx, String tableName, String columnName) {
        ConverterConfig config = ctx.getConfig();
        String functionName = IdentifierUtil.timestampFunctionName(columnName);

        if (!ctx.getTimestampFunctions().containsKey(functionName)) {
            ctx.getTimestampFunctions().put(functionName, createFunction(ctx, functionName, columnName));
            log.debug("Created function {}", functionName);
        }

        Element trigger = DbmElements.create(ctx.getDocument(), "trigger",
                "name", IdentifierUtil.timestampTriggerName(tableName, columnName),
                "firing-type", "BEFORE",
                "per-line", "true",
                "constraint", "false",
                "ins-event", "false",
                "del-event", "false",
                "upd-event", "true",
                "trunc-event", "false",
                "table", config.qualify(tableName));
        DbmElements.append(trigger, "function", "signature", config.qualify(functionName) + "()");
        ctx.getTimestampTriggers().add(trigger);
    }

    private Element createFunction(SynthesisContext ctx, String functionName, String columnName) {
        ConverterConfig config = ctx.getConfig();
        Element function = DbmElements.create(ctx.getDocument(), "function",
                "name", functionName,
                "window-func", "false",
                "returns-setof", "false",
                "behavior-type", "CALLED ON NULL INPUT",
                "function-type", "VOLATILE",
                "security-type", "SECURITY INVOKER",
                "execution-cost", "1000",
                "row-amount", "0");
        DbmElements.appendOwnership(function, config.getSchema(), config.getOwner());
        DbmElements.appendText(function, "comment", "ON UPDATE CURRENT TIMESTAMP equivalent for column " + columnName);
        DbmElements.append(function, "language", "name", "plpgsql", "sql-disabled", "true");
        Element returnType = DbmElements.append(function, "return-type");
        DbmElements.append(returnType, "type", "name", "trigger", "length", "0");
        DbmElements.appendCData(function, "definition", renderBody(columnName));
        return function;
    }

    String renderBody(String columnName) {
        try {
            Template template = freemarkerConfig.getTemplate(FUNCTION_TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(Map.of("columnName", columnName), out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Cannot render " + FUNCTION_TEMPLATE + " for column " + columnName, e);
        }
    }
}
