package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.mapping.TriggerConfig;
import com.dbmodel.converter.model.Table;
import com.dbmodel.converter.model.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.Locale;
import java.util.Optional;

/**
 * Recreates source triggers as destination triggers calling hand-written functions.
 * The function for each trigger comes from the trigger configuration; triggers without
 * an entry are skipped.
 */
public class SourceTriggerSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(SourceTriggerSynthesizer.class);

    public void synthesize(SynthesisContext ctx, Table table) {
        ConverterConfig config = ctx.getConfig();
        TriggerConfig triggerConfig = config.getTriggerConfig();
        if (triggerConfig == null) {
            return;
        }

        for (Trigger trigger : table.getTriggers()) {
            Optional<String> signature = triggerConfig.getFunctionForTrigger(trigger.getName());
            if (signature.isEmpty()) {
                String message = "Trigger " + trigger.getName() + " not present in trigger config: skipping";
                log.warn(message);
                ctx.getDiagnostics().warn(message);
                continue;
            }

            String event = trigger.getEvent().toUpperCase(Locale.ROOT);
            Element element = DbmElements.create(ctx.getDocument(), "trigger",
                    "name", trigger.getName(),
                    "firing-type", trigger.getTiming().toUpperCase(Locale.ROOT),
                    "per-line", "true",
                    "constraint", "false",
                    "ins-event", DbmElements.bool("INSERT".equals(event)),
                    "del-event", DbmElements.bool("DELETE".equals(event)),
                    "upd-event", DbmElements.bool("UPDATE".equals(event)),
                    "trunc-event", "false",
                    "table", config.qualify(table.getName()));
            DbmElements.append(element, "function", "signature", signature.get());
            ctx.getSourceTriggers().add(element);
        }
    }
}
