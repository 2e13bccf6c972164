package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.model.Column;
import com.dbmodel.converter.model.ForeignKey;
import com.dbmodel.converter.model.SchemaGraph;
import com.dbmodel.converter.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Replaces foreign keys with one-to-many relationships. Runs once every table exists;
 * identifying relationships are emitted first.
 */
public class RelationshipSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(RelationshipSynthesizer.class);

    public void synthesize(SynthesisContext ctx, SchemaGraph graph) {
        List<ForeignKey> foreignKeys = new ArrayList<>();
        for (Table table : graph.getTables()) {
            foreignKeys.addAll(table.getForeignKeys());
        }
        // List.sort is stable: declaration order is kept within each group
        foreignKeys.sort(Comparator.comparing(ForeignKey::isPrimary).reversed());

        for (ForeignKey fk : foreignKeys) {
            Optional<String> referencedTableId = fk.findReferencedTableId();
            if (referencedTableId.isEmpty()) {
                log.info("Foreign key {} has no referenced table, skipping", fk.getName());
                continue;
            }
            ctx.getRelationships().add(relationship(ctx, graph, fk, referencedTableId.get()));
        }
    }

    private Element relationship(SynthesisContext ctx, SchemaGraph graph, ForeignKey fk, String referencedTableId) {
        ConverterConfig config = ctx.getConfig();

        if (!fk.isMany()) {
            throw new ConversionException(ConversionError.UNSUPPORTED_FOREIGN_KEY,
                    "Foreign key " + fk.getName() + " is not one-to-many");
        }
        Table referenced = graph.findTable(referencedTableId)
                .orElseThrow(() -> new ConversionException(ConversionError.TABLE_NOT_FOUND,
                        "Foreign key " + fk.getName() + " references unknown table " + referencedTableId));
        Table owner = graph.findTable(fk.getTableId())
                .orElseThrow(() -> new ConversionException(ConversionError.TABLE_NOT_FOUND,
                        "Foreign key " + fk.getName() + " belongs to unknown table " + fk.getTableId()));
        if (fk.getColumns().size() != 1) {
            throw new ConversionException(ConversionError.UNSUPPORTED_FOREIGN_KEY,
                    "Foreign key " + owner.getName() + "." + fk.getName() + " has "
                            + fk.getColumns().size() + " columns, only single column keys are supported");
        }
        Column source = fk.getColumns().get(0);

        Element relationship = DbmElements.create(ctx.getDocument(), "relationship",
                "name", fk.getName(),
                "type", "rel1n",
                "layer", "0",
                "src-col-pattern", source.getName(),
                "pk-pattern", "{dt}_pk",
                "uq-pattern", "{dt}_uq",
                "src-fk-pattern", "{st}_fk",
                "src-table", config.qualify(referenced.getName()),
                "dst-table", config.qualify(owner.getName()),
                "src-required", DbmElements.bool(fk.isMandatory() && source.isNotNull()),
                "dst-required", "false",
                "identifier", DbmElements.bool(fk.isPrimary()),
                "upd-action", fk.getUpdateRule(),
                "del-action", fk.getDeleteRule());
        Element label = DbmElements.append(relationship, "label", "ref-type", "name-label");
        DbmElements.append(label, "position", "x", "0", "y", "0");
        return relationship;
    }
}
