package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.model.SchemaGraph;
import com.dbmodel.converter.model.Table;
import com.dbmodel.converter.xml.XmlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds the destination document from a {@link SchemaGraph}.
 *
 * Emission order: database, schema, extension, layers, unsigned domains, then per table its
 * enumerations, domains and the table itself; after all tables, relationships, indexes,
 * timestamp functions, timestamp triggers and source triggers.
 */
public class DbmModelSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(DbmModelSynthesizer.class);

    private final ConverterConfig config;

    private final LayerSynthesizer layerSynthesizer = new LayerSynthesizer();
    private final DomainSynthesizer domainSynthesizer = new DomainSynthesizer();
    private final RelationshipSynthesizer relationshipSynthesizer = new RelationshipSynthesizer();
    private final TableSynthesizer tableSynthesizer;

    public DbmModelSynthesizer(ConverterConfig config) {
        this.config = config;
        ColumnSynthesizer columnSynthesizer = new ColumnSynthesizer(
                domainSynthesizer, new EnumTypeSynthesizer(), new TimestampTriggerSynthesizer());
        this.tableSynthesizer = new TableSynthesizer(
                columnSynthesizer, new IndexSynthesizer(), new SourceTriggerSynthesizer());
    }

    public SynthesisResult synthesize(SchemaGraph graph) {
        Document document = XmlSupport.newDocument();
        Element root = DbmElements.create(document, "dbmodel",
                "pgmodeler-ver", config.getFormatVersion(),
                "last-position", "0,0",
                "last-zoom", "1",
                "max-obj-count", "4",
                "default-schema", config.getSchema(),
                "default-owner", config.getOwner());
        document.appendChild(root);

        SynthesisContext ctx = new SynthesisContext(config, document, root);

        DbmElements.append(root, "database",
                "name", graph.getSchemaName(),
                "is-template", "false",
                "allow-conns", "true");
        DbmElements.append(root, "schema",
                "name", config.getSchema(),
                "layer", "0",
                "fill-color", "#e1e1e1",
                "sql-disabled", "true");
        if (config.isCitextEnabled()) {
            Element citext = DbmElements.append(root, "extension",
                    "name", "citext",
                    "handles-type", "true");
            DbmElements.append(citext, "schema", "name", config.getSchema());
        }

        layerSynthesizer.synthesize(ctx, graph.getDiagram());
        domainSynthesizer.addUnsignedDomains(ctx);

        if (config.getTriggerConfig() == null && graph.getTables().stream().anyMatch(t -> !t.getTriggers().isEmpty())) {
            String message = "Skipping triggers generation as no trigger config file is provided";
            log.warn(message);
            ctx.getDiagnostics().warn(message);
        }

        for (Table table : graph.getTables()) {
            tableSynthesizer.synthesize(ctx, graph, table);
        }

        relationshipSynthesizer.synthesize(ctx, graph);

        ctx.getRelationships().forEach(root::appendChild);
        ctx.getIndexes().forEach(root::appendChild);
        ctx.getTimestampFunctions().values().forEach(root::appendChild);
        ctx.getTimestampTriggers().forEach(root::appendChild);
        ctx.getSourceTriggers().forEach(root::appendChild);

        log.info("Synthesized {} tables, {} relationships, {} indexes",
                graph.getTables().size(), ctx.getRelationships().size(), ctx.getIndexes().size());
        return new SynthesisResult(document, ctx.toStats(graph.getTables().size()), ctx.getDiagnostics());
    }
}
