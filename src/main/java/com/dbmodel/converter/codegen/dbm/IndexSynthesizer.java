package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.codegen.util.IdentifierUtil;
import com.dbmodel.converter.model.Index;
import com.dbmodel.converter.model.IndexColumn;
import com.dbmodel.converter.model.IndexType;
import com.dbmodel.converter.model.SchemaGraph;
import com.dbmodel.converter.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns source indexes into a primary key constraint on the table and standalone
 * index elements. Index elements are deferred until relationships have added the
 * foreign key columns they may reference.
 */
public class IndexSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(IndexSynthesizer.class);

    public void synthesize(SynthesisContext ctx, SchemaGraph graph, Table table, Element tableElement) {
        ConverterConfig config = ctx.getConfig();
        Set<IndexType> kept = config.isSkipForeignKeyIndexes()
                ? EnumSet.of(IndexType.UNIQUE)
                : EnumSet.of(IndexType.UNIQUE, IndexType.INDEX);

        for (Index index : table.getIndices()) {
            List<IndexColumn> ownColumns = index.getColumns().stream()
                    .filter(c -> !graph.isForeignKeyMember(c.getColumn()))
                    .collect(Collectors.toList());

            // Indexes made only of foreign key columns
            if (ownColumns.isEmpty() && !kept.contains(index.getIndexType())) {
                log.debug("Skipping index {}.{}: foreign key columns only", table.getName(), index.getName());
                continue;
            }

            if (index.getIndexType() == IndexType.PRIMARY) {
                tableElement.appendChild(primaryKey(ctx, table, ownColumns));
            } else {
                ctx.getIndexes().add(index(ctx, table, index));
            }
        }
    }

    private Element primaryKey(SynthesisContext ctx, Table table, List<IndexColumn> columns) {
        Element constraint = DbmElements.create(ctx.getDocument(), "constraint",
                "name", table.getName() + "_pk",
                "type", "pk-constr",
                "table", ctx.getConfig().qualify(table.getName()));
        String names = columns.stream()
                .map(c -> c.getColumn().getName())
                .collect(Collectors.joining(","));
        DbmElements.append(constraint, "columns", "names", names, "ref-type", "src-columns");
        return constraint;
    }

    private Element index(SynthesisContext ctx, Table table, Index index) {
        ConverterConfig config = ctx.getConfig();
        String name = IdentifierUtil.indexName(table.getName(), index.getName(), config.isPrefixIndexNames());

        Element element = DbmElements.create(ctx.getDocument(), "index",
                "name", name,
                "table", config.qualify(table.getName()),
                "concurrent", "false",
                "unique", DbmElements.bool(index.isUnique()),
                "fast-update", "false",
                "buffering", "false",
                "index-type", "btree",
                "factor", "0");
        for (IndexColumn column : index.getColumns()) {
            Element idxElement = DbmElements.append(element, "idxelement",
                    "use-sorting", "true",
                    "nulls-first", "false",
                    "asc-order", DbmElements.bool(!column.isDescend()));
            DbmElements.append(idxElement, "column", "name", column.getColumn().getName());
        }
        return element;
    }
}
