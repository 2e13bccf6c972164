package com.dbmodel.converter;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.model.Column;
import com.dbmodel.converter.model.Diagram;
import com.dbmodel.converter.model.ForeignKey;
import com.dbmodel.converter.model.Index;
import com.dbmodel.converter.model.IndexColumn;
import com.dbmodel.converter.model.IndexType;
import com.dbmodel.converter.model.SchemaGraph;
import com.dbmodel.converter.model.Table;
import com.dbmodel.converter.model.type.SimpleType;
import com.dbmodel.converter.model.type.TypeCatalog;
import com.dbmodel.converter.model.type.UserType;
import com.dbmodel.converter.xml.XmlSupport;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builders for in-memory schema models used by synthesis tests.
 */
public final class SchemaFixtures {

    public static final String NATIVE_PREFIX = "com.mysql.rdbms.mysql.datatype.";

    private static final AtomicInteger IDS = new AtomicInteger();

    private SchemaFixtures() {
    }

    public static SimpleType type(String category) {
        return TypeCatalog.simpleTypeOf(NATIVE_PREFIX + category.toLowerCase(Locale.ROOT));
    }

    public static UserType userType(String name, String category) {
        return UserType.builder()
                .id("ut-" + name)
                .name(name)
                .actualType(type(category))
                .build();
    }

    /**
     * Column with unset length, precision and scale and a unique id.
     */
    public static Column.ColumnBuilder column(String name, String category) {
        return Column.builder()
                .id("c-" + name + "-" + IDS.incrementAndGet())
                .name(name)
                .type(type(category))
                .length(-1)
                .precision(-1)
                .scale(-1);
    }

    public static Index index(String name, IndexType type, Column... columns) {
        Index.IndexBuilder index = Index.builder()
                .id("i-" + name + "-" + IDS.incrementAndGet())
                .name(name)
                .indexType(type)
                .primary(type == IndexType.PRIMARY)
                .unique(type == IndexType.UNIQUE);
        for (Column column : columns) {
            index.column(IndexColumn.builder()
                    .id("ic-" + IDS.incrementAndGet())
                    .indexName(name)
                    .indexType(type)
                    .column(column)
                    .build());
        }
        return index.build();
    }

    public static ForeignKey.ForeignKeyBuilder foreignKey(String name, String tableId, String referencedTableId,
                                                          Column column) {
        return ForeignKey.builder()
                .id("fk-" + name)
                .name(name)
                .tableId(tableId)
                .referencedTableId(referencedTableId)
                .many(true)
                .mandatory(true)
                .updateRule("CASCADE")
                .deleteRule("RESTRICT")
                .column(column);
    }

    public static Diagram emptyDiagram() {
        return Diagram.builder().id("d-1").name("EER Diagram").build();
    }

    /**
     * Graph over {@code tables} with the column lookups derived from their keys.
     */
    public static SchemaGraph graph(Diagram diagram, Table... tables) {
        Map<String, ForeignKey> foreignKeys = new LinkedHashMap<>();
        Map<String, List<IndexColumn>> memberships = new LinkedHashMap<>();
        for (Table table : tables) {
            for (ForeignKey fk : table.getForeignKeys()) {
                fk.getColumns().forEach(c -> foreignKeys.put(c.getId(), fk));
            }
            for (Index index : table.getIndices()) {
                index.getColumns().forEach(ic ->
                        memberships.computeIfAbsent(ic.getColumn().getId(), k -> new ArrayList<>()).add(ic));
            }
        }
        return SchemaGraph.builder()
                .schemaName("shop")
                .types(new TypeCatalog())
                .tables(List.of(tables))
                .diagram(diagram)
                .foreignKeysByColumnId(foreignKeys)
                .indexColumnsByColumnId(memberships)
                .build();
    }

    public static ConverterConfig.ConverterConfigBuilder config() {
        return ConverterConfig.builder().sourcePath(Path.of("model.mwb"));
    }

    public static SynthesisContext context(ConverterConfig config) {
        Document document = XmlSupport.newDocument();
        Element root = document.createElement("dbmodel");
        document.appendChild(root);
        return new SynthesisContext(config, document, root);
    }

    public static SynthesisContext context() {
        return context(config().build());
    }
}
