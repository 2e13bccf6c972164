package com.dbmodel.converter.parser;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.model.Column;
import com.dbmodel.converter.model.Diagram;
import com.dbmodel.converter.model.Figure;
import com.dbmodel.converter.model.FigureKind;
import com.dbmodel.converter.model.ForeignKey;
import com.dbmodel.converter.model.Index;
import com.dbmodel.converter.model.IndexColumn;
import com.dbmodel.converter.model.IndexType;
import com.dbmodel.converter.model.Layer;
import com.dbmodel.converter.model.SchemaGraph;
import com.dbmodel.converter.model.Table;
import com.dbmodel.converter.model.Trigger;
import com.dbmodel.converter.model.type.DataType;
import com.dbmodel.converter.model.type.TypeCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link SchemaGraph} from a {@code workbench.physical.Model} element.
 *
 * Construction follows structural dependencies: types, then per table its columns,
 * indexes (which link back to columns), foreign keys (which need the index memberships
 * to know whether they are identifying) and triggers; the diagram comes last.
 */
public class SchemaGraphReader {
    private static final Logger log = LoggerFactory.getLogger(SchemaGraphReader.class);

    static final String SCHEMA_STRUCT = "db.mysql.Schema";
    static final String DIAGRAM_STRUCT = "workbench.physical.Diagram";

    private final TypeCatalogBuilder typeCatalogBuilder = new TypeCatalogBuilder();

    private final Map<String, ForeignKey> foreignKeysByColumnId = new LinkedHashMap<>();
    private final Map<String, List<IndexColumn>> indexColumnsByColumnId = new LinkedHashMap<>();

    public SchemaGraph build(Element physicalModel) {
        foreignKeysByColumnId.clear();
        indexColumnsByColumnId.clear();

        Element catalog = XmlElements.findValue(physicalModel, "catalog")
                .orElseThrow(() -> invalid("Physical model has no catalog"));

        Element schema = XmlElements.findValue(catalog, "schemata")
                .flatMap(s -> XmlElements.childrenWithStruct(s, SCHEMA_STRUCT).stream().findFirst())
                .orElseThrow(() -> invalid("Catalog has no " + SCHEMA_STRUCT));
        String schemaName = AttributeReader.read(schema).getRequiredString("name");

        TypeCatalog types = typeCatalogBuilder.build(catalog);

        Element tablesEl = XmlElements.findValue(schema, "tables")
                .orElseThrow(() -> invalid("Schema " + schemaName + " has no tables list"));
        List<Element> tableElements = XmlElements.childElements(tablesEl, "value");
        if (tableElements.isEmpty()) {
            throw invalid("Schema " + schemaName + " declares no tables");
        }

        SchemaGraph.SchemaGraphBuilder graph = SchemaGraph.builder()
                .schemaName(schemaName)
                .types(types);

        for (Element tableElement : tableElements) {
            graph.table(buildTable(tableElement, types));
        }

        graph.diagram(buildDiagram(physicalModel));

        return graph
                .foreignKeysByColumnId(new LinkedHashMap<>(foreignKeysByColumnId))
                .indexColumnsByColumnId(copyMemberships())
                .build();
    }

    private Table buildTable(Element el, TypeCatalog types) {
        ElementAttributes attrs = AttributeReader.read(el);
        String tableName = attrs.getRequiredString("name");

        Table.TableBuilder table = Table.builder()
                .id(attrs.getId())
                .name(tableName)
                .nextAutoInc(attrs.findString("nextAutoInc").orElse(null));

        List<Element> columnElements = children(el, "columns", tableName);
        if (columnElements.isEmpty()) {
            throw invalid("Table " + tableName + " has no columns");
        }
        List<Column> columns = new ArrayList<>();
        for (Element columnElement : columnElements) {
            columns.add(buildColumn(columnElement, types, tableName));
        }
        table.columns(columns);

        for (Element indexElement : children(el, "indices", tableName)) {
            table.index(buildIndex(indexElement, columns, tableName));
        }

        for (Element fkElement : optionalChildren(el, "foreignKeys")) {
            table.foreignKey(buildForeignKey(fkElement, attrs.getId(), columns, tableName));
        }

        for (Element triggerElement : optionalChildren(el, "triggers")) {
            table.trigger(buildTrigger(triggerElement, attrs.getId()));
        }

        return table.build();
    }

    private Column buildColumn(Element el, TypeCatalog types, String tableName) {
        ElementAttributes attrs = AttributeReader.read(el);
        String name = attrs.getRequiredString("name");

        // Every column references exactly one of a user type or a simple type
        Optional<String> userType = linkText(el, "userType");
        Optional<String> simpleType = linkText(el, "simpleType");
        if (userType.isPresent() == simpleType.isPresent()) {
            throw new ConversionException(ConversionError.INVALID_COLUMN_TYPE,
                    "Column " + tableName + "." + name + " must have exactly one of userType/simpleType");
        }
        String typeId = userType.orElseGet(simpleType::get);
        DataType type = types.find(typeId)
                .orElseThrow(() -> new ConversionException(ConversionError.TYPE_NOT_FOUND,
                        "Column " + tableName + "." + name + " references unknown type " + typeId));

        Column.ColumnBuilder column = Column.builder()
                .id(attrs.getId())
                .name(name)
                .type(type)
                .notNull(attrs.getFlag("isNotNull", false))
                .autoIncrement(attrs.getFlag("autoIncrement", false))
                .defaultValue(attrs.findString("defaultValue").orElse(null))
                .defaultValueIsNull(attrs.getFlag("defaultValueIsNull", false))
                .length(attrs.getInt("length", -1))
                .precision(attrs.getInt("precision", -1))
                .scale(attrs.getInt("scale", -1))
                .datatypeExplicitParams(attrs.findString("datatypeExplicitParams").orElse(null))
                .comment(attrs.findString("comment").orElse(null));

        XmlElements.findValue(el, "flags").ifPresent(flags -> {
            for (Element flag : XmlElements.childElements(flags, "value")) {
                String text = XmlElements.text(flag);
                if (text != null) {
                    column.flag(text.trim());
                }
            }
        });

        return column.build();
    }

    private Index buildIndex(Element el, List<Column> tableColumns, String tableName) {
        ElementAttributes attrs = AttributeReader.read(el);
        String name = attrs.getRequiredString("name");
        String rawType = attrs.getRequiredString("indexType");

        IndexType indexType = IndexType.fromName(rawType)
                .orElseThrow(() -> new ConversionException(ConversionError.INVALID_INDEX,
                        "Index " + tableName + "." + name + " has unsupported type " + rawType));
        boolean primary = attrs.getFlag("isPrimary");
        if (primary != (indexType == IndexType.PRIMARY)) {
            throw new ConversionException(ConversionError.INVALID_INDEX,
                    "Index " + tableName + "." + name + " isPrimary=" + primary + " contradicts type " + indexType);
        }

        List<Element> columnElements = children(el, "columns", tableName + "." + name);
        if (columnElements.isEmpty()) {
            throw new ConversionException(ConversionError.INVALID_INDEX,
                    "Index " + tableName + "." + name + " has no columns");
        }

        Index.IndexBuilder index = Index.builder()
                .id(attrs.getId())
                .name(name)
                .indexType(indexType)
                .primary(primary)
                .unique(attrs.getFlag("unique", false));

        for (Element columnElement : columnElements) {
            ElementAttributes colAttrs = AttributeReader.read(columnElement);
            String referenced = colAttrs.getLink("referencedColumn");
            Column column = findColumn(tableColumns, referenced)
                    .orElseThrow(() -> new ConversionException(ConversionError.COLUMN_NOT_FOUND,
                            "Index " + tableName + "." + name + " references unknown column " + referenced));

            IndexColumn indexColumn = IndexColumn.builder()
                    .id(colAttrs.getId())
                    .indexName(name)
                    .indexType(indexType)
                    .column(column)
                    .descend(colAttrs.getFlag("descend", false))
                    .build();
            registerMembership(column, indexColumn);
            index.column(indexColumn);
        }
        return index.build();
    }

    private void registerMembership(Column column, IndexColumn indexColumn) {
        List<IndexColumn> memberships = indexColumnsByColumnId.computeIfAbsent(column.getId(), k -> new ArrayList<>());
        if (memberships.stream().anyMatch(m -> m == indexColumn)) {
            throw new IllegalStateException("Index column registered twice on " + column.getName());
        }
        memberships.add(indexColumn);
    }

    private ForeignKey buildForeignKey(Element el, String tableId, List<Column> tableColumns, String tableName) {
        ElementAttributes attrs = AttributeReader.read(el);
        String name = attrs.getRequiredString("name");

        ForeignKey.ForeignKeyBuilder fk = ForeignKey.builder()
                .id(attrs.getId())
                .name(name)
                .tableId(tableId)
                .referencedTableId(attrs.findLink("referencedTable").orElse(null))
                .many(attrs.getFlag("many", true))
                .mandatory(attrs.getFlag("mandatory", false))
                .updateRule(attrs.findString("updateRule").orElse("NO ACTION"))
                .deleteRule(attrs.findString("deleteRule").orElse("NO ACTION"));

        List<Column> members = new ArrayList<>();
        boolean primary = false;
        for (Element link : optionalChildren(el, "columns")) {
            String columnId = XmlElements.text(link);
            Column column = findColumn(tableColumns, columnId)
                    .orElseThrow(() -> new ConversionException(ConversionError.COLUMN_NOT_FOUND,
                            "Foreign key " + tableName + "." + name + " references unknown column " + columnId));
            members.add(column);

            primary |= indexColumnsByColumnId.getOrDefault(column.getId(), List.of()).stream()
                    .anyMatch(m -> m.getIndexType() == IndexType.PRIMARY);
        }

        ForeignKey built = fk.columns(members).primary(primary).build();
        for (Column column : members) {
            ForeignKey previous = foreignKeysByColumnId.putIfAbsent(column.getId(), built);
            if (previous != null) {
                throw new ConversionException(ConversionError.DUPLICATE_FOREIGN_KEY_MEMBER,
                        "Column " + tableName + "." + column.getName() + " belongs to foreign keys "
                                + previous.getName() + " and " + name);
            }
        }
        return built;
    }

    private Trigger buildTrigger(Element el, String tableId) {
        ElementAttributes attrs = AttributeReader.read(el);
        return Trigger.builder()
                .id(attrs.getId())
                .tableId(tableId)
                .name(attrs.getRequiredString("name"))
                .timing(attrs.getRequiredString("timing"))
                .event(attrs.getRequiredString("event"))
                .build();
    }

    private Diagram buildDiagram(Element physicalModel) {
        List<Element> diagrams = XmlElements.findValue(physicalModel, "diagrams")
                .map(d -> XmlElements.childElements(d, "value"))
                .orElse(List.of());
        if (diagrams.isEmpty()) {
            throw invalid("Physical model has no diagrams");
        }
        for (Element diagram : diagrams) {
            if (!DIAGRAM_STRUCT.equals(diagram.getAttribute("struct-name"))) {
                throw invalid("Unexpected diagram struct " + diagram.getAttribute("struct-name"));
            }
        }

        Element el = diagrams.get(0);
        ElementAttributes attrs = AttributeReader.read(el);
        String name = attrs.findString("name").orElse("");
        if (diagrams.size() > 1) {
            log.info("Model has {} diagrams, using the first one", diagrams.size());
        }
        log.info("Using diagram \"{}\"", name);

        XmlElements.findValue(el, "connections")
                .orElseThrow(() -> invalid("Diagram " + name + " has no connections list"));
        Element figures = XmlElements.findValue(el, "figures")
                .orElseThrow(() -> invalid("Diagram " + name + " has no figures list"));
        Element layers = XmlElements.findValue(el, "layers")
                .orElseThrow(() -> invalid("Diagram " + name + " has no layers list"));

        Diagram.DiagramBuilder diagram = Diagram.builder()
                .id(attrs.getId())
                .name(name);

        for (Element figureElement : XmlElements.childElements(figures, "value")) {
            ElementAttributes fa = AttributeReader.read(figureElement);
            FigureKind kind = FigureKind.fromStructName(fa.getStructName());
            diagram.figure(Figure.builder()
                    .id(fa.getId())
                    .kind(kind)
                    .tableId(kind == FigureKind.TABLE ? fa.findLink("table").orElse(null) : null)
                    .viewId(kind == FigureKind.VIEW ? fa.findLink("view").orElse(null) : null)
                    .layerId(fa.findLink("layer").orElse(null))
                    .left(fa.getReal("left", 0))
                    .top(fa.getReal("top", 0))
                    .color(fa.findString("color").orElse(null))
                    .build());
        }

        for (Element layerElement : XmlElements.childElements(layers, "value")) {
            ElementAttributes la = AttributeReader.read(layerElement);
            diagram.layer(Layer.builder()
                    .id(la.getId())
                    .name(la.getRequiredString("name"))
                    .left(la.getReal("left", 0))
                    .top(la.getReal("top", 0))
                    .color(la.findString("color").orElse(null))
                    .build());
        }

        return diagram.build();
    }

    private Map<String, List<IndexColumn>> copyMemberships() {
        Map<String, List<IndexColumn>> copy = new LinkedHashMap<>();
        indexColumnsByColumnId.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return copy;
    }

    private static Optional<Column> findColumn(List<Column> columns, String id) {
        return columns.stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    private static Optional<String> linkText(Element el, String key) {
        return XmlElements.findLink(el, key).map(XmlElements::text);
    }

    private static List<Element> children(Element el, String key, String owner) {
        Element list = XmlElements.findValue(el, key)
                .orElseThrow(() -> invalid(owner + " has no '" + key + "' list"));
        return XmlElements.childElements(list);
    }

    private static List<Element> optionalChildren(Element el, String key) {
        return XmlElements.findValue(el, key)
                .map(XmlElements::childElements)
                .orElse(List.of());
    }

    private static ConversionException invalid(String message) {
        return new ConversionException(ConversionError.INVALID_DOCUMENT, message);
    }
}
