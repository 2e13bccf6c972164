package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.ConverterConfig;
import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.model.Column;
import com.dbmodel.converter.model.Diagram;
import com.dbmodel.converter.model.Figure;
import com.dbmodel.converter.model.Layer;
import com.dbmodel.converter.model.SchemaGraph;
import com.dbmodel.converter.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Emits one destination table: placement, columns, column check constraints, primary key
 * and the custom column order that keeps foreign key columns at their source position.
 *
 * The table element is appended to the root only after its columns, so enumerations and
 * domains created for them precede it.
 */
public class TableSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(TableSynthesizer.class);

    private final ColumnSynthesizer columnSynthesizer;
    private final IndexSynthesizer indexSynthesizer;
    private final SourceTriggerSynthesizer sourceTriggerSynthesizer;

    public TableSynthesizer(ColumnSynthesizer columnSynthesizer,
                            IndexSynthesizer indexSynthesizer,
                            SourceTriggerSynthesizer sourceTriggerSynthesizer) {
        this.columnSynthesizer = columnSynthesizer;
        this.indexSynthesizer = indexSynthesizer;
        this.sourceTriggerSynthesizer = sourceTriggerSynthesizer;
    }

    public Element synthesize(SynthesisContext ctx, SchemaGraph graph, Table table) {
        ConverterConfig config = ctx.getConfig();

        Element tableElement = DbmElements.create(ctx.getDocument(), "table",
                "name", table.getName(),
                "layer", "0",
                "collapse-mode", "2",
                "max-obj-count", "0");
        DbmElements.appendOwnership(tableElement, config.getSchema(), config.getOwner());
        appendPlacement(ctx, graph.getDiagram(), table, tableElement);

        List<Element> constraints = new ArrayList<>();
        Map<Integer, String> customOrder = new LinkedHashMap<>();
        Column autoIncrement = null;

        List<Column> columns = table.getColumns();
        for (int position = 0; position < columns.size(); position++) {
            Column column = columns.get(position);

            // Regenerated by the relationship
            if (graph.isForeignKeyMember(column)) {
                customOrder.put(position, column.getName());
                continue;
            }

            if (column.isAutoIncrement()) {
                if (autoIncrement != null) {
                    throw new ConversionException(ConversionError.MULTIPLE_AUTO_INCREMENT,
                            "Table " + table.getName() + " has more than one auto-increment column: "
                                    + autoIncrement.getName() + ", " + column.getName());
                }
                autoIncrement = column;
            }

            columnSynthesizer.synthesize(ctx, table, column, tableElement, constraints);
        }

        constraints.forEach(tableElement::appendChild);
        ctx.getRoot().appendChild(tableElement);

        indexSynthesizer.synthesize(ctx, graph, table, tableElement);
        appendCustomOrder(tableElement, customOrder);
        sourceTriggerSynthesizer.synthesize(ctx, table);

        log.debug("Converted table {}", table.getName());
        return tableElement;
    }

    private void appendPlacement(SynthesisContext ctx, Diagram diagram, Table table, Element tableElement) {
        ConverterConfig config = ctx.getConfig();
        Optional<Figure> figure = diagram.findTableFigure(table);
        if (figure.isEmpty()) {
            String message = "Table " + table.getName() + " has no figure on diagram " + diagram.getName()
                    + ", placing it at the origin";
            log.warn(message);
            ctx.getDiagnostics().warn(message);
            DbmElements.append(tableElement, "position", "x", "0", "y", "0");
            return;
        }

        Optional<Layer> layer = diagram.findLayer(figure.get());
        layer.ifPresent(l -> DbmElements.append(tableElement, "tag", "name", LayerSynthesizer.tagName(l)));

        double left = figure.get().getLeft() + layer.map(Layer::getLeft).orElse(0.0);
        double top = figure.get().getTop() + layer.map(Layer::getTop).orElse(0.0);
        DbmElements.append(tableElement, "position",
                "x", String.valueOf((int) (left * config.getPositionScaleX())),
                "y", String.valueOf((int) (top * config.getPositionScaleY())));
    }

    private void appendCustomOrder(Element tableElement, Map<Integer, String> customOrder) {
        if (customOrder.isEmpty()) {
            return;
        }
        Element customIdxs = DbmElements.append(tableElement, "customidxs", "object-type", "column");
        customOrder.forEach((position, name) ->
                DbmElements.append(customIdxs, "object", "name", name, "index", String.valueOf(position)));
    }
}
