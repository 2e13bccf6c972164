package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.model.Color;
import com.dbmodel.converter.model.Diagram;
import com.dbmodel.converter.model.Figure;
import com.dbmodel.converter.model.Layer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.Locale;
import java.util.Optional;

/**
 * Diagram layers become a text box with the layer name and a tag that tables on the
 * layer reference. The tag's title colors come from the first table figure on the layer.
 */
public class LayerSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(LayerSynthesizer.class);

    static final int TITLE_SHADE_DELTA = -40;
    static final String BODY_COLORS = "#fcfcfc,#fcfcfc,#808080";
    static final String NAME_COLORS = "#000000";

    public void synthesize(SynthesisContext ctx, Diagram diagram) {
        for (Layer layer : diagram.getLayers()) {
            appendTextBox(ctx, layer);
            appendTag(ctx, layer, layerColor(diagram, layer));
        }
    }

    public static String tagName(Layer layer) {
        return layer.getName().toLowerCase(Locale.ROOT);
    }

    private Color layerColor(Diagram diagram, Layer layer) {
        Optional<Figure> first = diagram.findFirstTableFigure(layer);
        if (first.isPresent() && first.get().getColor() != null) {
            return Color.parse(first.get().getColor());
        }
        log.debug("Layer {} holds no colored table figure, using the layer color", layer.getName());
        return Color.parse(layer.getColor());
    }

    private void appendTextBox(SynthesisContext ctx, Layer layer) {
        Element textBox = DbmElements.append(ctx.getRoot(), "textbox",
                "name", layer.getName(),
                "layer", "0",
                "font-size", "9");
        DbmElements.append(textBox, "position",
                "x", String.valueOf((int) (layer.getLeft() * ctx.getConfig().getPositionScaleX())),
                "y", String.valueOf((int) (layer.getTop() * ctx.getConfig().getPositionScaleY())));
        DbmElements.appendText(textBox, "comment", layer.getName());
    }

    private void appendTag(SynthesisContext ctx, Layer layer, Color color) {
        Element tag = DbmElements.append(ctx.getRoot(), "tag", "name", tagName(layer));
        DbmElements.append(tag, "style", "id", "table-body", "colors", BODY_COLORS);
        DbmElements.append(tag, "style", "id", "table-ext-body", "colors", BODY_COLORS);
        DbmElements.append(tag, "style", "id", "table-name", "colors", NAME_COLORS);
        DbmElements.append(tag, "style", "id", "table-schema-name", "colors", NAME_COLORS);
        DbmElements.append(tag, "style", "id", "table-title",
                "colors", color + "," + color + "," + color.shift(TITLE_SHADE_DELTA));
        DbmElements.appendText(tag, "comment", layer.getName());
    }
}
