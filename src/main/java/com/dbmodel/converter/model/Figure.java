package com.dbmodel.converter.model;

import lombok.Builder;
import lombok.Value;

/**
 * Placement of a table or view on a diagram. Coordinates are relative to the figure's layer.
 */
@Value
@Builder
public class Figure {
    String id;
    FigureKind kind;
    String tableId;
    String viewId;
    String layerId;
    double left;
    double top;
    String color;
}
