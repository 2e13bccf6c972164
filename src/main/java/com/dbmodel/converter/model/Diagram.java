package com.dbmodel.converter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Value
@Builder
public class Diagram {
    String id;
    String name;
    @Singular
    List<Figure> figures;
    @Singular
    List<Layer> layers;

    public Optional<Figure> findTableFigure(Table table) {
        return figures.stream()
                .filter(f -> f.getKind() == FigureKind.TABLE && table.getId().equals(f.getTableId()))
                .findFirst();
    }

    /**
     * Layer holding the figure, or empty when the figure sits on the root layer.
     */
    public Optional<Layer> findLayer(Figure figure) {
        if (figure.getLayerId() == null) {
            return Optional.empty();
        }
        return layers.stream()
                .filter(l -> figure.getLayerId().equals(l.getId()))
                .findFirst();
    }

    public Optional<Figure> findFirstTableFigure(Layer layer) {
        return figures.stream()
                .filter(f -> f.getKind() == FigureKind.TABLE)
                .filter(f -> Objects.equals(f.getLayerId(), layer.getId()))
                .findFirst();
    }
}
