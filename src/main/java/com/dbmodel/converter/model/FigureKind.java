package com.dbmodel.converter.model;

public enum FigureKind {
    TABLE("workbench.physical.TableFigure"),
    VIEW("workbench.physical.ViewFigure"),
    OTHER(null);

    private final String structName;

    FigureKind(String structName) {
        this.structName = structName;
    }

    public static FigureKind fromStructName(String structName) {
        for (FigureKind kind : values()) {
            if (kind.structName != null && kind.structName.equals(structName)) {
                return kind;
            }
        }
        return OTHER;
    }
}
