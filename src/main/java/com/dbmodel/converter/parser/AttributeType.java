package com.dbmodel.converter.parser;

import java.util.Optional;

/**
 * Value kinds carried by the {@code type} attribute of a workbench {@code value}/{@code link} element.
 */
public enum AttributeType {
    STRING("string"),
    INT("int"),
    REAL("real"),
    OBJECT("object"),
    LIST("list"),
    DICT("dict");

    private final String wireName;

    AttributeType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<AttributeType> fromWireName(String name) {
        for (AttributeType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
