package com.dbmodel.converter.model;

import java.util.Optional;

public enum IndexType {
    PRIMARY,
    UNIQUE,
    INDEX;

    public static Optional<IndexType> fromName(String name) {
        for (IndexType type : values()) {
            if (type.name().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
