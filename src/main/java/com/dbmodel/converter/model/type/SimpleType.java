package com.dbmodel.converter.model.type;

import lombok.Value;

/**
 * Built-in type; its identifier is its native name.
 */
@Value
public class SimpleType implements DataType {
    String nativeType;
    String category;

    @Override
    public Kind getKind() {
        return Kind.SIMPLE;
    }

    @Override
    public String getId() {
        return nativeType;
    }
}
