package com.dbmodel.converter.model;

import com.dbmodel.converter.model.type.DataType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A table column as declared in the source model. Length, precision and scale use
 * {@code -1} for "not set", like the source format.
 */
@Value
@Builder
public class Column {
    String id;
    String name;
    DataType type;
    boolean notNull;
    boolean autoIncrement;
    String defaultValue;
    boolean defaultValueIsNull;
    long length;
    long precision;
    long scale;
    String datatypeExplicitParams;
    String comment;
    @Singular
    List<String> flags;

    public boolean hasDefaultValue() {
        return defaultValue != null && !defaultValue.isEmpty();
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
