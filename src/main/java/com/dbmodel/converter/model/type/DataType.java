package com.dbmodel.converter.model.type;

import java.util.Optional;

/**
 * A resolved workbench data type: either a built-in {@link SimpleType} or a named
 * {@link UserType} aliasing one.
 */
public interface DataType {

    enum Kind { SIMPLE, USER }

    Kind getKind();

    String getId();

    /**
     * Full native name, e.g. {@code com.mysql.rdbms.mysql.datatype.varchar}.
     */
    String getNativeType();

    /**
     * Upper-cased last segment of the native name, e.g. {@code VARCHAR}.
     */
    String getCategory();

    /**
     * Symbolic name of a user type ({@code BOOLEAN}, {@code UBOOL}, ...); empty for simple types.
     */
    default Optional<String> getSymbolicName() {
        return Optional.empty();
    }
}
