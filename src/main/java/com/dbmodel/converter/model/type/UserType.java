package com.dbmodel.converter.model.type;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Named alias of a built-in type, declared in the catalog's user datatypes.
 */
@Value
@Builder
public class UserType implements DataType {
    String id;
    String name;
    String sqlDefinition;
    SimpleType actualType;

    @Override
    public Kind getKind() {
        return Kind.USER;
    }

    @Override
    public String getNativeType() {
        return actualType.getNativeType();
    }

    @Override
    public String getCategory() {
        return actualType.getCategory();
    }

    @Override
    public Optional<String> getSymbolicName() {
        return Optional.ofNullable(name);
    }
}
