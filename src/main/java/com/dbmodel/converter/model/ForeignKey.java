package com.dbmodel.converter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A foreign key of a table. {@code primary} is set when one of its columns is also part
 * of the table's primary key, which makes the resulting relationship identifying.
 */
@Value
@Builder
public class ForeignKey {
    String id;
    String name;
    String tableId;
    String referencedTableId;
    boolean many;
    boolean mandatory;
    String updateRule;
    String deleteRule;
    boolean primary;
    @Singular
    List<Column> columns;

    /**
     * Some foreign key entries carry no referenced table; they are index artifacts.
     */
    public Optional<String> findReferencedTableId() {
        return Optional.ofNullable(referencedTableId);
    }
}
