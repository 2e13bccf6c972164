package com.dbmodel.converter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class Table {
    String id;
    String name;
    String nextAutoInc;
    @Singular
    List<Column> columns;
    @Singular("index")
    List<Index> indices;
    @Singular
    List<ForeignKey> foreignKeys;
    @Singular
    List<Trigger> triggers;

    public Optional<String> findNextAutoInc() {
        return nextAutoInc == null || nextAutoInc.isBlank() ? Optional.empty() : Optional.of(nextAutoInc.trim());
    }
}
