package com.dbmodel.converter.model;

import com.dbmodel.converter.model.type.TypeCatalog;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed schema model built from one workbench physical model.
 *
 * Column back-references (owning foreign key, index memberships) live in lookup tables
 * keyed by column id rather than on the columns themselves.
 */
@Getter
@Builder
public final class SchemaGraph {

    @NonNull
    private final String schemaName;

    @NonNull
    private final TypeCatalog types;

    @Singular
    private final List<Table> tables;

    @NonNull
    private final Diagram diagram;

    @NonNull
    private final Map<String, ForeignKey> foreignKeysByColumnId;

    @NonNull
    private final Map<String, List<IndexColumn>> indexColumnsByColumnId;

    public Optional<Table> findTable(String tableId) {
        return tables.stream().filter(t -> t.getId().equals(tableId)).findFirst();
    }

    public Optional<ForeignKey> foreignKeyOf(Column column) {
        return Optional.ofNullable(foreignKeysByColumnId.get(column.getId()));
    }

    public boolean isForeignKeyMember(Column column) {
        return foreignKeysByColumnId.containsKey(column.getId());
    }

    public List<IndexColumn> indexMembershipsOf(Column column) {
        return indexColumnsByColumnId.getOrDefault(column.getId(), List.of());
    }
}
