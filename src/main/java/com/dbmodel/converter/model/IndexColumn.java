package com.dbmodel.converter.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Membership of a table column in an index.
 */
@Value
@Builder
public class IndexColumn {
    String id;
    String indexName;
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Column column;
    IndexType indexType;
    boolean descend;
}
