package com.dbmodel.converter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Index {
    String id;
    String name;
    IndexType indexType;
    boolean primary;
    boolean unique;
    @Singular
    List<IndexColumn> columns;
}
