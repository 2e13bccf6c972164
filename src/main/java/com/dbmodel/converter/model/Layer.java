package com.dbmodel.converter.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Layer {
    String id;
    String name;
    double left;
    double top;
    String color;
}
