package com.dbmodel.converter.model;

import lombok.Builder;
import lombok.Value;

/**
 * Source trigger. The procedure body is not carried over: destination triggers call
 * functions looked up by trigger name.
 */
@Value
@Builder
public class Trigger {
    String id;
    String tableId;
    String name;
    String timing;
    String event;
}
