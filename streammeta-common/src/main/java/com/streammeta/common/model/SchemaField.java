package com.streammeta.common.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named, typed column of a stream schema
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaField {

    private String name;
    private FieldType type;
}
