package com.streammeta.common.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of a schema field
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamProperty {

    private String name;
    private String type;

    public static StreamProperty from(SchemaField field) {
        return new StreamProperty(field.getName(), field.getType().getDisplayName());
    }
}
