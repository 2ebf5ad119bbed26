package com.streammeta.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One version of a stream schema: ordered fields plus a free-form string metadata map.
 * The metadata map carries the {@code created_at} stamp and the serialized stream settings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Schema {

    public static final String CREATED_AT_KEY = "created_at";
    public static final String SETTINGS_KEY = "settings";

    @Builder.Default
    private List<SchemaField> fields = new ArrayList<>();

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    /**
     * The schema store's answer for a stream that does not exist
     */
    public static Schema empty() {
        return new Schema(new ArrayList<>(), new HashMap<>());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fields == null || fields.isEmpty();
    }

    /**
     * Copy of this schema with the same fields and the given metadata
     */
    public Schema withMetadata(Map<String, String> newMetadata) {
        return new Schema(new ArrayList<>(fields), new HashMap<>(newMetadata));
    }
}
