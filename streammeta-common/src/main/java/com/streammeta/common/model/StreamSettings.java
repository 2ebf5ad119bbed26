package com.streammeta.common.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured stream configuration derived from schema metadata.
 * A default instance means "nothing configured".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StreamSettings {

    @Builder.Default
    private List<String> partitionKeys = new ArrayList<>();

    @Builder.Default
    private List<String> fullTextSearchKeys = new ArrayList<>();

    private boolean skipSchemaValidation;

    // 0 means no explicit retention
    private long dataRetention;
}
