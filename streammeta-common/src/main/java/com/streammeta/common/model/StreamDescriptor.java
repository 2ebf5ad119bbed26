package com.streammeta.common.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Public representation of a stream, rebuilt on every read
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StreamDescriptor {

    private String name;
    private StreamType streamType;
    private String storageType;
    private List<StreamProperty> schema;
    private StreamStats stats;
    private StreamSettings settings;
}
