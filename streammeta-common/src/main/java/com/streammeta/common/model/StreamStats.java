package com.streammeta.common.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Usage counters of a stream. Sizes are bytes when raw and MiB once normalized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StreamStats {

    private long docTimeMin;
    private long docTimeMax;
    private long docNum;
    private long fileNum;
    private double storageSize;
    private double compressedSize;
}
