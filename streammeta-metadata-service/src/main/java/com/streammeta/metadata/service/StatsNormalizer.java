package com.streammeta.metadata.service;

import com.streammeta.common.model.StreamStats;
import org.springframework.stereotype.Component;

/**
 * Converts raw byte counters to MiB with two decimals for display.
 */
@Component
public class StatsNormalizer {

    static final double BYTES_PER_MIB = 1024.0 * 1024.0;

    /**
     * Returns a normalized copy; the input is left untouched.
     * Rounding goes to the nearest hundredth with ties away from zero.
     */
    public StreamStats normalize(StreamStats stats) {
        return stats.toBuilder()
                .storageSize(toMib(stats.getStorageSize()))
                .compressedSize(toMib(stats.getCompressedSize()))
                .build();
    }

    static double toMib(double bytes) {
        double hundredths = bytes / BYTES_PER_MIB * 100.0;
        return Math.copySign((double) Math.round(Math.abs(hundredths)), hundredths) / 100.0;
    }
}
