package com.streammeta.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of data a stream holds. Streams of different types may share a name.
 */
public enum StreamType {
    LOGS("logs"),
    METRICS("metrics"),
    TRACES("traces"),
    METADATA("metadata");

    private final String label;

    StreamType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static StreamType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stream type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StreamType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown stream type: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
