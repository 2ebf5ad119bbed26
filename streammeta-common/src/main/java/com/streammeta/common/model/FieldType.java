package com.streammeta.common.model;

/**
 * Primitive column types a schema field can declare.
 * The display name is what callers see as a property type.
 */
public enum FieldType {
    UTF8("Utf8"),
    INT64("Int64"),
    INT32("Int32"),
    UINT64("UInt64"),
    FLOAT64("Float64"),
    BOOLEAN("Boolean"),
    BINARY("Binary"),
    TIMESTAMP_MICROS("Timestamp(Microsecond, None)");

    private final String displayName;

    FieldType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
