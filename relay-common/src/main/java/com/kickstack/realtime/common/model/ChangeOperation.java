package com.kickstack.realtime.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Row operation that produced a change record.
 * Serialized in lower case ("insert", "update", "delete").
 */
public enum ChangeOperation {
    INSERT,
    UPDATE,
    DELETE,

    /**
     * Anything the trigger wrote that is not one of the above (e.g. TRUNCATE)
     */
    @JsonEnumDefaultValue
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a store or wire value, case-insensitively.
     * Never throws; unrecognized values map to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static ChangeOperation fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (ChangeOperation operation : values()) {
            if (operation.name().equalsIgnoreCase(value.trim())) {
                return operation;
            }
        }
        return UNKNOWN;
    }
}
