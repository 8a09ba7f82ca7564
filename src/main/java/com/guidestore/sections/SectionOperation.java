package com.guidestore.sections;

import java.util.Locale;
import java.util.Optional;

public enum SectionOperation {
    REPLACE("replace"),
    APPEND("append"),
    PREPEND("prepend"),
    INSERT_BEFORE("insert_before"),
    INSERT_AFTER("insert_after"),
    APPEND_CHILD("append_child"),
    REMOVE("remove");

    private final String value;

    SectionOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Operations that create a new heading and therefore need a title. */
    public boolean createsSection() {
        return this == INSERT_BEFORE || this == INSERT_AFTER || this == APPEND_CHILD;
    }

    public boolean requiresContent() {
        return this != REMOVE;
    }

    public static Optional<SectionOperation> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SectionOperation op : values()) {
            if (op.value.equals(v)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
