package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** The two variants of monitored entity. Names are unique within a variant, not across them. */
public enum ObjectKind {
    HOST("Host"),
    SERVICE("Service");

    private final String typeName;

    ObjectKind(String typeName) {
        this.typeName = typeName;
    }

    /** Type name as used by configuration items ("Host", "Service"). */
    @JsonValue
    public String typeName() {
        return typeName;
    }

    /**
     * Resolves a configuration type name. Returns {@code null} for types this engine does not track
     * (groups, templates of other types, ...), which callers treat as "not ours".
     */
    @JsonCreator
    public static ObjectKind fromTypeName(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return null;
        }
        String norm = typeName.trim().toLowerCase(Locale.ROOT);
        for (ObjectKind kind : values()) {
            if (kind.typeName.toLowerCase(Locale.ROOT).equals(norm)) {
                return kind;
            }
        }
        return null;
    }
}
