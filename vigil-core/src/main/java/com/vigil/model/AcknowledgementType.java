package com.vigil.model;

public enum AcknowledgementType {
    NONE(0),
    NORMAL(1),
    STICKY(2);

    private final int code;

    AcknowledgementType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static AcknowledgementType fromCode(int code) {
        for (AcknowledgementType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown acknowledgement type code: " + code);
    }
}
