package com.vigil.service.core.bridge;

/** One attribute assignment of a config item, applied after everything inherited from parents. */
public record ConfigExpression(String key, Operator operator, Object value) {

    public enum Operator {
        /** Replace the inherited value. */
        SET,
        /** Merge into the inherited value (maps and collections), replace otherwise. */
        PLUS
    }

    public static ConfigExpression set(String key, Object value) {
        return new ConfigExpression(key, Operator.SET, value);
    }

    public static ConfigExpression plus(String key, Object value) {
        return new ConfigExpression(key, Operator.PLUS, value);
    }
}
