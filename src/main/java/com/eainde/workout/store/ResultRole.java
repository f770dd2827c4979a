package com.eainde.workout.store;

/**
 * Logical slot under which a tool's result is kept, independent of call order.
 */
public enum ResultRole {
    DISCIPLINE("discipline"),
    EXTRACTION("extraction"),
    VALIDATION("validation"),
    NORMALIZATION("normalization"),
    SUMMARY("summary"),
    SAVE("save");

    private final String key;

    ResultRole(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
