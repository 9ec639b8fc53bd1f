package com.adlanda.contextengine.model;

/**
 * Kind of knowledge a context carries.
 */
public enum ContextType {
    FILE("file"),
    DIRECTORY("directory"),
    SYMBOL("symbol"),
    DOCUMENTATION("documentation"),
    DEPENDENCY("dependency"),
    CONVERSATION("conversation"),
    ERROR("error"),
    TEST("test"),
    ARCHITECTURE("architecture");

    private final String value;

    ContextType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ContextType fromValue(String value) {
        for (ContextType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown context type: " + value);
    }
}
