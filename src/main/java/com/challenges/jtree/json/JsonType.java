package com.challenges.jtree.json;

public enum JsonType {
    NULL,
    FALSE,
    TRUE,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT;

    public boolean isContainer() {
        return this == ARRAY || this == OBJECT;
    }
}
