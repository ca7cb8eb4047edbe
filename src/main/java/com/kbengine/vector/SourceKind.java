package com.kbengine.vector;

// declaration order is the tie-break order at equal score
public enum SourceKind {
    SYSTEM("system"),
    TENANT("tenant"),
    USER("user");

    private final String label;

    SourceKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
