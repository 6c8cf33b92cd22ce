package com.example.shorts_backend.util;

/**
 * The engagement signals a job can be scored on. Declaration order doubles as the tie-break order
 * when two signals contribute equally to a point of the engagement curve.
 */
public enum AnalyzerKind {
    SEMANTIC("semantic"),
    AUDIO("audio"),
    MOTION("motion"),
    SCENE("scene"),
    FACES("faces");

    private final String key;

    AnalyzerKind(String key) {
        this.key = key;
    }

    /** Lower-case key used in configuration maps and the status surface. */
    public String key() {
        return key;
    }

    public static AnalyzerKind fromKey(String key) {
        for (AnalyzerKind kind : values()) {
            if (kind.key.equalsIgnoreCase(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown analyzer: " + key);
    }
}
