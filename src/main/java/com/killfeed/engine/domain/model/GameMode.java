package com.killfeed.engine.domain.model;

public enum GameMode {
    PU("PU"),
    AC("AC"),
    UNKNOWN("Unknown");

    private final String label;

    GameMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
