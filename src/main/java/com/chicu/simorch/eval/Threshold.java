package com.chicu.simorch.eval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Threshold {

    HARD("hard"),
    SOFT("soft");

    private final String wire;

    Threshold(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static Threshold from(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Threshold t : values()) {
            if (t.wire.equals(v)) return t;
        }
        throw new IllegalArgumentException("threshold должен быть hard|soft, получено: " + value);
    }
}
