package com.chicu.simorch.eval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Режим расчёта XPM (cross-phase modulation) в симуляторе.
 */
public enum XpmMode {

    LINEAR("linear"),
    PHYSICS("physics");

    private final String wire;

    XpmMode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static XpmMode from(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (XpmMode m : values()) {
            if (m.wire.equals(v)) return m;
        }
        throw new IllegalArgumentException("xpm_mode должен быть linear|physics, получено: " + value);
    }
}
