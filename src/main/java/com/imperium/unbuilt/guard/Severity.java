package com.imperium.unbuilt.guard;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public Severity max(Severity other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }

    public boolean atLeast(Severity other) {
        return ordinal() >= other.ordinal();
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
