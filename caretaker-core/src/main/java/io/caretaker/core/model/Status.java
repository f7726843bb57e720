package io.caretaker.core.model;

import java.util.Locale;

public enum Status {
    OK,
    WARNING,
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
