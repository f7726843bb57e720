package io.caretaker.core.database;

public enum DbKind {
    POSTGRES,
    SQLITE
}
