package com.shelfsync.converter.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskState {
    PENDING,
    ACTIVE,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
