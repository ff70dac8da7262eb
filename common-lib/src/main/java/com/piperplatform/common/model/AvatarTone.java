package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AvatarTone {
    WARM("warm"),
    CALM("calm");

    private final String label;

    AvatarTone(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
