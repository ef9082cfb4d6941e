package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ControlSignalType {
    INTERRUPT("interrupt"),
    SOFT_RESTART("soft-restart"),
    PASTE_MODE_ENTER("paste-mode-enter");

    private final String wireName;

    ControlSignalType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
