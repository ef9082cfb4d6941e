package org.circuitrepl.hardware;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PinMode {
    @JsonProperty("input") INPUT,
    @JsonProperty("output") OUTPUT
}
