package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ExecutionMode {
    /** Code is fed to the interactive line processor one unit at a time. */
    @JsonProperty("repl") REPL,
    /** The whole buffer is evaluated at once. */
    @JsonProperty("file") FILE
}
