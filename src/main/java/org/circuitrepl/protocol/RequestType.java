package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request types understood by the runtime worker.
 * <p>
 * Unknown wire values decode to {@link #UNKNOWN} so that the worker can answer them with
 * a failure response instead of dropping the frame.
 */
public enum RequestType {
    @JsonProperty("execute") EXECUTE,
    @JsonProperty("query") QUERY,
    @JsonProperty("reset") RESET,
    @JsonProperty("configure") CONFIGURE,
    @JsonProperty("hardware_query") HARDWARE_QUERY,
    @JsonProperty("hardware_set") HARDWARE_SET,
    @JsonEnumDefaultValue UNKNOWN
}
