package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.circuitrepl.hardware.HardwareSnapshot;

/**
 * Inbound envelope from the runtime worker.
 *
 * @param id               Correlation id of the request this answers, or {@link #INIT_ID}.
 * @param success          Whether the request was handled without error.
 * @param result           Type specific result, may be null.
 * @param error            Error message, present when {@code success} is false.
 * @param executionTimeMs  Wall time the worker spent on the request.
 * @param hardwareSnapshot Worker hardware state after handling, may be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Response(String id,
                       boolean success,
                       JsonNode result,
                       String error,
                       long executionTimeMs,
                       HardwareSnapshot hardwareSnapshot) {

    /**
     * Distinguished id of the response a worker emits once after initializing its interpreter.
     */
    public static final String INIT_ID = "init";

    public static Response success(String id, JsonNode result, long executionTimeMs, HardwareSnapshot snapshot) {
        return new Response(id, true, result, null, executionTimeMs, snapshot);
    }

    public static Response failure(String id, String error, long executionTimeMs) {
        return new Response(id, false, null, error, executionTimeMs, null);
    }

    public static Response failure(String id, JsonNode result, String error, long executionTimeMs, HardwareSnapshot snapshot) {
        return new Response(id, false, result, error, executionTimeMs, snapshot);
    }
}
