package org.circuitrepl.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outbound envelope from the session controller to the runtime worker.
 *
 * @param id        Correlation id, unique among outstanding commands.
 * @param type      The request type.
 * @param payload   Type specific payload, never null on the wire.
 * @param timestamp Issuance time in epoch milliseconds.
 */
public record Request(String id, RequestType type, JsonNode payload, long timestamp) {
}
