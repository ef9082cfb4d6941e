package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of {@code query} and {@code reset} requests. Only {@code status} is always present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResult(String status, Boolean initialized, Long heapSizeBytes, Long timestamp) {

    public static StatusResult of(String status) {
        return new StatusResult(status, null, null, null);
    }
}
