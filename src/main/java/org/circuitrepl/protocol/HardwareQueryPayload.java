package org.circuitrepl.protocol;

public record HardwareQueryPayload(String queryType) {

    public static final String FULL_STATE = "full_state";

    public String effectiveQueryType() {
        return queryType == null || queryType.isBlank() ? FULL_STATE : queryType;
    }
}
