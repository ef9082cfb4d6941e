package org.circuitrepl.protocol;

public record QueryPayload(String queryType) {

    public static final String READY = "ready";
    public static final String HEALTH = "health";
}
