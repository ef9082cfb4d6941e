package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BoardProfile(String boardId) {

    public static final BoardProfile DEFAULT = new BoardProfile("default");
}
