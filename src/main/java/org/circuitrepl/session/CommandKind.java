package org.circuitrepl.session;

public enum CommandKind {
    EXECUTE,
    QUERY,
    RESET,
    CONFIGURE,
    HARDWARE,
    CONTROL
}
