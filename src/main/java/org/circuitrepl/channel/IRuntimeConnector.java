package org.circuitrepl.channel;

import org.circuitrepl.protocol.Request;
import org.circuitrepl.protocol.Response;

import java.io.IOException;

/**
 * Opens a fresh channel to a newly started runtime worker. Each call starts a new worker.
 */
@FunctionalInterface
public interface IRuntimeConnector {

    IDuplexChannel<Request, Response> connect() throws IOException;
}
