package org.circuitrepl.channel;

import org.circuitrepl.protocol.ChannelClosedException;
import org.circuitrepl.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Duplex channel carrying one encoded message per line over a pair of byte streams.
 * <p>
 * A dedicated reader thread decodes incoming lines. Malformed lines are logged and skipped.
 * End of stream, or a read failure, closes the channel.
 *
 * @param <O> The type of message this endpoint sends.
 * @param <I> The type of message this endpoint receives.
 */
public class StreamDuplexChannel<O, I> extends AbstractDuplexChannel<O, I> {

    private static final Logger log = LoggerFactory.getLogger(StreamDuplexChannel.class);

    private final BufferedReader reader;
    private final Writer writer;
    private final Function<O, String> encoder;
    private final Function<String, I> decoder;
    private final Thread readerThread;
    private final Runnable closeAction;

    /**
     * Creates the channel and starts its reader thread.
     *
     * @param name        Name used for the reader thread and in log messages.
     * @param in          Stream to read incoming lines from.
     * @param out         Stream to write outgoing lines to.
     * @param encoder     Encodes an outgoing message to a single line without line terminator.
     * @param decoder     Decodes an incoming line, throwing {@link ProtocolException} if malformed.
     * @param closeAction Extra action run once on close, e.g. destroying a child process.
     */
    public StreamDuplexChannel(final String name,
                               final InputStream in,
                               final OutputStream out,
                               final Function<O, String> encoder,
                               final Function<String, I> decoder,
                               final Runnable closeAction) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        this.encoder = encoder;
        this.decoder = decoder;
        this.closeAction = closeAction;
        this.readerThread = new Thread(this::readLoop, name + "-reader");
        this.readerThread.setDaemon(true);
        this.readerThread.start();
    }

    @Override
    public void send(final O message) {
        ensureOpen();
        final String line = encoder.apply(message);
        synchronized (writer) {
            try {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                close();
                throw new ChannelClosedException("Failed to write to channel: " + e.getMessage(), e);
            }
        }
    }

    @Override
    protected void onClose() {
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Error closing channel writer: {}", e.getMessage());
        }
        if (closeAction != null) {
            closeAction.run();
        }
        readerThread.interrupt();
    }

    private void readLoop() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    deliver(decoder.apply(line));
                } catch (ProtocolException e) {
                    log.warn("Ignoring malformed frame on {}: {}", readerThread.getName(), e.getMessage());
                }
            }
            log.debug("{} reached end of stream", readerThread.getName());
        } catch (IOException e) {
            if (isOpen()) {
                log.debug("{} read failed: {}", readerThread.getName(), e.getMessage());
            }
        } finally {
            close();
        }
    }
}
