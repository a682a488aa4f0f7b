package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.core.domain.LogStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads one output stream of a child line by line and forwards each line as a
 * log event until end-of-stream. Malformed UTF-8 is replaced, not fatal.
 * Lines read after the handle's output was closed are dropped.
 */
final class OutputPump implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(OutputPump.class);

    private final ManagedProcess handle;
    private final LogStream stream;
    private final InputStream input;
    private final EventDispatcher events;

    OutputPump(ManagedProcess handle, LogStream stream, InputStream input, EventDispatcher events) {
        this.handle = handle;
        this.stream = stream;
        this.input = input;
        this.events = events;
    }

    @Override
    public void run() {
        // InputStreamReader substitutes U+FFFD for undecodable bytes
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String text = line;
                handle.deliverOutput(() -> events.log(handle.category(), handle.id(), stream, text));
            }
        } catch (IOException e) {
            // Stream closed underneath us, usually by a forced kill
            LOG.debug("{} of {} closed: {}", stream, handle, e.getMessage());
        }
    }
}
