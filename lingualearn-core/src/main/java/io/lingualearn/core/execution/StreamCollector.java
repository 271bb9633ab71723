package io.lingualearn.core.execution;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a process stream on its own thread. Keeps at most {@code maxBytes}; anything beyond the
 * cap is read and discarded so the child never blocks on a full pipe.
 */
final class StreamCollector implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(StreamCollector.class);

    private final InputStream input;
    private final String name;
    private final int maxBytes;
    private final ByteArrayOutputStream sink = new ByteArrayOutputStream();
    private Thread thread;

    private StreamCollector(InputStream input, String name, int maxBytes) {
        this.input = input;
        this.name = name;
        this.maxBytes = maxBytes;
    }

    static StreamCollector start(InputStream input, String name, int maxBytes) {
        StreamCollector collector = new StreamCollector(input, name, maxBytes);
        Thread thread = new Thread(collector, name);
        thread.setDaemon(true);
        collector.thread = thread;
        thread.start();
        return collector;
    }

    @Override
    public void run() {
        byte[] buffer = new byte[8192];
        boolean capReached = false;
        try (InputStream in = input) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                synchronized (sink) {
                    int room = maxBytes - sink.size();
                    if (room > 0) {
                        sink.write(buffer, 0, Math.min(room, read));
                    }
                    if (read > room && !capReached) {
                        LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                        capReached = true;
                    }
                }
            }
        } catch (IOException e) {
            // the stream closes underneath us when the process is destroyed
            LOG.debug("Stream collector '{}' stopped: {}", name, e.toString());
        }
    }

    void join(Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    String text() {
        synchronized (sink) {
            return sink.toString(StandardCharsets.UTF_8);
        }
    }
}
