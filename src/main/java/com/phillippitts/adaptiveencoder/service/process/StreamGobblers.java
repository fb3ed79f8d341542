package com.phillippitts.adaptiveencoder.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Daemon threads that drain subprocess streams so a full pipe never blocks the child.
 *
 * <p>Every gobbler keeps reading after its cap is reached; only accumulation stops.
 */
public final class StreamGobblers {

    private static final Logger LOG = LogManager.getLogger(StreamGobblers.class);

    private StreamGobblers() {
        // Utility class - prevent instantiation
    }

    /**
     * Starts a gobbler accumulating text lines into {@code sink} up to {@code maxBytes} characters.
     */
    public static Thread text(InputStream in, StringBuilder sink, String name, int maxBytes) {
        return startDaemon(name, () -> readLines(in, name, line -> {
            synchronized (sink) {
                if (sink.length() >= maxBytes) {
                    return;
                }
                if (!sink.isEmpty()) {
                    sink.append('\n');
                }
                int available = maxBytes - sink.length();
                sink.append(line, 0, Math.min(line.length(), available));
            }
        }));
    }

    /**
     * Starts a gobbler feeding each line to {@code consumer}.
     */
    public static Thread lines(InputStream in, Consumer<String> consumer, String name) {
        return startDaemon(name, () -> readLines(in, name, consumer));
    }

    /**
     * Starts a gobbler copying raw bytes into {@code sink} up to {@code maxBytes}.
     */
    public static Thread bytes(InputStream in, ByteArrayOutputStream sink, String name, int maxBytes) {
        return startDaemon(name, () -> {
            byte[] buffer = new byte[8192];
            boolean capReached = false;
            try (InputStream stream = in) {
                int read;
                while ((read = stream.read(buffer)) != -1) {
                    int available;
                    synchronized (sink) {
                        available = maxBytes - sink.size();
                        if (available > 0) {
                            sink.write(buffer, 0, Math.min(read, available));
                        }
                    }
                    if (available < read && !capReached) {
                        LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                        capReached = true;
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        });
    }

    /**
     * Joins a gobbler thread, restoring the interrupt flag if interrupted.
     */
    public static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void readLines(InputStream in, String name, Consumer<String> consumer) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                consumer.accept(line);
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    private static Thread startDaemon(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
