package com.phillippitts.readaloud.service.process;

import com.phillippitts.readaloud.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared subprocess plumbing: output gobblers, bounded joins and two-phase termination.
 */
public final class ProcessSupport {

    private static final Logger LOG = LogManager.getLogger(ProcessSupport.class);

    private ProcessSupport() {
        // Utility class - prevent instantiation
    }

    /**
     * Drains a process stream on a daemon thread, keeping at most {@code maxBytes} characters.
     *
     * @param inputStream stream to drain
     * @param sink        receives captured lines; read it only after joining the thread
     * @param name        thread name, also used in log messages
     * @param maxBytes    capture cap
     * @return started gobbler thread
     */
    public static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

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

    /**
     * Terminates a process: {@link Process#destroy()} first, then {@link Process#destroyForcibly()}
     * if it is still alive after the graceful timeout.
     *
     * @param process process to terminate; ignored if null or already exited
     */
    public static void destroy(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // Interrupted during graceful wait; make sure it does not outlive the session
            process.destroyForcibly();
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    /**
     * Returns at most {@code maxChars} leading characters of captured output.
     */
    public static String snippet(StringBuilder sb, int maxChars) {
        synchronized (sb) {
            int len = Math.min(maxChars, sb.length());
            return sb.substring(0, len);
        }
    }

    /**
     * Reads lines into a StringBuilder until the cap is reached, then keeps draining so the
     * process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    if (capReached) {
                        continue;
                    }
                    synchronized (sink) {
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, Math.max(0, available));
                            LOG.debug("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }
}
