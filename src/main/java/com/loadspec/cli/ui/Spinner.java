package com.loadspec.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

/**
 * Shows a labelled spinner on the terminal while a parse or backend probe runs in the background.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = {'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Runs the task on a worker thread and redraws the spinner every 100ms until it completes.
     *
     * @param label Text shown before the spinner frame, e.g. {@code "Parsing..."}.
     * @param task  The work to run.
     * @param <T>   The result type.
     * @return The task result.
     * @throws RuntimeException the task's own runtime exception, unwrapped.
     */
    public <T> T spin(String label, Supplier<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        int frame = 0;

        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clear(writer, label);
                    return result;
                } catch (TimeoutException e) {
                    writer.print("\r\u001B[33m" + label + " " + FRAMES[frame++ % FRAMES.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (Exception e) {
            clear(writer, label);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private void clear(PrintWriter writer, String label) {
        writer.print("\r" + " ".repeat(label.length() + 4) + "\r");
        writer.flush();
    }
}
