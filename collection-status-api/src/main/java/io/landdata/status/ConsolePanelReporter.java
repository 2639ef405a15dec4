package io.landdata.status;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.function.IntSupplier;

/**
 * A reporter for interactive terminals which redraws a single progress line in place.
 *
 * <pre>
 * Downloading files [##########################--------------]  65% 26/40
 * </pre>
 *
 * <p>Redraws are throttled to {@link #MIN_REDRAW_NANOS} except for the final item,
 * which is always drawn. The line is terminated when the tracker closes.</p>
 */
public final class ConsolePanelReporter implements ProgressReporter {

    static final long MIN_REDRAW_NANOS = 100_000_000L;
    private static final int MIN_BAR_WIDTH = 10;

    private final PrintWriter writer;
    private final IntSupplier widthSupplier;
    private final Terminal terminal;
    private final Object drawLock = new Object();

    /**
     * Creates a reporter drawing onto an arbitrary writer.
     *
     * @param writer destination of the progress line
     * @param widthSupplier current console width in columns
     */
    public ConsolePanelReporter(PrintWriter writer, IntSupplier widthSupplier) {
        this(writer, widthSupplier, null);
    }

    private ConsolePanelReporter(PrintWriter writer, IntSupplier widthSupplier, Terminal terminal) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.widthSupplier = Objects.requireNonNull(widthSupplier, "widthSupplier");
        this.terminal = terminal;
    }

    /**
     * Creates a reporter on the JLine system terminal. The terminal is owned by the
     * reporter and released by {@link #close()}.
     *
     * @return a reporter bound to the system terminal
     */
    public static ConsolePanelReporter forSystemTerminal() {
        try {
            Terminal terminal = TerminalBuilder.builder().system(true).dumb(true).build();
            return new ConsolePanelReporter(terminal.writer(), () -> {
                int width = terminal.getWidth();
                return width > 0 ? width : 80;
            }, terminal);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to open system terminal", e);
        }
    }

    @Override
    public ProgressTracker begin(String description, long total) {
        PanelTracker tracker = new PanelTracker(description, total);
        tracker.draw();
        return tracker;
    }

    @Override
    public void close() {
        if (terminal != null) {
            try {
                terminal.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to close system terminal", e);
            }
        }
    }

    String renderLine(String description, long completed, long total, int width) {
        long percent = total > 0 ? (completed * 100) / total : 100;
        String suffix = String.format(" %3d%% %d/%d", percent, completed, total);
        int barWidth = Math.max(MIN_BAR_WIDTH, width - description.length() - suffix.length() - 4);
        int filled = total > 0 ? (int) ((completed * barWidth) / total) : barWidth;
        StringBuilder line = new StringBuilder(width);
        line.append(description).append(" [");
        line.append("#".repeat(filled));
        line.append("-".repeat(barWidth - filled));
        line.append(']').append(suffix);
        return line.toString();
    }

    private final class PanelTracker implements ProgressTracker {
        private final String description;
        private final long total;
        private long completed;
        private long lastDrawNanos;
        private boolean closed;

        private PanelTracker(String description, long total) {
            this.description = description;
            this.total = total;
        }

        @Override
        public synchronized void advance() {
            completed++;
            long now = System.nanoTime();
            if (completed == total || now - lastDrawNanos >= MIN_REDRAW_NANOS) {
                lastDrawNanos = now;
                draw();
            }
        }

        @Override
        public synchronized long completed() {
            return completed;
        }

        @Override
        public long total() {
            return total;
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            draw();
            synchronized (drawLock) {
                writer.println();
                writer.flush();
            }
        }

        private void draw() {
            String line = renderLine(description, completed, total, widthSupplier.getAsInt());
            synchronized (drawLock) {
                writer.print('\r');
                writer.print(line);
                writer.flush();
            }
        }
    }
}
