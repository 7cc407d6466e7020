package com.scheduler.worker.execution;

import com.scheduler.worker.function.TaskContext;

/**
 * Accumulates a task's printed output. The clear marker drops everything
 * before it, including a marker split across appends. Only the last
 * {@code maxChars} characters are kept.
 */
public class OutputBuffer {

    public static final int DEFAULT_MAX_CHARS = 1_000_000;

    private static final String MARKER = TaskContext.CLEAR_MARKER;

    private final StringBuilder text = new StringBuilder();
    private final int maxChars;
    private long version;

    public OutputBuffer() {
        this(DEFAULT_MAX_CHARS);
    }

    public OutputBuffer(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive");
        }
        this.maxChars = maxChars;
    }

    public synchronized void append(CharSequence chunk) {
        if (chunk.length() == 0) {
            return;
        }
        // a marker can only start in the new chunk or just before it
        int from = Math.max(0, text.length() - MARKER.length() + 1);
        text.append(chunk);

        int last = -1;
        for (int i = text.indexOf(MARKER, from); i >= 0; i = text.indexOf(MARKER, i + 1)) {
            last = i;
        }
        if (last >= 0) {
            text.delete(0, last + MARKER.length());
        }
        if (text.length() > maxChars) {
            text.delete(0, text.length() - maxChars);
        }
        version++;
    }

    public synchronized String snapshot() {
        return text.toString();
    }

    /**
     * Increases with every append.
     */
    public synchronized long version() {
        return version;
    }
}
