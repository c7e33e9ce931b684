package com.codeact.sandbox;

import java.nio.CharBuffer;

/**
 * Character-capped accumulator for one output stream. Characters past the cap
 * are counted and dropped.
 */
class OutputBuffer {

    static final String TRUNCATION_MARKER = "\n...[output truncated: %d characters omitted]";

    private final int maxChars;
    private final StringBuilder content = new StringBuilder();
    private long dropped;

    OutputBuffer(int maxChars) {
        if (maxChars < 0) {
            throw new IllegalArgumentException("maxChars must not be negative");
        }
        this.maxChars = maxChars;
    }

    synchronized void append(CharSequence chunk) {
        int room = maxChars - content.length();
        if (room >= chunk.length()) {
            content.append(chunk);
            return;
        }
        if (room > 0) {
            content.append(chunk, 0, room);
        }
        dropped += chunk.length() - Math.max(room, 0);
    }

    synchronized void append(char[] chars, int offset, int length) {
        append(CharBuffer.wrap(chars, offset, length));
    }

    synchronized boolean truncated() {
        return dropped > 0;
    }

    @Override
    public synchronized String toString() {
        if (dropped == 0) {
            return content.toString();
        }
        return content + String.format(TRUNCATION_MARKER, dropped);
    }
}
