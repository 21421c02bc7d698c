package com.bookreader.nlp.core;

/**
 * Half-open character range {@code [start, end)} into the chapter text.
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0, got: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException(
                String.format("end (%d) must not be before start (%d)", end, start));
        }
    }

    public int length() {
        return end - start;
    }

    public int overlapWith(TextSpan other) {
        return Math.max(0, Math.min(end, other.end) - Math.max(start, other.start));
    }

    /**
     * True when the overlap exceeds {@code ratio} of the shorter span's length.
     */
    public boolean overlapsMoreThan(TextSpan other, double ratio) {
        int shorter = Math.min(length(), other.length());
        if (shorter == 0) {
            return false;
        }
        return overlapWith(other) > ratio * shorter;
    }

    public TextSpan union(TextSpan other) {
        return new TextSpan(Math.min(start, other.start), Math.max(end, other.end));
    }
}
