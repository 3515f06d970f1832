package com.tradeguard.stream;

import java.time.Instant;

/**
 * Stream entry id in {@code <millis>-<sequence>} form. Ids are ordered by
 * millisecond timestamp, then sequence, which is what age-based trimming relies on.
 */
public record StreamEntryId(long millis, long sequence) implements Comparable<StreamEntryId> {

    public static final StreamEntryId ZERO = new StreamEntryId(0, 0);

    public static StreamEntryId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Stream entry id must not be blank");
        }
        int dash = value.indexOf('-');
        try {
            if (dash < 0) {
                return new StreamEntryId(Long.parseLong(value), 0);
            }
            return new StreamEntryId(Long.parseLong(value.substring(0, dash)), Long.parseLong(value.substring(dash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed stream entry id: " + value, e);
        }
    }

    /** Smallest id that an entry created at {@code instant} can have. */
    public static StreamEntryId minimumAt(Instant instant) {
        return new StreamEntryId(instant.toEpochMilli(), 0);
    }

    public Instant timestamp() {
        return Instant.ofEpochMilli(millis);
    }

    @Override
    public int compareTo(StreamEntryId other) {
        int byMillis = Long.compare(millis, other.millis);
        return byMillis != 0 ? byMillis : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return millis + "-" + sequence;
    }
}
