package com.tradeguard.stream;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Append-only log with consumer groups, the substrate for the event pipeline.
 *
 * <p>Delivery is at-least-once: an entry read by a group member stays pending for
 * that group until acknowledged, and pending entries idle for too long can be
 * claimed by another member. Failures surface as
 * {@link com.tradeguard.exception.StreamBrokerException}.
 */
public interface StreamBroker {

    /** Verifies the backend is usable. Called once before any other operation. */
    void initialize();

    /** Appends an entry, capping the stream at roughly {@code maxLength} entries. */
    StreamEntryId append(String stream, Map<String, String> fields, long maxLength);

    /** Creates the group at the start of the stream, creating the stream if needed. Idempotent. */
    void createGroup(String stream, String group);

    /** Reads up to {@code count} never-delivered entries, blocking up to {@code block} when none exist. */
    List<StreamEntry> readGroup(String stream, String group, String consumer, int count, Duration block)
            throws InterruptedException;

    long acknowledge(String stream, String group, List<StreamEntryId> ids);

    /**
     * Transfers up to {@code count} pending entries idle for at least {@code minIdle}
     * to {@code consumer}, scanning the pending list from {@code cursor}.
     */
    ClaimResult claimIdle(String stream, String group, String consumer, Duration minIdle, String cursor, int count);

    /** Removes entries with ids lower than {@code minId}. */
    long trimByMinId(String stream, StreamEntryId minId);

    /** Removes the oldest entries until at most {@code maxLength} remain. */
    long trimByMaxLength(String stream, long maxLength);

    StreamInfo info(String stream);

    /** Number of delivered but unacknowledged entries for the group. */
    long pendingCount(String stream, String group);

    default void close() {}
}
