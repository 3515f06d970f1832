package com.tradeguard.stream;

import com.tradeguard.exception.StreamBrokerException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process broker with the same group semantics as Redis Streams: per-group
 * delivery cursor, pending entry lists, idle-based claiming, and trimming that
 * leaves pending references to deleted entries behind (they are dropped when
 * claimed).
 *
 * <p>Entry ids and idle times come from the injected {@link Clock}; blocking reads
 * wait in real time.
 */
public class InMemoryStreamBroker implements StreamBroker {

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();
    private final Map<String, StreamLog> streams = new HashMap<>();

    public InMemoryStreamBroker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void initialize() {
        // nothing to connect to
    }

    @Override
    public StreamEntryId append(String stream, Map<String, String> fields, long maxLength) {
        lock.lock();
        try {
            StreamLog streamLog = streams.computeIfAbsent(stream, name -> new StreamLog());
            StreamEntryId id = streamLog.nextId(clock.millis());
            streamLog.entries.put(id, Map.copyOf(fields));
            streamLog.lastId = id;
            if (maxLength > 0) {
                streamLog.trimToLength(maxLength);
            }
            appended.signalAll();
            return id;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void createGroup(String stream, String group) {
        lock.lock();
        try {
            streams.computeIfAbsent(stream, name -> new StreamLog()).groups.putIfAbsent(group, new GroupState());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StreamEntry> readGroup(String stream, String group, String consumer, int count, Duration block)
            throws InterruptedException {
        long remainingNanos = block.toNanos();
        lock.lock();
        try {
            while (true) {
                GroupState state = requireGroup(stream, group);
                StreamLog streamLog = streams.get(stream);
                List<StreamEntry> delivered = new ArrayList<>();
                for (Map.Entry<StreamEntryId, Map<String, String>> entry :
                        streamLog.entries.tailMap(state.lastDelivered, false).entrySet()) {
                    if (delivered.size() >= count) {
                        break;
                    }
                    state.pending.put(entry.getKey(), new PendingEntry(consumer, clock.instant()));
                    state.lastDelivered = entry.getKey();
                    delivered.add(new StreamEntry(stream, entry.getKey(), entry.getValue()));
                }
                if (!delivered.isEmpty() || remainingNanos <= 0) {
                    return delivered;
                }
                remainingNanos = appended.awaitNanos(remainingNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long acknowledge(String stream, String group, List<StreamEntryId> ids) {
        lock.lock();
        try {
            GroupState state = requireGroup(stream, group);
            long acked = 0;
            for (StreamEntryId id : ids) {
                if (state.pending.remove(id) != null) {
                    acked++;
                }
            }
            return acked;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ClaimResult claimIdle(
            String stream, String group, String consumer, Duration minIdle, String cursor, int count) {
        lock.lock();
        try {
            GroupState state = requireGroup(stream, group);
            StreamLog streamLog = streams.get(stream);
            Instant now = clock.instant();
            List<StreamEntry> claimed = new ArrayList<>();
            NavigableMap<StreamEntryId, PendingEntry> scan = state.pending.tailMap(StreamEntryId.parse(cursor), true);
            StreamEntryId next = null;
            List<StreamEntryId> deleted = new ArrayList<>();
            for (Map.Entry<StreamEntryId, PendingEntry> pending : scan.entrySet()) {
                if (claimed.size() >= count) {
                    next = pending.getKey();
                    break;
                }
                if (Duration.between(pending.getValue().deliveredAt, now).compareTo(minIdle) < 0) {
                    continue;
                }
                Map<String, String> fields = streamLog.entries.get(pending.getKey());
                if (fields == null) {
                    deleted.add(pending.getKey());
                    continue;
                }
                pending.setValue(new PendingEntry(consumer, now, pending.getValue().deliveries + 1));
                claimed.add(new StreamEntry(stream, pending.getKey(), fields));
            }
            deleted.forEach(state.pending::remove);
            return new ClaimResult(claimed, next != null ? next.toString() : ClaimResult.SCAN_START);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long trimByMinId(String stream, StreamEntryId minId) {
        lock.lock();
        try {
            StreamLog streamLog = streams.get(stream);
            if (streamLog == null) {
                return 0;
            }
            NavigableMap<StreamEntryId, Map<String, String>> older = streamLog.entries.headMap(minId, false);
            int removed = older.size();
            older.clear();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long trimByMaxLength(String stream, long maxLength) {
        lock.lock();
        try {
            StreamLog streamLog = streams.get(stream);
            return streamLog == null ? 0 : streamLog.trimToLength(maxLength);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public StreamInfo info(String stream) {
        lock.lock();
        try {
            StreamLog streamLog = streams.get(stream);
            if (streamLog == null) {
                return new StreamInfo(0, null);
            }
            return new StreamInfo(streamLog.entries.size(), streamLog.lastId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long pendingCount(String stream, String group) {
        lock.lock();
        try {
            return requireGroup(stream, group).pending.size();
        } finally {
            lock.unlock();
        }
    }

    /** Oldest retained entry id, for inspection in tests and diagnostics. */
    public StreamEntryId firstEntryId(String stream) {
        lock.lock();
        try {
            StreamLog streamLog = streams.get(stream);
            return streamLog == null || streamLog.entries.isEmpty() ? null : streamLog.entries.firstKey();
        } finally {
            lock.unlock();
        }
    }

    private GroupState requireGroup(String stream, String group) {
        StreamLog streamLog = streams.get(stream);
        GroupState state = streamLog != null ? streamLog.groups.get(group) : null;
        if (state == null) {
            throw new StreamBrokerException("NOGROUP no consumer group " + group + " for stream " + stream);
        }
        return state;
    }

    private static final class StreamLog {
        private final TreeMap<StreamEntryId, Map<String, String>> entries = new TreeMap<>();
        private final Map<String, GroupState> groups = new HashMap<>();
        private StreamEntryId lastId;

        private StreamEntryId nextId(long nowMillis) {
            if (lastId == null || nowMillis > lastId.millis()) {
                return new StreamEntryId(nowMillis, 0);
            }
            return new StreamEntryId(lastId.millis(), lastId.sequence() + 1);
        }

        private long trimToLength(long maxLength) {
            long removed = 0;
            while (entries.size() > maxLength) {
                entries.pollFirstEntry();
                removed++;
            }
            return removed;
        }
    }

    private static final class GroupState {
        private final TreeMap<StreamEntryId, PendingEntry> pending = new TreeMap<>();
        private StreamEntryId lastDelivered = StreamEntryId.ZERO;
    }

    private static final class PendingEntry {
        private final String consumer;
        private final Instant deliveredAt;
        private final int deliveries;

        private PendingEntry(String consumer, Instant deliveredAt) {
            this(consumer, deliveredAt, 1);
        }

        private PendingEntry(String consumer, Instant deliveredAt, int deliveries) {
            this.consumer = consumer;
            this.deliveredAt = deliveredAt;
            this.deliveries = deliveries;
        }

        @Override
        public String toString() {
            return consumer + "@" + deliveredAt + "#" + deliveries;
        }
    }
}
