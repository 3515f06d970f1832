package com.tradeguard.stream.handler;

import com.tradeguard.stream.EventStreamCatalog;
import com.tradeguard.stream.EventStreamConfig;
import com.tradeguard.stream.StreamEntry;
import com.tradeguard.stream.StreamEventHandler;
import com.tradeguard.stream.StreamTrimmer;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trims streams. Runs over the whole catalog on every fallback cycle; a
 * CLEANUP_REQUEST event trims the stream named in its {@code stream} field, or
 * every stream when the field is absent.
 */
public class StreamCleanupHandler implements StreamEventHandler {

    private static final Logger log = LoggerFactory.getLogger(StreamCleanupHandler.class);

    private final StreamTrimmer trimmer;

    public StreamCleanupHandler(StreamTrimmer trimmer) {
        this.trimmer = trimmer;
    }

    @Override
    public String serviceName() {
        return EventStreamCatalog.CLEANUP_SERVICE;
    }

    @Override
    public void handle(StreamEntry entry) {
        String target = entry.field("stream");
        if (target == null) {
            trimAll();
            return;
        }
        Optional<EventStreamConfig> config = EventStreamCatalog.stream(target);
        if (config.isEmpty()) {
            log.warn("Cleanup request {} names unknown stream {}", entry.id(), target);
            return;
        }
        trimmer.trim(config.get());
    }

    @Override
    public void runFallback() {
        trimAll();
    }

    private void trimAll() {
        List<StreamTrimmer.TrimResult> results = trimmer.trimAll();
        long removed = results.stream().mapToLong(r -> r.removedByAge() + r.removedByLength()).sum();
        log.info("Stream cleanup finished: {} streams, {} entries removed", results.size(), removed);
    }
}
