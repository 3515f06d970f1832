package com.tradeguard.stream;

import java.util.Map;

/** One delivered stream entry. Field values are flat strings as stored by the broker. */
public record StreamEntry(String stream, StreamEntryId id, Map<String, String> fields) {

    public String field(String name) {
        return fields.get(name);
    }

    public String eventType() {
        return fields.get(StreamPublisher.FIELD_EVENT_TYPE);
    }
}
