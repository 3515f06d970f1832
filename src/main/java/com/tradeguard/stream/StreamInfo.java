package com.tradeguard.stream;

import java.util.Optional;

public record StreamInfo(long length, StreamEntryId lastEntryId) {

    public Optional<StreamEntryId> lastEntry() {
        return Optional.ofNullable(lastEntryId);
    }
}
