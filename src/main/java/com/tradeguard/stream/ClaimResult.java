package com.tradeguard.stream;

import java.util.List;

/**
 * One batch of reclaimed pending entries. {@code nextCursor} is where the next
 * claim scan starts; {@code 0-0} means the pending list was scanned to the end.
 */
public record ClaimResult(List<StreamEntry> entries, String nextCursor) {

    public static final String SCAN_START = "0-0";

    public boolean isScanComplete() {
        return SCAN_START.equals(nextCursor);
    }
}
