package com.flagship.smart_sync.rail;

import lombok.Value;

import java.util.List;

/**
 * A page of records from a rail, oldest modification first.
 */
@Value
public class RailPage {
    List<RailRecord> records;
    String nextPageToken;       // null on the last page

    public boolean hasMore() {
        return nextPageToken != null;
    }

    public static RailPage last(List<RailRecord> records) {
        return new RailPage(records, null);
    }
}
