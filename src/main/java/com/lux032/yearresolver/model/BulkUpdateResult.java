package com.lux032.yearresolver.model;

import lombok.Value;

import java.util.Collections;
import java.util.Set;

@Value
public class BulkUpdateResult {

    int successCount;
    int failureCount;
    Set<String> failedIds;

    public static BulkUpdateResult empty() {
        return new BulkUpdateResult(0, 0, Collections.emptySet());
    }

    public boolean isFailed(String trackId) {
        return failedIds.contains(trackId);
    }
}
