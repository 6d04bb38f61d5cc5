package com.lux032.yearresolver.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One album waiting for year re-verification.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingEntry {

    private LocalDateTime timestamp;
    private String artist;
    private String album;
    private VerificationReason reason;

    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    @Builder.Default
    private int attemptCount = 1;
}
