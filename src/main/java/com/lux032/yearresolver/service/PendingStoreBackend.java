package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.PendingEntry;

import java.io.IOException;
import java.util.List;

/**
 * Durable table behind {@link PendingVerificationStore}.
 * The store always writes its full state, backends replace what they hold.
 */
public interface PendingStoreBackend {

    List<PendingEntry> loadAll() throws IOException;

    void saveAll(List<PendingEntry> entries) throws IOException;

    /** Human readable location, for logs. */
    String describe();
}
