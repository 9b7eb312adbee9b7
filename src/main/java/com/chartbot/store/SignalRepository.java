package com.chartbot.store;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.model.Signal;

import java.util.Optional;

public interface SignalRepository {
    /**
     * Upserts keyed by capture key; a second call with the same key overwrites, never duplicates.
     */
    Signal upsert(Signal signal) throws PersistenceException;

    Optional<Signal> findByCaptureKey(String captureKey) throws PersistenceException;
}
