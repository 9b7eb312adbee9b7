package com.chartbot.store;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.model.EconomicContext;

import java.util.Optional;

public interface EconomicContextRepository {
    /**
     * Upserts keyed by signal id.
     */
    EconomicContext upsert(EconomicContext context) throws PersistenceException;

    Optional<EconomicContext> findBySignalId(long signalId) throws PersistenceException;
}
