package com.chartbot.store;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.model.Layout;
import com.chartbot.model.UserAccount;

import java.util.Optional;

/**
 * Read-only access to layouts and accounts owned by the surrounding application.
 */
public interface AccountRepository {
    Optional<Layout> findLayout(String layoutId) throws PersistenceException;

    Optional<UserAccount> findAccount(String userId) throws PersistenceException;
}
