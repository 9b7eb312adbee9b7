package com.chartbot.automation;

import com.chartbot.ai.ChatModelRegistry;
import com.chartbot.automation.error.ConfigurationException;
import com.chartbot.automation.error.MissingCredentialsException;
import com.chartbot.automation.error.PersistenceException;
import com.chartbot.model.JobContext;
import com.chartbot.model.JobTrigger;
import com.chartbot.model.Layout;
import com.chartbot.model.Schedule;
import com.chartbot.model.SessionCredentials;
import com.chartbot.model.TelegramTarget;
import com.chartbot.model.UserAccount;
import com.chartbot.security.CredentialCipher;
import com.chartbot.store.AccountRepository;

import java.time.Instant;

/**
 * Resolves everything a job needs before the first external call, so a misconfigured schedule
 * fails without touching the capture service.
 */
public final class JobBuilder {
    private final AccountRepository accounts;
    private final CredentialCipher cipher;
    private final ChatModelRegistry models;

    public JobBuilder(AccountRepository accounts, CredentialCipher cipher, ChatModelRegistry models) {
        this.accounts = accounts;
        this.cipher = cipher;
        this.models = models;
    }

    public JobContext build(Schedule schedule, JobTrigger trigger, Instant startedAt)
            throws ConfigurationException, PersistenceException {
        Layout layout = accounts.findLayout(schedule.layoutId)
                .orElseThrow(() -> new ConfigurationException("layout not found: " + schedule.layoutId));
        if (isBlank(layout.captureTargetId)) {
            throw new MissingCredentialsException("layout " + layout.id + " has no capture target id");
        }
        UserAccount account = accounts.findAccount(schedule.userId)
                .orElseThrow(() -> new MissingCredentialsException("user not found: " + schedule.userId));

        String sessionId = cipher.open(account.storedSessionId);
        String sessionIdSign = cipher.open(account.storedSessionIdSign);
        if (isBlank(sessionId) || isBlank(sessionIdSign)) {
            throw new MissingCredentialsException("user " + account.id + " has no chart session credentials");
        }

        TelegramTarget target = isBlank(account.telegramChatId)
                ? null
                : new TelegramTarget(account.telegramChatId.trim(), account.includeChart, account.includeEconomic);

        return new JobContext(
                schedule,
                layout.id,
                layout.captureTargetId.trim(),
                blankToNull(layout.symbol),
                blankToNull(layout.interval),
                new SessionCredentials(sessionId, sessionIdSign),
                target,
                models.select(account.preferredModel),
                trigger,
                startedAt
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
