package com.chartbot.automation;

import com.chartbot.ai.ChatModelRegistry;
import com.chartbot.automation.error.ConfigurationException;
import com.chartbot.automation.error.MissingCredentialsException;
import com.chartbot.model.JobContext;
import com.chartbot.model.JobStatus;
import com.chartbot.model.JobTrigger;
import com.chartbot.model.Layout;
import com.chartbot.model.Schedule;
import com.chartbot.model.UserAccount;
import com.chartbot.security.CredentialCipher;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobBuilderTest {
    private static final String KEY = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";
    private static final String OTHER_KEY = "ffeeddccbbaa99887766554433221100ffeeddccbbaa99887766554433221100";
    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private final InMemoryStore store = new InMemoryStore();
    private final ChatModelRegistry registry = new ChatModelRegistry(
            Map.of("ollama", new StubAdapters.EchoModel(), "openai", new StubAdapters.EchoModel()),
            "ollama"
    );

    @Test
    void build_shouldDecodeEnvelopeCredentialsAndCopySettings() throws Exception {
        CredentialCipher cipher = CredentialCipher.fromHexKey(KEY);
        store.putLayout(new Layout("l1", "u1", "tv-123", "BINANCE:BTCUSDT", "4h"));
        store.putAccount(new UserAccount("u1", cipher.seal("sess"), cipher.seal("sign"), "chat-9", false, true, "openai"));
        Schedule schedule = schedule("l1");

        JobContext context = new JobBuilder(store, cipher, registry).build(schedule, JobTrigger.TICK, NOW);

        assertEquals("tv-123", context.captureTargetId);
        assertEquals("sess", context.credentials.sessionId);
        assertEquals("sign", context.credentials.sessionIdSign);
        assertEquals("BINANCE:BTCUSDT", context.symbol);
        assertEquals("openai", context.model);
        assertNotNull(context.target);
        assertEquals("chat-9", context.target.chatId);
        assertEquals(false, context.target.includeChart);
        assertEquals(NOW, context.startedAt);
        assertEquals(schedule.minConfidence, context.schedule.minConfidence);
    }

    @Test
    void build_shouldFallBackToDefaultModelAndOmitTargetWithoutChat() throws Exception {
        store.putLayout(new Layout("l1", "u1", "tv-123", null, null));
        store.putAccount(new UserAccount("u1", "plain-session", "plain-sign", " ", true, true, "gemini"));

        JobContext context = new JobBuilder(store, CredentialCipher.fromHexKey(""), registry)
                .build(schedule("l1"), JobTrigger.MANUAL, NOW);

        assertEquals("ollama", context.model);
        assertNull(context.target);
        assertEquals("plain-session", context.credentials.sessionId);
        assertTrue(!context.hasSymbol());
        assertNull(context.interval);
    }

    @Test
    void build_shouldAbortWhenTaggedCredentialWasSealedUnderAnotherKey() throws Exception {
        CredentialCipher sealer = CredentialCipher.fromHexKey(OTHER_KEY);
        JobBuilder builder = new JobBuilder(store, CredentialCipher.fromHexKey(KEY), registry);
        store.putLayout(new Layout("l1", "u1", "tv-123", "FX:EURUSD", "1h"));

        int rejected = 0;
        for (int i = 0; i < 16; i++) {
            store.putAccount(new UserAccount("u1", sealer.seal("sess"), "plain-sign", "chat", true, true, null));
            try {
                JobContext context = builder.build(schedule("l1"), JobTrigger.TICK, NOW);
                // CBC under the wrong key still ends in valid padding about once in 256 seals
                assertNotEquals("sess", context.credentials.sessionId);
            } catch (ConfigurationException e) {
                assertEquals(JobStatus.CAPTURE_FAILED, e.jobStatus());
                assertTrue(e.getMessage().contains("decryption failed"));
                rejected++;
            }
        }

        assertTrue(rejected > 0);
    }

    @Test
    void build_shouldFailFastWithoutCaptureTarget() {
        store.putLayout(new Layout("l1", "u1", "  ", "FX:EURUSD", "1h"));
        store.putAccount(new UserAccount("u1", "s", "t", "chat", true, true, null));

        MissingCredentialsException e = assertThrows(MissingCredentialsException.class,
                () -> new JobBuilder(store, CredentialCipher.fromHexKey(""), registry).build(schedule("l1"), JobTrigger.TICK, NOW));

        assertEquals(JobStatus.CAPTURE_FAILED, e.jobStatus());
    }

    @Test
    void build_shouldFailFastWithoutSessionCredentials() {
        store.putLayout(new Layout("l1", "u1", "tv-1", "FX:EURUSD", "1h"));
        store.putAccount(new UserAccount("u1", "s", null, "chat", true, true, null));

        assertThrows(MissingCredentialsException.class,
                () -> new JobBuilder(store, CredentialCipher.fromHexKey(""), registry).build(schedule("l1"), JobTrigger.TICK, NOW));
    }

    @Test
    void build_shouldRejectSealedCredentialsWhenNoKeyIsConfigured() throws Exception {
        CredentialCipher sealing = CredentialCipher.fromHexKey(KEY);
        store.putLayout(new Layout("l1", "u1", "tv-1", "FX:EURUSD", "1h"));
        store.putAccount(new UserAccount("u1", sealing.seal("sess"), sealing.seal("sign"), null, true, true, null));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new JobBuilder(store, CredentialCipher.fromHexKey(""), registry).build(schedule("l1"), JobTrigger.TICK, NOW));

        assertTrue(e.getMessage().contains("encryption-key"));
    }

    @Test
    void build_shouldReportMissingLayoutAsConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> new JobBuilder(store, CredentialCipher.fromHexKey(""), registry).build(schedule("nope"), JobTrigger.TICK, NOW));
    }

    private static Schedule schedule(String layoutId) {
        return PipelineFixture.schedule().id(7L).userId("u1").layoutId(layoutId).minConfidence(65).build();
    }
}
