package com.chartbot.automation;

import com.chartbot.automation.error.AutomationException;
import com.chartbot.automation.error.CaptureException;
import com.chartbot.data.capture.ChartCaptureClient;
import com.chartbot.model.ImageRef;
import com.chartbot.model.JobContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;

/**
 * Captures the layout's chart. Concurrent captures are capped by a shared semaphore; callers over the
 * cap queue for a permit. The wait for a permit is not part of the capture timeout.
 */
public final class CaptureStage {
    private static final Logger LOG = LogManager.getLogger(CaptureStage.class);

    private final ChartCaptureClient client;
    private final Timebox timebox;
    private final Semaphore captureSlots;
    private final Duration timeout;
    private final Clock clock;

    public CaptureStage(ChartCaptureClient client, Timebox timebox, int captureConcurrency, Duration timeout, Clock clock) {
        this.client = client;
        this.timebox = timebox;
        this.captureSlots = new Semaphore(Math.max(1, captureConcurrency), true);
        this.timeout = timeout;
        this.clock = clock;
    }

    public ImageRef capture(JobContext context) throws CaptureException, InterruptedException {
        captureSlots.acquire();
        try {
            ChartCaptureClient.CapturedChart chart = timebox.call(
                    timeout,
                    () -> client.capture(context.captureTargetId, context.credentials)
            );
            if (chart == null || chart.bytes() == null || chart.bytes().length == 0) {
                throw new CaptureException("capture returned no image for layout " + context.layoutId);
            }
            ImageRef image = new ImageRef(
                    captureKey(context.layoutId, chart.bytes()),
                    chart.mimeType(),
                    chart.bytes(),
                    clock.instant(),
                    chart.sourceUrl()
            );
            LOG.debug("capture ok {} bytes={} key={}", context.logTag(), image.size(), image.captureKey);
            return image;
        } catch (TimeoutException e) {
            throw new CaptureException("capture timed out after " + timeout.toSeconds() + "s");
        } catch (CaptureException e) {
            throw e;
        } catch (AutomationException | RuntimeException e) {
            throw new CaptureException("capture failed: " + e.getMessage(), e);
        } finally {
            captureSlots.release();
        }
    }

    int availableSlots() {
        return captureSlots.availablePermits();
    }

    /**
     * Content-derived identity: the same image for the same layout always maps to the same key.
     */
    static String captureKey(String layoutId, byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update((layoutId == null ? "" : layoutId).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(bytes);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
