package com.chartbot.automation;

import com.chartbot.automation.error.AutomationException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage call on a helper thread and gives up on it after a deadline.
 * A timed-out call is interrupted; only the calling job is affected.
 */
public final class Timebox {
    private final ExecutorService executor;

    public Timebox(ExecutorService executor) {
        this.executor = executor;
    }

    <T> T call(Duration timeout, StageCall<T> call)
            throws AutomationException, TimeoutException, InterruptedException {
        Callable<T> task = call::call;
        Future<T> future = executor.submit(task);
        try {
            return future.get(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof AutomationException) {
                throw (AutomationException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }
}
