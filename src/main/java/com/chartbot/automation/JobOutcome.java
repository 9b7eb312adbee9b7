package com.chartbot.automation;

import com.chartbot.automation.error.AutomationException;
import com.chartbot.model.DecisionReason;
import com.chartbot.model.JobStatus;
import com.chartbot.model.Signal;

/**
 * Where a job ended. {@code signal} is set once analysis produced one; {@code evaluated} once the gate ran on it.
 */
public final class JobOutcome {
    public final JobStatus status;
    public final Signal signal;
    public final boolean evaluated;
    public final DecisionReason reason;
    public final boolean telegramSent;
    public final String error;

    private JobOutcome(JobStatus status, Signal signal, boolean evaluated, DecisionReason reason, boolean telegramSent, String error) {
        this.status = status;
        this.signal = signal;
        this.evaluated = evaluated;
        this.reason = reason;
        this.telegramSent = telegramSent;
        this.error = AutomationException.shorten(error);
    }

    public static JobOutcome sent(Signal signal) {
        return new JobOutcome(JobStatus.SUCCESS, signal, true, DecisionReason.SEND, true, null);
    }

    public static JobOutcome suppressed(Signal signal, DecisionReason reason) {
        return new JobOutcome(JobStatus.SUPPRESSED, signal, true, reason, false, null);
    }

    public static JobOutcome dispatchFailed(Signal signal, String error) {
        return new JobOutcome(JobStatus.DISPATCH_FAILED, signal, true, DecisionReason.SEND, false, error);
    }

    public static JobOutcome failed(AutomationException e, Signal signal) {
        return new JobOutcome(e.jobStatus(), signal, false, null, false, e.shortDetail());
    }

    public static JobOutcome incomplete(String error, Signal signal) {
        return new JobOutcome(JobStatus.INCOMPLETE, signal, false, null, false, error);
    }

    @Override
    public String toString() {
        return "JobOutcome{status=" + status.label()
                + ", reason=" + (reason == null ? "-" : reason.label())
                + ", telegramSent=" + telegramSent
                + ", error=" + (error == null ? "-" : error)
                + "}";
    }
}
