package io.github.drompincen.devicebridge.runtime.agent;

import java.util.concurrent.atomic.AtomicBoolean;

/** One-shot cancellation flag shared between a run and whoever may stop it. */
public class AbortSignal {

    private final AtomicBoolean aborted = new AtomicBoolean();

    public static AbortSignal none() {
        return new AbortSignal();
    }

    public void abort() {
        aborted.set(true);
    }

    public boolean isAborted() {
        return aborted.get();
    }
}
