package com.piperplatform.orchestrator.session;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * The single owned inactivity timer of a session.
 *
 * <p>{@link #start} always replaces any pending countdown. A countdown that was
 * cancelled or replaced never fires, even if its tick was already in flight.
 */
public class InactivityTimer {

    private final Scheduler scheduler;

    private Disposable pending;
    private long       generation;
    private Duration   timeout;

    public InactivityTimer(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * (Re)starts the countdown. {@code onFire} runs at most once, on the scheduler thread.
     */
    public synchronized void start(Duration timeout, Runnable onFire) {
        cancel();
        long armed = ++generation;
        this.timeout = timeout;
        this.pending = Mono.delay(timeout, scheduler)
            .subscribe(tick -> fire(armed, onFire));
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.dispose();
            pending = null;
        }
        generation++;
    }

    public synchronized boolean isRunning() {
        return pending != null;
    }

    /** Duration of the last started countdown, null before the first start. */
    public synchronized Duration currentTimeout() {
        return timeout;
    }

    private void fire(long armed, Runnable onFire) {
        synchronized (this) {
            if (armed != generation) {
                return;
            }
            pending = null;
        }
        onFire.run();
    }
}
