package com.churnguard.intervention.schedule;

import com.churnguard.common.exception.CycleInProgressException;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * At most one in-flight cycle per loop.
 *
 * <p>Non-blocking try-acquire: a caller that finds the loop busy gets a
 * {@link CycleInProgressException} signal immediately instead of waiting. The guard is
 * released when the cycle terminates, whether by completion, error or cancellation.
 */
public class CycleGuard {

    private final String loopName;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CycleGuard(String loopName) {
        this.loopName = loopName;
    }

    /**
     * Acquisition happens on subscription, so an unsubscribed Mono holds nothing.
     */
    public <T> Mono<T> runExclusive(Supplier<Mono<T>> cycle) {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                return Mono.error(new CycleInProgressException(loopName));
            }
            return Mono.defer(cycle)
                .doFinally(signal -> running.set(false));
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    public String loopName() {
        return loopName;
    }
}
