package org.iceforge.assetcache.prewarm;

import reactor.core.publisher.Mono;

/**
 * Gate for background work that must not compete with interactive traffic.
 */
@FunctionalInterface
public interface IdleScheduler {

    /**
     * Completes when the host has spare capacity, or when the implementation's maximum wait has
     * elapsed. Never errors.
     */
    Mono<Void> whenIdle();

    static IdleScheduler immediate() {
        return Mono::empty;
    }
}
