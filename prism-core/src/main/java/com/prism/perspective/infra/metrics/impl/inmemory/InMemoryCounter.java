package com.prism.perspective.infra.metrics.impl.inmemory;

import com.prism.perspective.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

/**
 * Counter backed by a {@link LongAdder}; engine steps on the reference fetch pool bump it concurrently.
 */
final class InMemoryCounter implements Counter {
    private final LongAdder adder = new LongAdder();

    @Override
    public void increment() {
        adder.increment();
    }

    long count() {
        return adder.sum();
    }
}
