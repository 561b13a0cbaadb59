package com.prism.perspective.infra.metrics.impl.inmemory;

import com.prism.perspective.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {
    private volatile double value;

    @Override
    public void set(double value) {
        this.value = value;
    }

    double value() {
        return value;
    }
}
