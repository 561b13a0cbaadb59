package com.prism.perspective.infra.metrics.impl.inmemory;

import com.prism.perspective.infra.metrics.Counter;
import com.prism.perspective.infra.metrics.Gauge;
import com.prism.perspective.infra.metrics.MetricsRegistry;
import com.prism.perspective.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry that keeps values in memory for assertions. Meters are keyed by name
 * and tags, so {@code timer("pipeline_step_duration", "step", "plan")} and the
 * same timer for another step are distinct.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = (InMemoryMetricsRegistry) MetricsRegistry.getInstance();
 * assertThat(metrics.counterValue("nested_criteria_unresolved")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    public long counterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double gaugeValue(String name, String... tags) {
        InMemoryGauge gauge = gauges.get(key(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> timerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.recordings() : List.of();
    }

    /**
     * Keys of every meter created so far, in {@code name{k=v,...}} form.
     */
    public Set<String> meterKeys() {
        Set<String> out = new TreeSet<>(counters.keySet());
        out.addAll(gauges.keySet());
        out.addAll(timers.keySet());
        return out;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    static String key(String name, String... tags) {
        if (tags == null || tags.length == 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        for (int i = 0; i + 1 < tags.length; i += 2) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return sb.append('}').toString();
    }
}
