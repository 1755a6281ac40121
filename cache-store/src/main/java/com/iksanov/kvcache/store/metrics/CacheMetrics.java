package com.iksanov.kvcache.store.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;

/**
 * Micrometer meters shared by every cache store, exposed in Prometheus format.
 */
public class CacheMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter cacheExpirations;
    private final Timer getLatency;
    private final Timer setLatency;

    public CacheMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.cacheHits = Counter.builder("cache.hits")
                .description("Number of cache hits")
                .register(registry);

        this.cacheMisses = Counter.builder("cache.misses")
                .description("Number of cache misses")
                .register(registry);

        this.cacheExpirations = Counter.builder("cache.expirations")
                .description("Number of entries found expired on read")
                .register(registry);

        this.getLatency = Timer.builder("cache.get.duration")
                .description("GET operation duration")
                .serviceLevelObjectives(
                    Duration.ofMillis(1),
                    Duration.ofMillis(5),
                    Duration.ofMillis(10),
                    Duration.ofMillis(50),
                    Duration.ofMillis(100)
                )
                .register(registry);

        this.setLatency = Timer.builder("cache.set.duration")
                .description("SET operation duration")
                .serviceLevelObjectives(
                    Duration.ofMillis(1),
                    Duration.ofMillis(5),
                    Duration.ofMillis(10),
                    Duration.ofMillis(50),
                    Duration.ofMillis(100)
                )
                .register(registry);

        Gauge.builder("cache.hit.rate", this, CacheMetrics::hitRate)
                .description("Cache hit rate percentage")
                .register(registry);
    }

    public void recordHit() {
        cacheHits.increment();
    }

    public void recordMiss() {
        cacheMisses.increment();
    }

    public void recordExpiration() {
        cacheExpirations.increment();
    }

    public Timer.Sample startGetTimer() {
        return Timer.start(registry);
    }

    public void stopGetTimer(Timer.Sample sample) {
        sample.stop(getLatency);
    }

    public Timer.Sample startSetTimer() {
        return Timer.start(registry);
    }

    public void stopSetTimer(Timer.Sample sample) {
        sample.stop(setLatency);
    }

    public double hitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        return total == 0 ? 0.0 : (hits / total) * 100.0;
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
