package com.linkresolver.resolver.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class ResolutionMetrics {

    private final MeterRegistry registry;
    private final Counter requests;
    private final Counter cacheHits;
    private final Counter unresolved;
    private final Counter errors;
    private final Timer latency;

    public ResolutionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.requests = Counter.builder("link_resolution_requests_total")
                .description("Link resolution requests")
                .tag("resolver", "aggregator")
                .register(registry);

        this.cacheHits = Counter.builder("link_resolution_cache_hits_total")
                .description("Link resolutions served from cache")
                .tag("resolver", "aggregator")
                .register(registry);

        this.unresolved = Counter.builder("link_resolution_unresolved_total")
                .description("Links returned unresolved after all strategies failed")
                .tag("resolver", "aggregator")
                .register(registry);

        this.errors = Counter.builder("link_resolution_errors_total")
                .description("Unexpected errors caught by the resolver")
                .tag("resolver", "aggregator")
                .register(registry);

        this.latency = Timer.builder("link_resolution_latency_seconds")
                .description("Link resolution latency")
                .tag("resolver", "aggregator")
                .register(registry);
    }

    public void onRequest() { requests.increment(); }
    public void onCacheHit() { cacheHits.increment(); }
    public void onUnresolved() { unresolved.increment(); }
    public void onError() { errors.increment(); }

    public void onSuccess(String strategy) {
        Counter.builder("link_resolution_success_total")
                .description("Successful link resolutions by strategy")
                .tag("resolver", "aggregator")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public <T> T recordLatency(Supplier<T> supplier) {
        return latency.record(supplier);
    }
}
