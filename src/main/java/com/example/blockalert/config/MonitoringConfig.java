package com.example.blockalert.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    /**
     * Pre-registers the alert engine meters so they show up before the first event.
     */
    @Bean
    public MeterBinder alertMetrics() {
        return registry -> {
            registry.counter("blockalert.alerts.sent", "status", "success");
            registry.counter("blockalert.alerts.sent", "status", "partial");
            registry.counter("blockalert.alerts.rejected", "reason", "quota");
            registry.counter("blockalert.alerts.rejected", "reason", "not_found");
            registry.counter("blockalert.alerts.responded");
            registry.counter("blockalert.alerts.acknowledged");
            registry.counter("blockalert.push.sent", "status", "success");
            registry.counter("blockalert.push.sent", "status", "failed");
            Timer.builder("blockalert.fanout.latency")
                    .description("Time taken to write all rows of one alert fan-out")
                    .register(registry);
        };
    }

    @Bean
    public AlertMetricsCollector alertMetricsCollector(MeterRegistry registry) {
        return new AlertMetricsCollector(registry);
    }

    public static class AlertMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public AlertMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long durationMillis, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMillis, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, long value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            gauges.computeIfAbsent(key, k -> {
                AtomicLong gauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), gauge);
                return gauge;
            }).set(value);
        }

        public long getCounterValue(String name, String... tags) {
            Counter counter = counters.get(name + "_" + String.join("_", tags));
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
