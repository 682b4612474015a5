package com.qqsuccubus.social.socket.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes the node's meters in Prometheus text format.
 * <p>
 * Registers a Prometheus registry into the global composite that Reactor Netty also reports to,
 * so HTTP server meters and application meters are scraped together.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        registry.config().commonTags("service", "social-rtc");
        log.info("Metrics exporter initialized for node {} with global registry + Prometheus", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
