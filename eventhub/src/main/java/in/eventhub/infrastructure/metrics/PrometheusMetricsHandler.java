package in.eventhub.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;

/**
 * HTTP handler for the Prometheus /metrics endpoint.
 *
 * Example output:
 * <pre>
 * # HELP realtime_connections_active Live WebSocket connections on this instance
 * # TYPE realtime_connections_active gauge
 * realtime_connections_active 42.0
 * realtime_messages_sent_total{type="event"} 1234.0
 * realtime_messages_dropped_total{reason="rate_limited"} 7.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        try {
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String metricsOutput = writer.toString();

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(metricsOutput);

            log.debug("[METRICS] Served metrics ({} bytes)", metricsOutput.length());

        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
