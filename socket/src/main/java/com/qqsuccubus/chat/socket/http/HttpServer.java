package com.qqsuccubus.chat.socket.http;

import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.chat.socket.store.ChatStore;
import com.qqsuccubus.chat.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private final ChatStore store;
    private DisposableServer server;

    /**
     * Starts the HTTP server and blocks until it is bound.
     *
     * @return the bound server; port 0 in the config binds an ephemeral port
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/health", (req, res) -> res.status(200)
                    .header("Content-Type", "application/json")
                    .sendString(Mono.just("{\"status\":\"ok\"}")))
                // Liveness
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Readiness requires a reachable store
                .get("/readyz", (req, res) -> store.ping()
                    .then(Mono.just(true))
                    .onErrorResume(err -> {
                        log.warn("Readiness check failed: {}", err.toString());
                        return Mono.just(false);
                    })
                    .flatMap(ready -> ready
                        ? res.status(200).sendString(Mono.just("Ready")).then()
                        : res.status(503).sendString(Mono.just("Not Ready - store unavailable")).then()))
                // Metrics endpoint with Prometheus scraping
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/ws", upgradeHandler::handle)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
