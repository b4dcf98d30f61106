package com.qqsuccubus.chat.socket.ws;

import com.qqsuccubus.chat.socket.auth.AuthenticationGate;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.error.AuthenticationException;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Arrays;

/**
 * Checks origin and credentials before upgrading to WebSocket.
 * <p>
 * A rejected request never reaches the WebSocket handler, so no session state is created:
 * a foreign {@code Origin} gets 403, a missing or invalid token gets 401.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    static final String AUTH_ERROR = "Authentication error";

    private final SocketConfig config;
    private final AuthenticationGate authenticationGate;
    private final ChatWebSocketHandler wsHandler;
    private final MetricsService metricsService;

    public WebSocketUpgradeHandler(
            SocketConfig config,
            AuthenticationGate authenticationGate,
            ChatWebSocketHandler wsHandler,
            MetricsService metricsService
    ) {
        this.config = config;
        this.authenticationGate = authenticationGate;
        this.wsHandler = wsHandler;
        this.metricsService = metricsService;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        String origin = req.requestHeaders().get(HttpHeaderNames.ORIGIN);
        if (!isOriginAllowed(origin)) {
            log.warn("Rejecting WebSocket upgrade from origin {}", origin);
            metricsService.recordConnectionRejected("origin");
            return res.status(403)
                .sendString(Mono.just("Origin not allowed"))
                .then();
        }

        return authenticationGate.authenticate(req)
            .flatMap(userId -> res.sendWebsocket((inbound, outbound) ->
                wsHandler.handle(inbound, outbound, userId)
            ))
            .onErrorResume(AuthenticationException.class, err -> {
                metricsService.recordConnectionRejected(err.reason());
                return res.status(401)
                    .sendString(Mono.just(AUTH_ERROR))
                    .then();
            });
    }

    /**
     * Requests without an {@code Origin} header (non-browser clients) are allowed.
     */
    boolean isOriginAllowed(String origin) {
        if (origin == null || config.allowsAnyOrigin()) {
            return true;
        }
        String normalized = stripTrailingSlash(origin.trim());
        return Arrays.stream(config.getFrontendUrl().split(","))
            .map(String::trim)
            .map(WebSocketUpgradeHandler::stripTrailingSlash)
            .anyMatch(normalized::equalsIgnoreCase);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
