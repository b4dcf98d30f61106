package com.qqsuccubus.chat.socket.ws;

import com.qqsuccubus.chat.core.util.BytesUtils;
import com.qqsuccubus.chat.core.util.JsonUtils;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.router.EventRouter;
import com.qqsuccubus.chat.socket.session.Connection;
import com.qqsuccubus.chat.socket.session.SessionLifecycle;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * Drives one authenticated WebSocket connection.
 * <p>
 * Every frame in both directions is a JSON text frame {@code {"event": ..., "data": ...}}.
 * Server → client: user_status, new_message, typing, messages_read, error.
 * Client → server: send_message, typing, read_message, ping.
 * </p>
 * <p>
 * Inbound frames of one connection are handled strictly in order. Closing the transport, for
 * whatever reason, tears the session down through {@link SessionLifecycle#disconnect}.
 * </p>
 */
public class ChatWebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

	private final SocketConfig config;
	private final SessionLifecycle sessionLifecycle;
	private final EventRouter eventRouter;
	private final MetricsService metricsService;

	public ChatWebSocketHandler(
			SocketConfig config,
			SessionLifecycle sessionLifecycle,
			EventRouter eventRouter,
			MetricsService metricsService
	) {
		this.config = config;
		this.sessionLifecycle = sessionLifecycle;
		this.eventRouter = eventRouter;
		this.metricsService = metricsService;
	}

	/**
	 * Handles the connection of an already authenticated user.
	 *
	 * @param inbound  WebSocket inbound
	 * @param outbound WebSocket outbound
	 * @param userId   user id taken from the verified token
	 * @return Publisher completing when the connection ends
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, String userId) {
		MDC.put("userId", userId);
		log.debug("WebSocket established for user {}", userId);

		return sessionLifecycle.connect(userId)
				.flatMap(connection -> {
					bindTransportState(inbound, outbound, connection);

					return Mono.when(
							outbound.sendString(outboundFrames(connection)),
							inboundFrames(inbound, connection)
					);
				})
				.onErrorResume(err -> {
					log.error("WebSocket error for user {}", userId, err);
					return outbound.sendClose();
				});
	}

	private void bindTransportState(WebsocketInbound inbound, WebsocketOutbound outbound, Connection connection) {
		inbound.withConnection(transport -> {
			long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
			long pingIntervalInMillis = config.getPingInterval() * 1000L;

			transport.onWriteIdle(pingIntervalInMillis, () -> transport.outbound().sendObject(
							Mono.just(new PingWebSocketFrame())
					).then().subscribe())
					.onReadIdle(idleTimeoutInMillis, () -> {
						log.debug("No traffic from {} for {} s, closing", connection, config.getIdleTimeout());
						outbound.sendClose().subscribe();
					})
					.onDispose(() -> {
						log.debug("Transport of {} disposed, removing session", connection);
						sessionLifecycle.disconnect(connection);
					});
		});
	}

	private Flux<String> outboundFrames(Connection connection) {
		return connection.outbound()
				.map(JsonUtils::writeValueAsString)
				.doOnNext(text -> metricsService.recordNetworkOutboundWs(BytesUtils.utf8Length(text)));
	}

	private Mono<Void> inboundFrames(WebsocketInbound inbound, Connection connection) {
		return inbound.aggregateFrames()
				.receive()
				.asString()
				.doOnNext(text -> metricsService.recordNetworkInboundWs(BytesUtils.utf8Length(text)))
				.concatMap(text -> eventRouter.handleInbound(connection, text))
				.doOnError(err -> {
					// AbortedException is expected on close
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream of {}", connection, err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.then();
	}
}
