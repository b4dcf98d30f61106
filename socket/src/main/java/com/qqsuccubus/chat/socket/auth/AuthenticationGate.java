package com.qqsuccubus.chat.socket.auth;

import com.qqsuccubus.chat.core.model.UserStatus;
import com.qqsuccubus.chat.socket.error.AuthenticationException;
import com.qqsuccubus.chat.socket.store.ChatStore;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;

import java.util.Collection;
import java.util.stream.Stream;

/**
 * Validates the credential presented when a connection is opened.
 * <p>
 * Runs before the WebSocket upgrade: a failure creates no session state at all. On success the
 * user's stored status is set to online; that write is awaited (bounded by the store timeout)
 * so it lands before the connection goes live, but its failure is only logged.
 * </p>
 */
public class AuthenticationGate {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationGate.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final ChatStore store;

    public AuthenticationGate(TokenService tokenService, ChatStore store) {
        this.tokenService = tokenService;
        this.store = store;
    }

    /**
     * Authenticates an upgrade request, reading the token from the {@code token} query
     * parameter or an {@code Authorization: Bearer} header.
     */
    public Mono<String> authenticate(HttpServerRequest request) {
        return authenticate(extractToken(request.uri(), request.requestHeaders().get(HttpHeaderNames.AUTHORIZATION)));
    }

    /**
     * Authenticates a raw token.
     *
     * @return the user id, or an {@link AuthenticationException} error
     */
    public Mono<String> authenticate(String token) {
        return Mono.fromCallable(() -> tokenService.verify(token))
            .flatMap(userId -> store.setUserStatus(userId, UserStatus.ONLINE, null)
                .onErrorResume(err -> {
                    log.warn("Could not mark {} online in storage, continuing: {}", userId, err.toString());
                    return Mono.empty();
                })
                .thenReturn(userId))
            .doOnNext(userId -> log.debug("Authenticated user {}", userId))
            .doOnError(AuthenticationException.class, err -> log.info("Connection refused: {}", err.getMessage()));
    }

    static String extractToken(String uri, String authorizationHeader) {
        String fromQuery = Stream.ofNullable(new QueryStringDecoder(uri).parameters().get("token"))
            .flatMap(Collection::stream)
            .filter(value -> !value.isBlank())
            .findFirst()
            .orElse(null);
        if (fromQuery != null) {
            return fromQuery;
        }
        if (authorizationHeader != null && authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
