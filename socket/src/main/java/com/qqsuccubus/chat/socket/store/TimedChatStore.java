package com.qqsuccubus.chat.socket.store;

import com.qqsuccubus.chat.core.model.ChatMessage;
import com.qqsuccubus.chat.core.model.UserStatus;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Decorator bounding every storage call with a timeout and recording its latency.
 * <p>
 * One slow call fails with a {@link java.util.concurrent.TimeoutException} after
 * {@code timeout} instead of stalling the connection that issued it.
 * </p>
 */
public class TimedChatStore implements ChatStore {

    private final ChatStore delegate;
    private final Duration timeout;
    private final MetricsService metricsService;

    public TimedChatStore(ChatStore delegate, Duration timeout, MetricsService metricsService) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.metricsService = metricsService;
    }

    @Override
    public Mono<Set<String>> findRoomsForUser(String userId) {
        return timed("findRoomsForUser", delegate.findRoomsForUser(userId));
    }

    @Override
    public Mono<ChatMessage> createMessage(String senderId, String chatId, String content) {
        return timed("createMessage", delegate.createMessage(senderId, chatId, content));
    }

    @Override
    public Mono<Void> setRoomLastMessage(String chatId, String messageId) {
        return timed("setRoomLastMessage", delegate.setRoomLastMessage(chatId, messageId));
    }

    @Override
    public Mono<Long> markMessagesRead(String chatId, String readerId) {
        return timed("markMessagesRead", delegate.markMessagesRead(chatId, readerId));
    }

    @Override
    public Mono<Void> setUserStatus(String userId, UserStatus status, Instant lastSeen) {
        return timed("setUserStatus", delegate.setUserStatus(userId, status, lastSeen));
    }

    @Override
    public Mono<Void> ping() {
        return timed("ping", delegate.ping());
    }

    @Override
    public void close() {
        delegate.close();
    }

    private <T> Mono<T> timed(String operation, Mono<T> call) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return call.timeout(timeout)
                .doOnSuccess(v -> metricsService.recordStoreLatency(operation, start, true))
                .doOnError(err -> metricsService.recordStoreLatency(operation, start, false));
        });
    }
}
