package com.qqsuccubus.chat.socket.presence;

import com.qqsuccubus.chat.core.model.UserStatus;
import com.qqsuccubus.chat.socket.router.EventRouter;
import com.qqsuccubus.chat.socket.session.ISessionRegistry;
import com.qqsuccubus.chat.socket.session.PresenceTransition;
import com.qqsuccubus.chat.socket.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns registry transitions into presence broadcasts.
 * <p>
 * A user is online while at least one connection is registered. A transition only triggers an
 * announcement; what gets announced is read from the registry at that moment and compared with
 * the last status announced for the user. Announcements of one user are serialized on its entry,
 * so an {@code offline} triggered by an old connection can never follow the {@code online} of a
 * newer one, and a reconnect that happens before the old connection's offline is announced is
 * not announced at all.
 * </p>
 * <p>
 * Going offline also records {@code lastSeen}. The write is fire-and-forget: the broadcast does
 * not wait for it.
 * </p>
 */
public class PresenceTracker {
    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    private final EventRouter eventRouter;
    private final ISessionRegistry sessionRegistry;
    private final ChatStore store;
    private final Clock clock;

    // userId -> ONLINE while an online announcement is the latest one; absent otherwise
    private final Map<String, UserStatus> announced = new ConcurrentHashMap<>();

    public PresenceTracker(EventRouter eventRouter, ISessionRegistry sessionRegistry, ChatStore store, Clock clock) {
        this.eventRouter = eventRouter;
        this.sessionRegistry = sessionRegistry;
        this.store = store;
        this.clock = clock;
    }

    public void onRegistered(String userId, PresenceTransition transition) {
        if (transition == PresenceTransition.CAME_ONLINE) {
            announce(userId);
        }
    }

    /**
     * @return handle of the background lastSeen write, or null if no offline was announced
     */
    public Disposable onUnregistered(String userId, PresenceTransition transition) {
        if (transition != PresenceTransition.WENT_OFFLINE || announce(userId) != UserStatus.OFFLINE) {
            return null;
        }
        Instant lastSeen = clock.instant();
        return store.setUserStatus(userId, UserStatus.OFFLINE, lastSeen)
                .subscribe(
                        unused -> log.debug("Recorded lastSeen={} for {}", lastSeen, userId),
                        err -> log.warn("Failed to record lastSeen for {}: {}", userId, err.toString())
                );
    }

    /**
     * @return the status broadcast by this call, or null if observers are already up to date
     */
    private UserStatus announce(String userId) {
        AtomicReference<UserStatus> published = new AtomicReference<>();

        announced.compute(userId, (key, previous) -> {
            boolean online = sessionRegistry.isOnline(userId);
            if (online && previous == null) {
                published.set(UserStatus.ONLINE);
            } else if (!online && previous != null) {
                published.set(UserStatus.OFFLINE);
            } else {
                return previous;
            }
            log.info("User {} is {}", userId, published.get().wireName());
            eventRouter.publishPresence(userId, published.get());
            return online ? UserStatus.ONLINE : null;
        });

        UserStatus status = published.get();
        if (status == null) {
            log.debug("Presence of {} unchanged, nothing to announce", userId);
        }
        return status;
    }
}
