package com.qqsuccubus.chat.socket.router;

import com.qqsuccubus.chat.core.metrics.MetricsNames;
import com.qqsuccubus.chat.core.metrics.MetricsTags;
import com.qqsuccubus.chat.core.model.ChatMessage;
import com.qqsuccubus.chat.core.model.ChatRoom;
import com.qqsuccubus.chat.core.model.UserProfile;
import com.qqsuccubus.chat.core.model.UserStatus;
import com.qqsuccubus.chat.core.msg.ChatEvents;
import com.qqsuccubus.chat.core.msg.EventNames;
import com.qqsuccubus.chat.core.msg.Frame;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.session.Connection;
import com.qqsuccubus.chat.socket.session.ConnectionFactory;
import com.qqsuccubus.chat.socket.session.FrameRecorder;
import com.qqsuccubus.chat.socket.session.SessionRegistry;
import com.qqsuccubus.chat.socket.store.FlakyChatStore;
import com.qqsuccubus.chat.socket.store.InMemoryChatStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventRouterTest {

    private InMemoryChatStore memoryStore;
    private FlakyChatStore store;
    private SessionRegistry registry;
    private SimpleMeterRegistry meterRegistry;
    private EventRouter router;
    private ConnectionFactory factory;

    @BeforeEach
    void setUp() {
        memoryStore = new InMemoryChatStore()
                .putUser(UserProfile.builder().id("alice").name("Alice").avatar("alice.png").build())
                .putUser(UserProfile.builder().id("bob").name("Bob").build())
                .putUser(UserProfile.builder().id("carol").name("Carol").build())
                .putChat(ChatRoom.builder().id("chat1").participant("alice").participant("bob").build())
                .putChat(ChatRoom.builder().id("group1").group(true).groupName("team")
                        .participant("alice").participant("bob").participant("carol").build());
        store = new FlakyChatStore(memoryStore);
        registry = new SessionRegistry();
        meterRegistry = new SimpleMeterRegistry();
        MetricsService metrics = new MetricsService(meterRegistry, SocketConfig.builder().nodeId("test-node").build());
        router = new EventRouter(registry, store, metrics);
        factory = new ConnectionFactory(64, Clock.systemUTC());
    }

    @Test
    @DisplayName("A message reaches every subscribed connection, sender's devices included, and is stored once")
    void testSendMessage_FanOutToAllSubscribers() {
        Connection alicePhone = connect("alice", "chat1", "group1");
        Connection aliceLaptop = connect("alice", "chat1", "group1");
        Connection bob = connect("bob", "chat1", "group1");
        Connection carol = connect("carol", "group1");
        FrameRecorder phone = FrameRecorder.attach(alicePhone);
        FrameRecorder laptop = FrameRecorder.attach(aliceLaptop);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        FrameRecorder carolFrames = FrameRecorder.attach(carol);

        StepVerifier.create(router.handleInbound(alicePhone,
                        "{\"event\":\"send_message\",\"data\":{\"content\":\"hello team\",\"chatId\":\"group1\"}}"))
                .verifyComplete();

        assertEquals(1, phone.ofEvent(EventNames.NEW_MESSAGE).size());
        assertEquals(1, laptop.ofEvent(EventNames.NEW_MESSAGE).size());
        assertEquals(1, bobFrames.ofEvent(EventNames.NEW_MESSAGE).size());
        assertEquals(1, carolFrames.ofEvent(EventNames.NEW_MESSAGE).size());
        assertEquals(4.0, deliveries(EventNames.NEW_MESSAGE));

        List<ChatMessage> stored = memoryStore.messagesIn("group1");
        assertEquals(1, stored.size());
        assertEquals(stored.get(0).getId(), memoryStore.chat("group1").orElseThrow().getLastMessageId());
    }

    @Test
    @DisplayName("B receives A's message in their direct chat with A's public profile")
    void testDirectChatScenario() {
        Connection alice = connect("alice", "chat1", "group1");
        Connection bob = connect("bob", "chat1", "group1");
        Connection carol = connect("carol", "group1");
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        FrameRecorder carolFrames = FrameRecorder.attach(carol);

        router.handleInbound(alice, "{\"event\":\"send_message\",\"data\":{\"content\":\"hi\",\"chatId\":\"chat1\"}}")
                .block();

        List<Frame> received = bobFrames.ofEvent(EventNames.NEW_MESSAGE);
        assertEquals(1, received.size());
        ChatMessage message = assertInstanceOf(ChatMessage.class, received.get(0).getData());
        assertEquals("hi", message.getContent());
        assertEquals("chat1", message.getChatId());
        assertEquals("alice", message.getSender().getId());
        assertEquals("Alice", message.getSender().getName());
        assertEquals("alice.png", message.getSender().getAvatar());
        assertFalse(message.isRead());
        assertTrue(carolFrames.all().isEmpty(), "non-members must not see the message");
    }

    @Test
    @DisplayName("Typing is relayed to other members but never echoed to the typist")
    void testTyping_ExcludesOriginator() {
        Connection alice = connect("alice", "chat1");
        Connection aliceOther = connect("alice", "chat1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder aliceOtherFrames = FrameRecorder.attach(aliceOther);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);

        router.handleInbound(alice, "{\"event\":\"typing\",\"data\":{\"chatId\":\"chat1\",\"isTyping\":true}}").block();

        assertTrue(aliceFrames.all().isEmpty());
        assertEquals(1, aliceOtherFrames.ofEvent(EventNames.TYPING).size());
        List<Frame> received = bobFrames.ofEvent(EventNames.TYPING);
        assertEquals(1, received.size());
        ChatEvents.Typing typing = (ChatEvents.Typing) received.get(0).getData();
        assertEquals("chat1", typing.getChatId());
        assertEquals(Boolean.TRUE, typing.getTyping());
    }

    @Test
    void testTyping_MissingFlagRejected() {
        Connection alice = connect("alice", "chat1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);

        router.handleInbound(alice, "{\"event\":\"typing\",\"data\":{\"chatId\":\"chat1\"}}").block();

        assertEquals(1, aliceFrames.ofEvent(EventNames.ERROR).size());
        assertTrue(bobFrames.all().isEmpty());
    }

    @Test
    @DisplayName("Read receipt marks foreign unread messages and notifies everyone but the reader")
    void testReadMessage() {
        memoryStore.createMessage("alice", "chat1", "one").block();
        memoryStore.createMessage("alice", "chat1", "two").block();
        memoryStore.createMessage("bob", "chat1", "mine").block();
        Connection alice = connect("alice", "chat1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);

        router.handleInbound(bob, "{\"event\":\"read_message\",\"data\":{\"chatId\":\"chat1\"}}").block();

        List<Frame> receipts = aliceFrames.ofEvent(EventNames.MESSAGES_READ);
        assertEquals(1, receipts.size());
        ChatEvents.MessagesRead receipt = (ChatEvents.MessagesRead) receipts.get(0).getData();
        assertEquals("chat1", receipt.getChatId());
        assertEquals("bob", receipt.getUserId());
        assertTrue(bobFrames.all().isEmpty());

        List<ChatMessage> messages = memoryStore.messagesIn("chat1");
        assertTrue(messages.get(0).isRead());
        assertTrue(messages.get(1).isRead());
        assertFalse(messages.get(2).isRead());

        StepVerifier.create(memoryStore.markMessagesRead("chat1", "bob"))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    @DisplayName("Events for chats the connection is not subscribed to are rejected")
    void testNotSubscribed_Rejected() {
        Connection carol = connect("carol", "group1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder carolFrames = FrameRecorder.attach(carol);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);

        router.handleInbound(carol, "{\"event\":\"send_message\",\"data\":{\"content\":\"sneaky\",\"chatId\":\"chat1\"}}")
                .block();

        assertEquals("Not a participant of chat chat1", errorMessage(carolFrames));
        assertTrue(bobFrames.all().isEmpty());
        assertEquals(0, store.createMessageCalls.get());
    }

    @Test
    void testEmptyContent_Rejected() {
        Connection alice = connect("alice", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);

        router.handleInbound(alice, "{\"event\":\"send_message\",\"data\":{\"content\":\"   \",\"chatId\":\"chat1\"}}")
                .block();

        assertEquals("Message content must not be empty", errorMessage(aliceFrames));
        assertEquals(0, store.createMessageCalls.get());
        assertEquals(1.0, eventErrors("validation"));
    }

    @Test
    @DisplayName("Malformed frames and unknown events produce an error for the originator only")
    void testMalformedAndUnknown() {
        Connection alice = connect("alice", "chat1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);

        StepVerifier.create(router.handleInbound(alice, "{not json")).verifyComplete();
        StepVerifier.create(router.handleInbound(alice, "{\"data\":{}}")).verifyComplete();
        StepVerifier.create(router.handleInbound(alice, "{\"event\":\"dance\",\"data\":{}}")).verifyComplete();
        StepVerifier.create(router.handleInbound(alice, "{\"event\":\"send_message\",\"data\":\"oops\"}")).verifyComplete();
        StepVerifier.create(router.handleInbound(alice, "{\"event\":\"read_message\"}")).verifyComplete();

        assertEquals(5, aliceFrames.ofEvent(EventNames.ERROR).size());
        assertTrue(bobFrames.all().isEmpty());
    }

    @Test
    void testPing_NoReply() {
        Connection alice = connect("alice", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);

        router.handleInbound(alice, "{\"event\":\"ping\"}").block();

        assertTrue(aliceFrames.all().isEmpty());
    }

    @Test
    @DisplayName("A failed write is reported to the sender and nothing is fanned out")
    void testPersistenceFailure() {
        store.failCreateMessage = true;
        Connection alice = connect("alice", "chat1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);

        StepVerifier.create(router.handleInbound(alice,
                        "{\"event\":\"send_message\",\"data\":{\"content\":\"hi\",\"chatId\":\"chat1\"}}"))
                .verifyComplete();

        assertEquals("Failed to send message", errorMessage(aliceFrames));
        assertTrue(bobFrames.all().isEmpty());
        assertEquals(1.0, eventErrors("persistence"));
    }

    @Test
    void testReadFailure() {
        store.failMarkMessagesRead = true;
        Connection alice = connect("alice", "chat1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);

        router.handleInbound(bob, "{\"event\":\"read_message\",\"data\":{\"chatId\":\"chat1\"}}").block();

        assertEquals("Failed to mark messages as read", errorMessage(bobFrames));
        assertTrue(aliceFrames.all().isEmpty());
    }

    @Test
    @DisplayName("A stored message is delivered even if the last-message pointer cannot be updated")
    void testLastMessagePointerFailure_StillDelivered() {
        store.failSetRoomLastMessage = true;
        Connection alice = connect("alice", "chat1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);

        router.handleInbound(alice, "{\"event\":\"send_message\",\"data\":{\"content\":\"hi\",\"chatId\":\"chat1\"}}")
                .block();

        assertEquals(1, bobFrames.ofEvent(EventNames.NEW_MESSAGE).size());
        assertTrue(aliceFrames.ofEvent(EventNames.ERROR).isEmpty());
        assertNull(memoryStore.chat("chat1").orElseThrow().getLastMessageId());
        assertEquals(1.0, meterRegistry.get(MetricsNames.STORE_INCONSISTENCY_TOTAL).counter().count());
    }

    @Test
    @DisplayName("A closed connection in the room does not abort delivery to the others")
    void testClosedConnection_CountedAsDrop() {
        Connection alice = connect("alice", "chat1");
        Connection bobGone = connect("bob", "chat1");
        Connection bob = connect("bob", "chat1");
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        bobGone.close();

        int delivered = router.broadcastToRoom("chat1", Frame.of(EventNames.TYPING, new ChatEvents.Typing("chat1", true)), alice);

        assertEquals(1, delivered);
        assertEquals(1, bobFrames.ofEvent(EventNames.TYPING).size());
        assertEquals(1.0, meterRegistry.get(MetricsNames.DROPS_TOTAL).tag(MetricsTags.REASON, "closed").counter().count());
    }

    @Test
    @DisplayName("Presence goes to every live connection regardless of rooms")
    void testPublishPresence_Global() {
        Connection bob = connect("bob", "chat1");
        Connection carol = connect("carol");
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        FrameRecorder carolFrames = FrameRecorder.attach(carol);

        assertEquals(2, router.publishPresence("alice", UserStatus.ONLINE));

        ChatEvents.UserStatusChange change =
                (ChatEvents.UserStatusChange) carolFrames.ofEvent(EventNames.USER_STATUS).get(0).getData();
        assertEquals("alice", change.getUserId());
        assertEquals(UserStatus.ONLINE, change.getStatus());
        assertEquals(1, bobFrames.ofEvent(EventNames.USER_STATUS).size());
    }

    private Connection connect(String userId, String... rooms) {
        Connection connection = factory.create(userId);
        registry.register(userId, connection);
        registry.subscribe(connection, Set.of(rooms));
        return connection;
    }

    private static String errorMessage(FrameRecorder recorder) {
        List<Frame> errors = recorder.ofEvent(EventNames.ERROR);
        assertEquals(1, errors.size());
        return ((ChatEvents.ErrorNotice) errors.get(0).getData()).getMessage();
    }

    private double deliveries(String event) {
        return meterRegistry.get(MetricsNames.DELIVERIES_TOTAL).tag(MetricsTags.EVENT, event).counter().count();
    }

    private double eventErrors(String reason) {
        return meterRegistry.get(MetricsNames.EVENT_ERRORS_TOTAL).tag(MetricsTags.REASON, reason).counter().count();
    }
}
