package com.qqsuccubus.chat.core.msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Universal JSON text frame exchanged over the WebSocket in both directions.
 * <p>
 * Wire shape: {@code {"event": "send_message", "data": {...}}}. Outbound frames carry one of
 * the {@link ChatEvents} payloads (or a {@code ChatMessage}) in {@code data}; inbound frames
 * are decoded with {@code data} as a generic JSON tree and converted once the event name is
 * known.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Frame {
    /**
     * Event name, see {@link EventNames}.
     */
    String event;

    /**
     * Event payload.
     */
    Object data;

    public static Frame of(String event, Object data) {
        return new Frame(event, data);
    }
}
