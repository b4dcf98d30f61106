package com.qqsuccubus.chat.socket.error;

/**
 * A storage call failed or timed out while processing an event.
 */
public class PersistenceException extends ChatException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "persistence";
    }
}
