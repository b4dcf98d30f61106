package com.qqsuccubus.chat.socket.error;

/**
 * An inbound event is malformed or targets a chat the sender is not subscribed to.
 */
public class ValidationException extends ChatException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "validation";
    }
}
