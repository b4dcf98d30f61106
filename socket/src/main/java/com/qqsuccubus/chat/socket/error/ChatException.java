package com.qqsuccubus.chat.socket.error;

/**
 * Base of the failures a chat node reports to clients.
 * <p>
 * The message of a {@code ChatException} is safe to show to the client; causes are only logged.
 * </p>
 */
public abstract class ChatException extends RuntimeException {

    protected ChatException(String message) {
        super(message);
    }

    protected ChatException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable category, used as a metrics tag.
     */
    public abstract String reason();
}
