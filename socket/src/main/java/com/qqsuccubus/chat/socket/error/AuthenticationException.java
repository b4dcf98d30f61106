package com.qqsuccubus.chat.socket.error;

/**
 * The credential presented when opening a connection is missing, malformed, badly signed or
 * expired. The connection is refused before any state is created.
 */
public class AuthenticationException extends ChatException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "auth";
    }
}
