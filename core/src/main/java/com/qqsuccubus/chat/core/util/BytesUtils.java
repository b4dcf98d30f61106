package com.qqsuccubus.chat.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * Size of a text frame payload on the wire (UTF-8 bytes).
     */
    public static long utf8Length(String str) {
        return str == null ? 0 : str.getBytes(StandardCharsets.UTF_8).length;
    }
}
