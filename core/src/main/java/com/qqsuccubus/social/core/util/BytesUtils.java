package com.qqsuccubus.social.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * UTF-8 payload size of a text frame, used for traffic metrics.
     */
    public static long getBytesLength(String str) {
        return str == null ? 0 : str.getBytes(StandardCharsets.UTF_8).length;
    }

}
