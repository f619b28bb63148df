package com.paxkun.pulldb.store;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque cursor holding the offset of the next row. Only stable while the underlying result set is.
 */
final class OffsetCursor {

    private static final String PREFIX = "offset:";

    private OffsetCursor() {
    }

    static String encode(int offset) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString((PREFIX + offset).getBytes(StandardCharsets.UTF_8));
    }

    static int decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return 0;
        }
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            if (!decoded.startsWith(PREFIX)) {
                throw new IllegalArgumentException("Unrecognised cursor: " + cursor);
            }
            int offset = Integer.parseInt(decoded.substring(PREFIX.length()));
            if (offset < 0) {
                throw new IllegalArgumentException("Negative cursor offset: " + cursor);
            }
            return offset;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed cursor: " + cursor, e);
        }
    }
}
