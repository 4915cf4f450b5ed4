package com.example.omnichat.service;

import com.example.omnichat.service.exception.ServiceException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;

/**
 * Keyset position {@code (timestamp, id)} of the last row of a page, encoded as url-safe base64 so
 * clients treat it as opaque.
 */
public record PageCursor(Instant timestamp, String id) {

    public static String encode(Instant timestamp, Object id) {
        String raw = timestamp.toEpochMilli() + ":" + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static PageCursor decode(String cursor) {
        if (!StringUtils.hasText(cursor)) {
            return null;
        }
        try {
            String raw = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            int separator = raw.indexOf(':');
            if (separator <= 0 || separator == raw.length() - 1) {
                throw invalid(cursor);
            }
            long millis = Long.parseLong(raw.substring(0, separator));
            return new PageCursor(Instant.ofEpochMilli(millis), raw.substring(separator + 1));
        } catch (IllegalArgumentException ex) {
            throw invalid(cursor);
        }
    }

    public long numericId() {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException ex) {
            throw invalid(id);
        }
    }

    private static ServiceException invalid(String cursor) {
        return new ServiceException(HttpStatus.BAD_REQUEST, "Invalid cursor " + cursor, "invalid_cursor");
    }
}
