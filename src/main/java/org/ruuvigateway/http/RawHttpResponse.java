package org.ruuvigateway.http;

import java.util.Locale;
import java.util.Map;

/**
 * Parsed HTTP response.
 *
 * @param status  numeric status code, or {@code -1} when the status line was unreadable
 * @param headers header map with lower-cased names
 * @param body    decoded body as UTF-8 text (de-chunked when needed)
 */
public record RawHttpResponse(int status, Map<String, String> headers, String body) {

    public RawHttpResponse {
        headers = Map.copyOf(headers);
        body = (body == null) ? "" : body;
    }

    /** Case-insensitive header lookup; null when absent. */
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
