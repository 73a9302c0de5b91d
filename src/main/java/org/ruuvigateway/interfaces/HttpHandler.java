package org.ruuvigateway.interfaces;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;
import org.ruuvigateway.http.RawHttpResponse;

/**
 * Wire-level HTTP/1.1 formatting and parsing.
 * No gateway or domain logic.
 */
public interface HttpHandler {

    int OK = 200;
    int UNAUTHORIZED = 401;
    int STATUS_UNKNOWN = -1;

    /** Build full HTTP/1.1 request headers (no body). */
    String buildRequest(String method,
                        String path,
                        String authority,
                        Map<String, String> extraHeaders,
                        int contentLength);

    /** Send prepared request headers and optional body. */
    void send(OutputStream out, String requestHeaders, byte[] body) throws IOException;

    /**
     * Split a complete raw response (as read until the server closed the connection)
     * into status, headers and decoded body.
     *
     * @throws IOException if a chunked body is malformed
     */
    RawHttpResponse parseResponse(byte[] raw) throws IOException;
}
